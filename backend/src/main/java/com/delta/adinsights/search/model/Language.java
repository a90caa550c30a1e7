package com.delta.adinsights.search.model;

public record Language(String code, String name) {
}
