package com.delta.adinsights.search.model;

public record PreviewImage(String url, Integer width, Integer height) {
}
