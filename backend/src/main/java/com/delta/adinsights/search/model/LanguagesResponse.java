package com.delta.adinsights.search.model;

import java.util.List;

public record LanguagesResponse(List<Language> languages) {
}
