package com.delta.adinsights.search.model;

import java.util.List;

public record AdTextContent(
    String headline,
    String description,
    List<String> sitelinks,
    String rawText,
    List<String> keyphrases,
    String detectedLanguage,
    String error
) {
    public AdTextContent {
        sitelinks = sitelinks == null ? List.of() : List.copyOf(sitelinks);
        keyphrases = keyphrases == null ? List.of() : List.copyOf(keyphrases);
    }
}
