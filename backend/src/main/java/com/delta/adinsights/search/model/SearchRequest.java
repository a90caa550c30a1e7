package com.delta.adinsights.search.model;

import com.delta.adinsights.search.util.DomainNormalizer;

import java.util.List;

public record SearchRequest(
    List<String> domains,
    Integer depth,
    Integer locationCode,
    String language
) {
    public List<String> normalizedDomains() {
        if (domains == null) {
            return List.of();
        }
        return DomainNormalizer.normalizeAll(domains);
    }
}
