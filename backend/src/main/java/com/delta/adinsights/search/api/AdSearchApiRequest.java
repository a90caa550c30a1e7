package com.delta.adinsights.search.api;

import java.util.List;

public record AdSearchApiRequest(
    List<String> domains,
    Integer depth,
    Integer locationCode,
    String language
) {
}
