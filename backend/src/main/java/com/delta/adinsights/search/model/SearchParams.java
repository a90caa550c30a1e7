package com.delta.adinsights.search.model;

/**
 * Resolved per-domain query parameters shared by every call of one search.
 */
public record SearchParams(int depth, int locationCode, String language) {
}
