package com.delta.adinsights.search.model;

import java.util.List;

/**
 * Aggregate answer of one search.
 *
 * <p>{@code domains} lists only the domains that returned data, in submission order.
 * {@code clustering} is {@code null} when no domain produced cluster data.
 * {@code requestedDomains} and {@code failedDomains} describe partial failure so callers can
 * tell how many of the requested domains are represented.
 */
public record CombinedResult(
    List<String> domains,
    int adsCount,
    List<AdRecord> ads,
    ClusterSet clustering,
    int requestedDomains,
    List<DomainFailure> failedDomains
) {
    public CombinedResult {
        domains = domains == null ? List.of() : List.copyOf(domains);
        ads = ads == null ? List.of() : List.copyOf(ads);
        failedDomains = failedDomains == null ? List.of() : List.copyOf(failedDomains);
        if (adsCount != ads.size()) {
            throw new IllegalArgumentException("adsCount " + adsCount + " does not match " + ads.size() + " ads");
        }
    }

    public boolean partial() {
        return !failedDomains.isEmpty();
    }
}
