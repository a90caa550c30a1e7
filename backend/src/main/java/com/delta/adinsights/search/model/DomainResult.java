package com.delta.adinsights.search.model;

import java.util.List;

/**
 * Provider answer for one domain. {@code clustering} is {@code null} when the provider
 * returned no cluster data at all, which is distinct from an empty {@link ClusterSet}.
 */
public record DomainResult(String domain, List<AdRecord> ads, ClusterSet clustering) {
    public DomainResult {
        ads = ads == null ? List.of() : List.copyOf(ads);
    }
}
