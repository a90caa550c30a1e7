package com.delta.adinsights.search.model;

import java.util.List;

/**
 * Keyphrase clusters for one domain or for a merged search. A non-null {@code error} means the
 * provider could not cluster; the set is then degraded data, not a failure.
 */
public record ClusterSet(
    List<Cluster> clusters,
    List<PhraseInfo> unclustered,
    int totalPhrases,
    String error
) {
    public ClusterSet {
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
        unclustered = unclustered == null ? List.of() : List.copyOf(unclustered);
        totalPhrases = Math.max(0, totalPhrases);
    }
}
