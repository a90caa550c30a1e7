package com.delta.adinsights.search.model;

import java.util.List;

/**
 * A named group of related keyphrases. {@code size} always equals {@code phrases.size()}.
 */
public record Cluster(int id, String name, int size, List<PhraseInfo> phrases) {
    public Cluster {
        phrases = phrases == null ? List.of() : List.copyOf(phrases);
        if (size != phrases.size()) {
            throw new IllegalArgumentException(
                "Cluster " + id + " size " + size + " does not match " + phrases.size() + " phrases"
            );
        }
    }

    public Cluster(int id, String name, List<PhraseInfo> phrases) {
        this(id, name, phrases == null ? 0 : phrases.size(), phrases);
    }

    public Cluster withId(int newId) {
        return new Cluster(newId, name, size, phrases);
    }
}
