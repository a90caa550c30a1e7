package com.delta.adinsights.search.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class DomainNormalizer {

    private DomainNormalizer() {
    }

    /**
     * Canonical form of a user-entered domain: lowercased and trimmed, without scheme,
     * trailing slash or {@code www.} prefix. Blank input yields an empty string.
     *
     * <p>The stripping steps repeat until nothing changes, so the result is always a fixed point:
     * {@code normalize(normalize(x)).equals(normalize(x))}.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String current = raw;
        while (true) {
            String next = stripOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    /**
     * Normalizes every candidate, dropping empty values and duplicates while keeping the order
     * in which each domain was first seen.
     */
    public static List<String> normalizeAll(Collection<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String candidate : candidates) {
            String normalized = normalize(candidate);
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return new ArrayList<>(out);
    }

    private static String stripOnce(String value) {
        String domain = value.trim().toLowerCase(Locale.ROOT);
        if (domain.startsWith("https://")) {
            domain = domain.substring("https://".length());
        } else if (domain.startsWith("http://")) {
            domain = domain.substring("http://".length());
        }
        if (domain.endsWith("/")) {
            domain = domain.substring(0, domain.length() - 1);
        }
        if (domain.startsWith("www.")) {
            domain = domain.substring("www.".length());
        }
        return domain;
    }
}
