package com.delta.adinsights.search.service;

import com.delta.adinsights.search.model.DomainFailure;

import java.util.List;

/**
 * Every domain of a search failed. Carries one user-facing message; the individual failures
 * stay available through {@link #getFailures()}.
 */
public class AllDomainsFailedException extends RuntimeException {
    private final List<DomainFailure> failures;

    public AllDomainsFailedException(List<DomainFailure> failures) {
        super(buildMessage(failures));
        this.failures = List.copyOf(failures);
    }

    public List<DomainFailure> getFailures() {
        return failures;
    }

    private static String buildMessage(List<DomainFailure> failures) {
        String base = "Failed to fetch ads for all " + failures.size() + " requested domain(s)";
        if (failures.isEmpty() || failures.get(0).message() == null) {
            return base;
        }
        return base + ": " + failures.get(0).message();
    }
}
