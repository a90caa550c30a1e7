package com.delta.adinsights.search.model;

import java.util.List;

public record DispatchOutcome(List<DomainResult> succeeded, List<DomainFailure> failed) {
    public DispatchOutcome {
        succeeded = succeeded == null ? List.of() : List.copyOf(succeeded);
        failed = failed == null ? List.of() : List.copyOf(failed);
    }

    public int attempted() {
        return succeeded.size() + failed.size();
    }
}
