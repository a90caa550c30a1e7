package com.delta.adinsights.search.service;

import com.delta.adinsights.search.model.AdRecord;
import com.delta.adinsights.search.model.Cluster;
import com.delta.adinsights.search.model.ClusterSet;
import com.delta.adinsights.search.model.CombinedResult;
import com.delta.adinsights.search.model.DispatchOutcome;
import com.delta.adinsights.search.model.DomainFailure;
import com.delta.adinsights.search.model.DomainResult;
import com.delta.adinsights.search.model.PhraseInfo;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class ResultCombiner {

    public CombinedResult combine(DispatchOutcome outcome) {
        return combine(outcome.succeeded(), outcome.failed(), outcome.attempted());
    }

    public CombinedResult combine(List<DomainResult> succeeded) {
        return combine(succeeded, List.of(), succeeded == null ? 0 : succeeded.size());
    }

    /**
     * Concatenates ads in the given domain order and merges the per-domain cluster sets.
     *
     * @throws IllegalArgumentException if {@code succeeded} is empty
     */
    public CombinedResult combine(List<DomainResult> succeeded, List<DomainFailure> failed, int requestedDomains) {
        if (succeeded == null || succeeded.isEmpty()) {
            throw new IllegalArgumentException("combine requires at least one successful domain result");
        }
        List<String> domains = new ArrayList<>(succeeded.size());
        List<AdRecord> ads = new ArrayList<>();
        for (DomainResult result : succeeded) {
            domains.add(result.domain());
            ads.addAll(result.ads());
        }
        return new CombinedResult(
            domains,
            ads.size(),
            ads,
            mergeClusters(succeeded),
            Math.max(requestedDomains, succeeded.size()),
            failed
        );
    }

    /**
     * Merges per-domain cluster sets into one whose ids are the dense range {@code 0..N-1},
     * ordered by cluster size descending. Equal sizes keep their append order. Returns
     * {@code null} when no domain carried cluster data.
     */
    public ClusterSet mergeClusters(List<DomainResult> succeeded) {
        List<Cluster> merged = new ArrayList<>();
        List<PhraseInfo> unclustered = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int totalPhrases = 0;
        boolean anyClustering = false;

        for (DomainResult result : succeeded) {
            ClusterSet clustering = result.clustering();
            if (clustering == null) {
                continue;
            }
            anyClustering = true;
            int offset = merged.size();
            for (Cluster cluster : clustering.clusters()) {
                merged.add(cluster.withId(cluster.id() + offset));
            }
            unclustered.addAll(clustering.unclustered());
            totalPhrases += clustering.totalPhrases();
            if (clustering.error() != null && !clustering.error().isBlank()) {
                errors.add(result.domain() + ": " + clustering.error());
            }
        }
        if (!anyClustering) {
            return null;
        }

        // List.sort is stable
        merged.sort(Comparator.comparingInt(Cluster::size).reversed());
        List<Cluster> reassigned = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            reassigned.add(merged.get(i).withId(i));
        }
        return new ClusterSet(
            reassigned,
            unclustered,
            totalPhrases,
            errors.isEmpty() ? null : String.join("; ", errors)
        );
    }

    /**
     * Provider-unified results already carry one cluster set; only the ad count is re-derived.
     */
    public CombinedResult passThrough(CombinedResult unified, int requestedDomains) {
        return new CombinedResult(
            unified.domains(),
            unified.ads().size(),
            unified.ads(),
            unified.clustering(),
            Math.max(requestedDomains, unified.domains().size()),
            unified.failedDomains()
        );
    }
}
