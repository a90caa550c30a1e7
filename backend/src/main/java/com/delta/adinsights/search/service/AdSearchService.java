package com.delta.adinsights.search.service;

import com.delta.adinsights.config.SearchProperties;
import com.delta.adinsights.search.model.ClusteringMode;
import com.delta.adinsights.search.model.CombinedResult;
import com.delta.adinsights.search.model.DispatchOutcome;
import com.delta.adinsights.search.model.DomainFailure;
import com.delta.adinsights.search.model.LanguagesResponse;
import com.delta.adinsights.search.model.LocationsResponse;
import com.delta.adinsights.search.model.SearchParams;
import com.delta.adinsights.search.model.SearchRequest;
import com.delta.adinsights.search.provider.AdProviderClient;
import com.delta.adinsights.search.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Entry point for multi-domain ad searches. Stateless: every call performs a fresh fan-out and
 * returns a new {@link CombinedResult}.
 */
@Service
public class AdSearchService {
    private static final Logger log = LoggerFactory.getLogger(AdSearchService.class);

    private final SearchProperties properties;
    private final FanOutOrchestrator orchestrator;
    private final ResultCombiner combiner;
    private final AdProviderClient providerClient;

    public AdSearchService(
        SearchProperties properties,
        FanOutOrchestrator orchestrator,
        ResultCombiner combiner,
        AdProviderClient providerClient
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.combiner = combiner;
        this.providerClient = providerClient;
    }

    /**
     * @throws SearchValidationException when no usable domain remains after normalization or
     *     more than {@code search.max-domains} remain
     * @throws AllDomainsFailedException when no domain returned data
     */
    public CombinedResult search(SearchRequest request) {
        List<String> domains = request == null ? List.of() : request.normalizedDomains();
        if (domains.isEmpty()) {
            throw new SearchValidationException("Please enter at least one domain");
        }
        int maxDomains = properties.getMaxDomains();
        if (domains.size() > maxDomains) {
            throw new SearchValidationException(
                "Too many domains: " + domains.size() + " requested, at most " + maxDomains + " allowed"
            );
        }
        SearchParams params = resolveParams(request);
        ClusteringMode mode = properties.getClusteringMode();

        CombinedResult result = mode == ClusteringMode.UNIFIED
            ? searchUnified(domains, params)
            : searchPerDomain(domains, params);

        log.info(
            "Ad search mode={} requested={} succeeded={} failed={} ads={} clusters={}",
            mode,
            domains.size(),
            result.domains().size(),
            result.failedDomains().size(),
            result.adsCount(),
            result.clustering() == null ? "none" : result.clustering().clusters().size()
        );
        return result;
    }

    public LocationsResponse locations() {
        return new LocationsResponse(providerClient.fetchLocations());
    }

    public LanguagesResponse languages() {
        return new LanguagesResponse(providerClient.fetchLanguages());
    }

    private CombinedResult searchPerDomain(List<String> domains, SearchParams params) {
        DispatchOutcome outcome = orchestrator.dispatch(domains, params);
        return combiner.combine(outcome);
    }

    private CombinedResult searchUnified(List<String> domains, SearchParams params) {
        CombinedResult unified;
        try {
            unified = providerClient.fetchUnified(domains, params.depth(), params.locationCode(), params.language());
        } catch (ProviderException e) {
            log.warn("Unified provider call failed for {} domains (status={}): {}",
                domains.size(), e.getStatusCode(), e.getMessage());
            List<DomainFailure> failures = new ArrayList<>(domains.size());
            for (String domain : domains) {
                failures.add(new DomainFailure(domain, e.getStatusCode(), e.getMessage()));
            }
            throw new AllDomainsFailedException(failures);
        }
        return combiner.passThrough(unified, domains.size());
    }

    SearchParams resolveParams(SearchRequest request) {
        SearchProperties.Defaults defaults = properties.getDefaults();
        int maxDepth = properties.getProvider().getMaxDepth();
        int depth = request.depth() == null ? defaults.getDepth() : request.depth();
        depth = Math.max(1, Math.min(depth, maxDepth));
        int locationCode = request.locationCode() == null
            ? defaults.getLocationCode()
            : Math.max(1, request.locationCode());
        String language = normalizeLanguage(request.language());
        if (language == null) {
            language = normalizeLanguage(defaults.getLanguage());
        }
        return new SearchParams(depth, locationCode, language);
    }

    private static String normalizeLanguage(String language) {
        if (language == null || language.isBlank()) {
            return null;
        }
        return language.trim().toLowerCase(Locale.ROOT);
    }
}
