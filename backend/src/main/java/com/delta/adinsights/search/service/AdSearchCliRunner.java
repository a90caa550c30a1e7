package com.delta.adinsights.search.service;

import com.delta.adinsights.config.SearchProperties;
import com.delta.adinsights.search.model.Cluster;
import com.delta.adinsights.search.model.CombinedResult;
import com.delta.adinsights.search.model.DomainFailure;
import com.delta.adinsights.search.model.SearchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Runs one search at startup when {@code search.cli.run=true} and logs the result.
 */
@Component
public class AdSearchCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AdSearchCliRunner.class);

    private final SearchProperties properties;
    private final AdSearchService searchService;
    private final ConfigurableApplicationContext applicationContext;

    public AdSearchCliRunner(
        SearchProperties properties,
        AdSearchService searchService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.searchService = searchService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        String rawDomains = properties.getCli().getDomains() == null ? "" : properties.getCli().getDomains();
        List<String> domains = Arrays.stream(rawDomains.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();

        SearchRequest request = new SearchRequest(
            domains,
            properties.getCli().getDepth(),
            properties.getCli().getLocationCode(),
            properties.getCli().getLanguage()
        );

        int exitStatus = 0;
        try {
            CombinedResult result = searchService.search(request);
            log.info(
                "Search returned {} ads for {} of {} domains: {}",
                result.adsCount(),
                result.domains().size(),
                result.requestedDomains(),
                result.domains()
            );
            for (DomainFailure failure : result.failedDomains()) {
                log.info("Skipped {}: {}", failure.domain(), failure.message());
            }
            if (result.clustering() != null) {
                for (Cluster cluster : result.clustering().clusters()) {
                    log.info("Cluster {} '{}': {} phrases", cluster.id(), cluster.name(), cluster.size());
                }
                log.info(
                    "Unclustered phrases: {} of {}",
                    result.clustering().unclustered().size(),
                    result.clustering().totalPhrases()
                );
            }
        } catch (SearchValidationException | AllDomainsFailedException e) {
            log.error("Search failed: {}", e.getMessage());
            exitStatus = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalStatus = exitStatus;
            int exitCode = SpringApplication.exit(applicationContext, () -> finalStatus);
            System.exit(exitCode);
        }
    }
}
