package com.delta.adinsights.search.service;

import com.delta.adinsights.config.SearchProperties;
import com.delta.adinsights.search.model.DispatchOutcome;
import com.delta.adinsights.search.model.DomainFailure;
import com.delta.adinsights.search.model.DomainResult;
import com.delta.adinsights.search.model.SearchParams;
import com.delta.adinsights.search.provider.AdProviderClient;
import com.delta.adinsights.search.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one provider call per domain concurrently and collects every outcome independently.
 *
 * <p>Each call runs as its own executor task and settles into its own slot; slots are read only after the whole batch has settled
 * and always in submission order, so results never depend on which call finished first.
 */
@Service
public class FanOutOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(FanOutOrchestrator.class);

    private final AdProviderClient providerClient;
    private final ExecutorService fanOutExecutor;
    private final SearchProperties properties;

    public FanOutOrchestrator(
        AdProviderClient providerClient,
        @Qualifier("fanOutExecutor") ExecutorService fanOutExecutor,
        SearchProperties properties
    ) {
        this.providerClient = providerClient;
        this.fanOutExecutor = fanOutExecutor;
        this.properties = properties;
    }

    /**
     * @throws AllDomainsFailedException when no domain succeeded, including when the batch
     *     deadline expired or the caller was interrupted while waiting
     */
    public DispatchOutcome dispatch(List<String> domains, SearchParams params) {
        if (domains == null || domains.isEmpty()) {
            throw new IllegalArgumentException("dispatch requires at least one domain");
        }

        List<CompletableFuture<DomainCallSlot>> futures = new ArrayList<>(domains.size());
        List<Future<?>> tasks = new ArrayList<>(domains.size());
        for (String domain : domains) {
            CompletableFuture<DomainCallSlot> slot = new CompletableFuture<>();
            futures.add(slot);
            tasks.add(submit(domain, params, slot));
        }

        awaitBatch(domains, futures, tasks);

        List<DomainResult> succeeded = new ArrayList<>();
        List<DomainFailure> failed = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String domain = domains.get(i);
            try {
                DomainCallSlot slot = futures.get(i).join();
                if (slot.result() != null) {
                    succeeded.add(slot.result());
                } else {
                    failed.add(slot.failure());
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                failed.add(new DomainFailure(domain, null, describe(cause)));
            }
        }

        for (DomainFailure failure : failed) {
            log.warn(
                "Provider call failed for {} (status={}): {}",
                failure.domain(),
                failure.statusCode() == null ? "none" : failure.statusCode(),
                failure.message()
            );
        }
        if (succeeded.isEmpty()) {
            throw new AllDomainsFailedException(failed);
        }
        return new DispatchOutcome(succeeded, failed);
    }

    private Future<?> submit(String domain, SearchParams params, CompletableFuture<DomainCallSlot> slot) {
        try {
            return fanOutExecutor.submit(() -> {
                try {
                    slot.complete(callProvider(domain, params));
                } catch (Throwable t) {
                    slot.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            slot.complete(new DomainCallSlot(null, new DomainFailure(domain, null, "Search executor rejected the call")));
            return CompletableFuture.completedFuture(null);
        }
    }

    private DomainCallSlot callProvider(String domain, SearchParams params) {
        try {
            DomainResult result = providerClient.fetchDomainAds(
                domain,
                params.depth(),
                params.locationCode(),
                params.language()
            );
            return new DomainCallSlot(result, null);
        } catch (ProviderException e) {
            return new DomainCallSlot(null, new DomainFailure(domain, e.getStatusCode(), e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Unexpected error fetching ads for {}", domain, e);
            return new DomainCallSlot(null, new DomainFailure(domain, null, describe(e)));
        }
    }

    private void awaitBatch(
        List<String> domains,
        List<CompletableFuture<DomainCallSlot>> futures,
        List<Future<?>> tasks
    ) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
        int timeoutSeconds = properties.getBatchTimeoutSeconds();
        try {
            if (timeoutSeconds > 0) {
                all.get(timeoutSeconds, TimeUnit.SECONDS);
            } else {
                all.get();
            }
        } catch (TimeoutException e) {
            cancelAll(tasks);
            log.warn("Search batch of {} domains exceeded {}s, cancelling", domains.size(), timeoutSeconds);
            throw abortedBatch(domains, "Search timed out after " + timeoutSeconds + " seconds");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(tasks);
            log.warn("Search batch of {} domains interrupted, cancelling", domains.size());
            throw abortedBatch(domains, "Search was cancelled");
        } catch (ExecutionException e) {
            // individual failures are collected per slot below
            log.debug("Search batch settled with an exceptional slot", e.getCause());
        }
    }

    /**
     * Interrupts the running provider calls; a blocked HTTP exchange aborts on interrupt.
     */
    private static void cancelAll(List<Future<?>> tasks) {
        for (Future<?> task : tasks) {
            task.cancel(true);
        }
    }

    private static AllDomainsFailedException abortedBatch(List<String> domains, String message) {
        List<DomainFailure> failures = new ArrayList<>(domains.size());
        for (String domain : domains) {
            failures.add(new DomainFailure(domain, null, message));
        }
        return new AllDomainsFailedException(failures);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private record DomainCallSlot(DomainResult result, DomainFailure failure) {
    }
}
