package com.brandmonitor.application.review;

import com.brandmonitor.domain.review.model.ReviewItem;
import com.brandmonitor.domain.review.service.SourceCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a brand query out to every enabled collector and fans the successes back in.
 * <p>
 * Collectors run concurrently on a bounded pool. Each call has its own timeout and the whole batch has a
 * deadline; whatever has not arrived by then is skipped. A failing collector only costs its own items.
 * </p>
 */
@Slf4j
@Service
public class ReviewCollectionService {

    private final List<SourceCollector> collectors;
    private final ExecutorService executor;
    private final Duration collectorTimeout;
    private final Duration batchDeadline;

    @Autowired
    public ReviewCollectionService(ObjectProvider<SourceCollector> collectors,
                                   @Qualifier("collectorExecutor") ExecutorService executor,
                                   @Value("${collector.timeout:15s}") Duration collectorTimeout,
                                   @Value("${collector.batch-deadline:30s}") Duration batchDeadline) {
        this(collectors.orderedStream().toList(), executor, collectorTimeout, batchDeadline);
    }

    public ReviewCollectionService(List<SourceCollector> collectors,
                                   ExecutorService executor,
                                   Duration collectorTimeout,
                                   Duration batchDeadline) {
        this.collectors = List.copyOf(collectors);
        this.executor = executor;
        this.collectorTimeout = collectorTimeout;
        this.batchDeadline = batchDeadline;
    }

    public List<ReviewItem> collect(String brandName) {
        return collectOutcomes(brandName).stream()
                .filter(CollectorOutcome::succeeded)
                .flatMap(o -> o.items().stream())
                .toList();
    }

    /**
     * Runs all collectors and returns one outcome per collector that finished before the batch deadline,
     * in registration order.
     */
    public List<CollectorOutcome> collectOutcomes(String brandName) {
        if (collectors.isEmpty()) {
            log.warn("[ReviewCollection] No collectors enabled, nothing to collect for '{}'", brandName);
            return List.of();
        }

        List<CompletableFuture<CollectorOutcome>> futures = collectors.stream()
                .map(collector -> CompletableFuture
                        .supplyAsync(() -> runCollector(collector, brandName), executor)
                        .exceptionally(t -> crashed(collector, t))
                        .completeOnTimeout(
                                CollectorOutcome.failure(collector.sourceId(),
                                        "timed out after " + collectorTimeout.toMillis() + "ms",
                                        collectorTimeout.toMillis()),
                                collectorTimeout.toMillis(), TimeUnit.MILLISECONDS))
                .toList();

        awaitBatch(futures);

        List<CollectorOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<CollectorOutcome> future = futures.get(i);
            if (future.isDone() && !future.isCancelled()) {
                outcomes.add(future.join());
            } else {
                future.cancel(true);
                log.warn("[ReviewCollection] {} missed the batch deadline, skipped", collectors.get(i).sourceId());
            }
        }

        logSummary(brandName, outcomes);
        return outcomes;
    }

    private void awaitBatch(List<CompletableFuture<CollectorOutcome>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(batchDeadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[ReviewCollection] Batch deadline of {}ms reached, continuing with partial results",
                    batchDeadline.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ReviewCollection] Interrupted while waiting for collectors");
        } catch (ExecutionException e) {
            // Every future recovers into an outcome; whatever still completed is read below
            log.error("[ReviewCollection] Collector batch completed exceptionally", e.getCause());
        }
    }

    private CollectorOutcome runCollector(SourceCollector collector, String brandName) {
        long start = System.currentTimeMillis();
        try {
            List<ReviewItem> items = collector.collect(brandName);
            long duration = System.currentTimeMillis() - start;
            return CollectorOutcome.success(collector.sourceId(), items, duration);
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - start;
            log.warn("[ReviewCollection] Collector {} failed after {}ms: {}",
                    collector.sourceId(), duration, e.getMessage());
            log.debug("[ReviewCollection] Collector {} failure detail", collector.sourceId(), e);
            return CollectorOutcome.failure(collector.sourceId(), String.valueOf(e.getMessage()), duration);
        }
    }

    // Errors (linkage failures, assertion errors) escape runCollector's catch and land here
    private CollectorOutcome crashed(SourceCollector collector, Throwable t) {
        Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        log.error("[ReviewCollection] Collector {} crashed", collector.sourceId(), cause);
        return CollectorOutcome.failure(collector.sourceId(),
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), 0);
    }

    private void logSummary(String brandName, List<CollectorOutcome> outcomes) {
        int total = outcomes.stream().mapToInt(o -> o.items().size()).sum();
        log.info("[ReviewCollection] Brand '{}': {} items from {}/{} collectors {}",
                brandName, total,
                outcomes.stream().filter(CollectorOutcome::succeeded).count(), collectors.size(),
                outcomes.stream()
                        .map(o -> o.sourceId() + "=" + (o.succeeded() ? o.items().size() : "failed"))
                        .toList());
    }
}
