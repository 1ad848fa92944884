package com.keyforge.node.batch;

import com.keyforge.core.config.BatchSettings;
import com.keyforge.core.error.ComponentUnavailableException;
import com.keyforge.core.error.Failures;
import com.keyforge.core.spi.CryptoBackend;
import com.keyforge.node.cache.CacheTier;
import com.keyforge.node.cache.MultiTierCache;
import com.keyforge.node.event.EventBus;
import com.keyforge.node.event.NodeEvent;
import com.keyforge.node.event.NodeEventType;
import com.keyforge.node.health.ManagedComponent;
import com.keyforge.node.pool.Task;
import com.keyforge.node.pool.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects sign and verify requests into batches and runs them on the worker pool.
 * <p>
 * A request answered by the cache completes immediately. Otherwise it joins an identical
 * request that is already pending or executing, or it is added to the pending batch. The
 * batch is flushed when it reaches {@code batchSize} or {@code batchTimeout} after its
 * first request. A flush partitions requests by {@link RequestKind} and submits every
 * request to the pool in parallel. Each result is cached before its in-flight slot is
 * released, so a key is executed at most once per batch and cache window.
 */
public class BatchedRequestService implements ManagedComponent {

    private static final Logger log = LoggerFactory.getLogger(BatchedRequestService.class);
    private static final String COMPONENT = "batch-service";

    private final BatchSettings settings;
    private final WorkerPool pool;
    private final MultiTierCache cache;
    private final CryptoBackend backend;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, CompletableFuture<Object>> pending = new LinkedHashMap<>();
    private final Map<String, BatchRequest<?>> pendingRequests = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<Object>> inFlight = new LinkedHashMap<>();
    private ScheduledFuture<?> flushTimer;
    private boolean closed;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong dedupJoins = new AtomicLong();
    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong batchesProcessed = new AtomicLong();
    private final AtomicLong batchedRequests = new AtomicLong();

    public BatchedRequestService(BatchSettings settings, WorkerPool pool, MultiTierCache cache,
                                 CryptoBackend backend, EventBus eventBus,
                                 ScheduledExecutorService scheduler, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "Batch settings cannot be null");
        this.pool = Objects.requireNonNull(pool, "Worker pool cannot be null");
        this.cache = Objects.requireNonNull(cache, "Cache cannot be null");
        this.backend = Objects.requireNonNull(backend, "Crypto backend cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Submits a request.
     *
     * @return future settled with this request's result or typed failure
     */
    public <R> CompletableFuture<R> request(BatchRequest<R> request) {
        Objects.requireNonNull(request, "Request cannot be null");
        requests.incrementAndGet();
        String key = request.cacheKey();
        Optional<R> cached = cache.get(key, request.resultType());
        if (cached.isPresent()) {
            cacheHits.incrementAndGet();
            return CompletableFuture.completedFuture(cached.get());
        }

        CompletableFuture<Object> shared;
        List<Map.Entry<BatchRequest<?>, CompletableFuture<Object>>> toFlush = null;
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(
                        new ComponentUnavailableException(COMPONENT, "service is shut down"));
            }
            shared = inFlight.get(key);
            if (shared == null) {
                shared = pending.get(key);
            }
            if (shared != null) {
                dedupJoins.incrementAndGet();
            } else {
                // A result cached and released between the first lookup and this lock.
                Optional<R> settled = cache.peekLocal(key, request.resultType());
                if (settled.isPresent()) {
                    cacheHits.incrementAndGet();
                    return CompletableFuture.completedFuture(settled.get());
                }
                shared = new CompletableFuture<>();
                pending.put(key, shared);
                pendingRequests.put(key, request);
                if (pending.size() == 1) {
                    scheduleFlushTimer();
                }
                if (pending.size() >= settings.batchSize()) {
                    toFlush = drainPending();
                }
            }
        }
        if (toFlush != null) {
            execute(toFlush);
        }
        return shared.thenApply(request.resultType()::cast);
    }

    /**
     * Warms the cache with the results of requests expected soon. Requests already cached
     * locally are skipped; the rest are flushed to the pool at once and their results cached
     * as usual. Individual failures are counted in the stats and do not fail the returned
     * future.
     *
     * @return future completed with the number of results computed and cached
     */
    public CompletableFuture<Integer> precompute(List<? extends BatchRequest<?>> requests) {
        Objects.requireNonNull(requests, "Requests cannot be null");
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(
                        new ComponentUnavailableException(COMPONENT, "service is shut down"));
            }
        }
        List<CompletableFuture<Integer>> computed = new ArrayList<>();
        for (BatchRequest<?> request : requests) {
            if (cache.containsLocal(request.cacheKey())) {
                continue;
            }
            computed.add(request(request).handle((result, error) -> error == null ? 1 : 0));
        }
        flush();
        return CompletableFuture.allOf(computed.toArray(CompletableFuture<?>[]::new))
                .thenApply(ignored -> {
                    int count = computed.stream().mapToInt(CompletableFuture::join).sum();
                    log.debug("Precomputed {} of {} requests", count, requests.size());
                    eventBus.emit(new NodeEvent(NodeEventType.PRECOMPUTE_COMPLETE, COMPONENT, null,
                            "Precomputed " + count + " results",
                            Map.of("requested", requests.size(), "computed", count)));
                    return count;
                });
    }

    /**
     * Flushes the pending batch now.
     *
     * @return future completed once every request of the batch has settled
     */
    public CompletableFuture<Void> flush() {
        List<Map.Entry<BatchRequest<?>, CompletableFuture<Object>>> batch;
        synchronized (lock) {
            batch = drainPending();
        }
        return execute(batch);
    }

    /**
     * Stops accepting requests, flushes the pending batch and waits for in-flight work.
     * Individual failures are delivered to their callers, not to the returned future.
     */
    public CompletableFuture<Void> shutdown() {
        synchronized (lock) {
            closed = true;
        }
        flush();
        List<CompletableFuture<Object>> outstanding;
        synchronized (lock) {
            outstanding = new ArrayList<>(inFlight.values());
        }
        log.info("Batch service shutting down with {} requests in flight", outstanding.size());
        return CompletableFuture.allOf(outstanding.stream()
                        .map(f -> f.handle((result, error) -> null))
                        .toArray(CompletableFuture<?>[]::new))
                .thenRun(() -> log.debug("Batch service drained"));
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public BatchStats getStats() {
        int pendingNow;
        int inFlightNow;
        synchronized (lock) {
            pendingNow = pending.size();
            inFlightNow = inFlight.size();
        }
        long batches = batchesProcessed.get();
        return new BatchStats(
                requests.get(),
                cacheHits.get(),
                dedupJoins.get(),
                executions.get(),
                failures.get(),
                batches,
                pendingNow,
                inFlightNow,
                batches == 0 ? 0.0 : (double) batchedRequests.get() / batches);
    }

    @Override
    public String componentName() {
        return COMPONENT;
    }

    @Override
    public void ping() {
        synchronized (lock) {
            if (closed) {
                throw new ComponentUnavailableException(COMPONENT, "service is shut down");
            }
        }
    }

    /**
     * Flushes whatever is pending so a stalled batch cannot hold callers indefinitely.
     */
    @Override
    public void recover() {
        if (pendingCount() > 0) {
            log.info("Recovering batch service by flushing {} pending requests", pendingCount());
            flush();
        }
    }

    // ==================== Internals ====================

    private List<Map.Entry<BatchRequest<?>, CompletableFuture<Object>>> drainPending() {
        List<Map.Entry<BatchRequest<?>, CompletableFuture<Object>>> batch = new ArrayList<>(pending.size());
        for (Map.Entry<String, CompletableFuture<Object>> entry : pending.entrySet()) {
            batch.add(Map.entry(pendingRequests.get(entry.getKey()), entry.getValue()));
            inFlight.put(entry.getKey(), entry.getValue());
        }
        pending.clear();
        pendingRequests.clear();
        if (flushTimer != null) {
            flushTimer.cancel(false);
            flushTimer = null;
        }
        return batch;
    }

    private CompletableFuture<Void> execute(List<Map.Entry<BatchRequest<?>, CompletableFuture<Object>>> batch) {
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        Map<RequestKind, List<Map.Entry<BatchRequest<?>, CompletableFuture<Object>>>> partitions =
                new EnumMap<>(RequestKind.class);
        for (Map.Entry<BatchRequest<?>, CompletableFuture<Object>> entry : batch) {
            partitions.computeIfAbsent(entry.getKey().kind(), k -> new ArrayList<>()).add(entry);
        }

        AtomicInteger failed = new AtomicInteger();
        List<CompletableFuture<Void>> settled = new ArrayList<>(batch.size());
        for (List<Map.Entry<BatchRequest<?>, CompletableFuture<Object>>> partition : partitions.values()) {
            for (Map.Entry<BatchRequest<?>, CompletableFuture<Object>> entry : partition) {
                settled.add(run(entry.getKey(), entry.getValue(), failed));
            }
        }

        batchesProcessed.incrementAndGet();
        batchedRequests.addAndGet(batch.size());
        Map<String, Object> sizes = new LinkedHashMap<>();
        sizes.put("size", batch.size());
        partitions.forEach((kind, list) -> sizes.put(kind.name().toLowerCase(Locale.ROOT), list.size()));
        eventBus.emit(new NodeEvent(NodeEventType.BATCH_FLUSHED, COMPONENT, null,
                "Flushed " + batch.size() + " requests", sizes));

        return CompletableFuture.allOf(settled.toArray(CompletableFuture<?>[]::new))
                .thenRun(() -> {
                    if (failed.get() == batch.size()) {
                        log.warn("Every request of a batch of {} failed", batch.size());
                        eventBus.emit(new NodeEvent(NodeEventType.BATCH_FAILED, COMPONENT, null,
                                "All " + batch.size() + " requests failed", Map.of("size", batch.size())));
                    }
                });
    }

    private <R> CompletableFuture<Void> run(BatchRequest<R> request, CompletableFuture<Object> shared,
                                            AtomicInteger failed) {
        executions.incrementAndGet();
        Task<R> task = Task.of(request.taskType(), settings.taskPriority(), () -> request.execute(backend, clock));
        return pool.submit(task).handle((result, error) -> {
            String key = request.cacheKey();
            if (error == null) {
                cache.set(key, result, CacheTier.HOT, ttlFor(request.kind()));
            }
            synchronized (lock) {
                inFlight.remove(key);
            }
            if (error == null) {
                shared.complete(result);
            } else {
                failures.incrementAndGet();
                failed.incrementAndGet();
                Throwable cause = Failures.unwrap(error);
                log.debug("{} request {} failed: {}", request.kind(), key, cause.getMessage());
                shared.completeExceptionally(cause);
            }
            return null;
        });
    }

    private Duration ttlFor(RequestKind kind) {
        return kind == RequestKind.SIGN ? settings.signatureTtl() : settings.verificationTtl();
    }

    private void scheduleFlushTimer() {
        try {
            flushTimer = scheduler.schedule(this::flushOnTimer,
                    settings.batchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Batch timer could not be scheduled, batch will flush on size or shutdown: {}", e.getMessage());
        }
    }

    private void flushOnTimer() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.error("Timed batch flush failed", e);
        }
    }
}
