package com.keyforge.node.batch;

import com.keyforge.core.config.BatchSettings;
import com.keyforge.core.config.CacheSettings;
import com.keyforge.core.config.PoolSettings;
import com.keyforge.core.domain.ComplexityTier;
import com.keyforge.core.domain.KeyRef;
import com.keyforge.core.domain.Signature;
import com.keyforge.core.error.ComponentUnavailableException;
import com.keyforge.core.error.CryptoBackendException;
import com.keyforge.node.cache.MultiTierCache;
import com.keyforge.node.event.EventBus;
import com.keyforge.node.event.NodeEvent;
import com.keyforge.node.event.NodeEventType;
import com.keyforge.node.pool.WorkerPool;
import com.keyforge.node.support.FakeCryptoBackend;
import com.keyforge.node.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for BatchedRequestService: deduplication, flush triggers, caching and failures.
 */
class BatchedRequestServiceTest {

    private static final byte[] PAYLOAD = "transfer 10 units".getBytes(StandardCharsets.UTF_8);

    private ScheduledExecutorService scheduler;
    private MutableClock clock;
    private EventBus eventBus;
    private List<NodeEvent> events;
    private FakeCryptoBackend backend;
    private WorkerPool pool;
    private MultiTierCache cache;
    private BatchedRequestService service;
    private KeyRef key;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        clock = new MutableClock();
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe(NodeEventType.ALL, events::add);
        backend = new FakeCryptoBackend();
        pool = new WorkerPool(PoolSettings.defaults().withPoolSize(2), eventBus, scheduler, clock);
        cache = new MultiTierCache(CacheSettings.defaults(), null, eventBus, null, clock);
        key = backend.generateKeyMaterial(ComplexityTier.LOW);
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
        pool.shutdown(Duration.ofSeconds(1));
        scheduler.shutdownNow();
    }

    private BatchedRequestService newService(BatchSettings settings) {
        service = new BatchedRequestService(settings, pool, cache, backend, eventBus, scheduler, clock);
        return service;
    }

    private static BatchSettings manualFlush() {
        return BatchSettings.defaults().withBatchTimeout(Duration.ofSeconds(30));
    }

    private SignRequest sign(String resourceId, byte[] data) {
        return new SignRequest(resourceId, key, 1, data);
    }

    // ==================== Deduplication Tests ====================

    /**
     * Property: Identical concurrent requests execute once and share the result.
     */
    @Test
    void request_identicalRequestsExecuteOnce() throws Exception {
        // Given
        newService(manualFlush());
        List<CompletableFuture<Signature>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < 5; i++) {
            futures.add(service.request(sign("res-1", PAYLOAD)));
        }
        assertThat(service.pendingCount()).isEqualTo(1);
        service.flush().get(5, TimeUnit.SECONDS);

        // Then
        Signature first = futures.get(0).get(5, TimeUnit.SECONDS);
        for (CompletableFuture<Signature> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(first);
        }
        assertThat(backend.signCalls).hasValue(1);
        BatchStats stats = service.getStats();
        assertThat(stats.requests()).isEqualTo(5);
        assertThat(stats.dedupJoins()).isEqualTo(4);
        assertThat(stats.executions()).isEqualTo(1);
        assertThat(stats.inFlight()).isZero();
    }

    @Test
    void request_answeredFromCacheAfterExecution() throws Exception {
        newService(manualFlush());
        CompletableFuture<Signature> original = service.request(sign("res-1", PAYLOAD));
        service.flush().get(5, TimeUnit.SECONDS);

        CompletableFuture<Signature> repeat = service.request(sign("res-1", PAYLOAD));

        assertThat(repeat).isCompleted();
        assertThat(repeat.get()).isEqualTo(original.get());
        assertThat(backend.signCalls).hasValue(1);
        assertThat(service.getStats().cacheHits()).isEqualTo(1);
        assertThat(service.pendingCount()).isZero();
    }

    @Test
    void request_differentDataIsNotDeduplicated() throws Exception {
        newService(manualFlush());

        CompletableFuture<Signature> a = service.request(sign("res-1", PAYLOAD));
        CompletableFuture<Signature> b = service.request(sign("res-1", "other".getBytes(StandardCharsets.UTF_8)));
        service.flush().get(5, TimeUnit.SECONDS);

        assertThat(a.get().value()).isNotEqualTo(b.get().value());
        assertThat(backend.signCalls).hasValue(2);
    }

    /**
     * Property: A result cached between a request's first lookup and its enqueue is served
     * from the cache rather than executed again.
     */
    @Test
    void request_resultCachedAfterFirstLookupIsNotExecutedAgain() throws Exception {
        // Given: a cache whose next lookup misses once, as if the result landed just after it
        AtomicBoolean missNextLookup = new AtomicBoolean();
        cache = new MultiTierCache(CacheSettings.defaults(), null, eventBus, null, clock) {
            @Override
            public Optional<Object> get(String key) {
                return missNextLookup.compareAndSet(true, false) ? Optional.empty() : super.get(key);
            }
        };
        newService(manualFlush());
        CompletableFuture<Signature> original = service.request(sign("res-1", PAYLOAD));
        service.flush().get(5, TimeUnit.SECONDS);
        assertThat(original.get(5, TimeUnit.SECONDS)).isNotNull();

        // When
        missNextLookup.set(true);
        CompletableFuture<Signature> repeat = service.request(sign("res-1", PAYLOAD));

        // Then
        assertThat(repeat).isCompleted();
        assertThat(service.pendingCount()).isZero();
        assertThat(backend.signCalls).hasValue(1);
        assertThat(service.getStats().cacheHits()).isEqualTo(1);
    }

    // ==================== Precompute Tests ====================

    @Test
    void precompute_cachesMissesAndSkipsCachedRequests() throws Exception {
        // Given
        newService(manualFlush());
        service.request(sign("res-1", PAYLOAD));
        service.flush().get(5, TimeUnit.SECONDS);

        // When
        int computed = service.precompute(List.of(
                sign("res-1", PAYLOAD), sign("res-2", PAYLOAD), sign("res-3", PAYLOAD))).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(computed).isEqualTo(2);
        assertThat(backend.signCalls).hasValue(3);
        assertThat(cache.containsLocal(sign("res-2", PAYLOAD).cacheKey())).isTrue();
        assertThat(service.request(sign("res-3", PAYLOAD))).isCompleted();
        assertThat(backend.signCalls).hasValue(3);
        assertThat(events).filteredOn(e -> e.eventType() == NodeEventType.PRECOMPUTE_COMPLETE)
                .singleElement()
                .satisfies(e -> assertThat(e.attributes()).containsEntry("computed", 2));
    }

    @Test
    void precompute_failuresAreCountedNotThrown() throws Exception {
        newService(manualFlush());
        backend.failSigning = true;

        int computed = service.precompute(List.of(sign("res-1", PAYLOAD))).get(5, TimeUnit.SECONDS);

        assertThat(computed).isZero();
        assertThat(service.getStats().failures()).isEqualTo(1);
        service.shutdown().get(5, TimeUnit.SECONDS);
        assertThatThrownBy(() -> service.precompute(List.of(sign("res-2", PAYLOAD))).join())
                .hasCauseInstanceOf(ComponentUnavailableException.class);
    }

    // ==================== Flush Trigger Tests ====================

    @Test
    void request_flushesWhenBatchIsFull() throws Exception {
        newService(manualFlush().withBatchSize(3));
        List<CompletableFuture<Signature>> futures = new ArrayList<>();

        for (int i = 0; i < 3; i++) {
            futures.add(service.request(sign("res-" + i, PAYLOAD)));
        }

        for (CompletableFuture<Signature> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS).keyId()).isEqualTo(key.keyId());
        }
        assertThat(service.pendingCount()).isZero();
        assertThat(service.getStats().batchesProcessed()).isEqualTo(1);
        assertThat(service.getStats().averageBatchSize()).isEqualTo(3.0);
    }

    @Test
    void request_flushesAfterBatchTimeout() throws Exception {
        newService(BatchSettings.defaults().withBatchTimeout(Duration.ofMillis(50)));

        CompletableFuture<Signature> future = service.request(sign("res-1", PAYLOAD));

        assertThat(future.get(5, TimeUnit.SECONDS).resourceId()).isEqualTo("res-1");
        assertThat(events).extracting(NodeEvent::eventType).contains(NodeEventType.BATCH_FLUSHED);
    }

    @Test
    void flush_withNothingPendingCompletesImmediately() {
        newService(manualFlush());

        assertThat(service.flush()).isCompleted();
        assertThat(service.getStats().batchesProcessed()).isZero();
    }

    @Test
    void request_verifiesSignedData() throws Exception {
        newService(manualFlush());
        CompletableFuture<Signature> signed = service.request(sign("res-1", PAYLOAD));
        service.flush().get(5, TimeUnit.SECONDS);
        byte[] value = signed.get().value();

        CompletableFuture<Boolean> valid = service.request(new VerifyRequest("res-1", key, value, PAYLOAD));
        CompletableFuture<Boolean> tampered = service.request(
                new VerifyRequest("res-1", key, value, "transfer 99 units".getBytes(StandardCharsets.UTF_8)));
        service.flush().get(5, TimeUnit.SECONDS);

        assertThat(valid.get()).isTrue();
        assertThat(tampered.get()).isFalse();
        NodeEvent flushed = events.stream()
                .filter(e -> e.eventType() == NodeEventType.BATCH_FLUSHED)
                .reduce((first, second) -> second)
                .orElseThrow();
        assertThat(flushed.attributes()).containsEntry("verify", 2).doesNotContainKey("sign");
    }

    // ==================== Failure Tests ====================

    @Test
    void request_failureReachesCallerUnwrappedAndIsNotCached() throws Exception {
        newService(manualFlush());
        backend.failSigning = true;

        CompletableFuture<Signature> failed = service.request(sign("res-1", PAYLOAD));
        service.flush().get(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> failed.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(CryptoBackendException.class);
        assertThat(service.getStats().failures()).isEqualTo(1);
        assertThat(events).extracting(NodeEvent::eventType).contains(NodeEventType.BATCH_FAILED);

        backend.failSigning = false;
        CompletableFuture<Signature> retried = service.request(sign("res-1", PAYLOAD));
        service.flush().get(5, TimeUnit.SECONDS);

        assertThat(retried.get(5, TimeUnit.SECONDS).resourceId()).isEqualTo("res-1");
        assertThat(backend.signCalls).hasValue(2);
    }

    @Test
    void request_partialFailureDoesNotFailBatch() throws Exception {
        newService(manualFlush());
        KeyRef unknown = new KeyRef("ghost", ComplexityTier.LOW, "FAKE-SHA256", Instant.now());

        CompletableFuture<Signature> good = service.request(sign("res-1", PAYLOAD));
        CompletableFuture<Signature> bad = service.request(new SignRequest("res-2", unknown, 1, PAYLOAD));
        service.flush().get(5, TimeUnit.SECONDS);

        assertThat(good.get()).isNotNull();
        assertThatThrownBy(bad::get).hasCauseInstanceOf(CryptoBackendException.class);
        assertThat(events).extracting(NodeEvent::eventType).doesNotContain(NodeEventType.BATCH_FAILED);
    }

    // ==================== Lifecycle Tests ====================

    @Test
    void shutdown_flushesPendingAndRejectsNewRequests() throws Exception {
        newService(manualFlush());
        CompletableFuture<Signature> pendingRequest = service.request(sign("res-1", PAYLOAD));

        service.shutdown().get(5, TimeUnit.SECONDS);

        assertThat(pendingRequest.get(5, TimeUnit.SECONDS).resourceId()).isEqualTo("res-1");
        CompletableFuture<Signature> late = service.request(sign("res-2", PAYLOAD));
        assertThatThrownBy(late::join).cause().isInstanceOfSatisfying(ComponentUnavailableException.class,
                e -> assertThat(e.getComponent()).isEqualTo("batch-service"));
        assertThatThrownBy(service::ping).isInstanceOf(ComponentUnavailableException.class);
    }

    @Test
    void recover_flushesStalledBatch() throws Exception {
        newService(manualFlush());
        CompletableFuture<Signature> stalled = service.request(sign("res-1", PAYLOAD));

        service.recover();

        assertThat(stalled.get(5, TimeUnit.SECONDS)).isNotNull();
    }
}
