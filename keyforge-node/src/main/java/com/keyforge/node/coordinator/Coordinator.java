package com.keyforge.node.coordinator;

import com.keyforge.core.config.KeyforgeConfig;
import com.keyforge.core.crypto.JcaCryptoBackend;
import com.keyforge.core.domain.AdaptationOutcome;
import com.keyforge.core.domain.ComplexityTier;
import com.keyforge.core.domain.Energy;
import com.keyforge.core.domain.KeyRef;
import com.keyforge.core.domain.ResourceSnapshot;
import com.keyforge.core.domain.Signature;
import com.keyforge.core.error.ComponentUnavailableException;
import com.keyforge.core.error.Failures;
import com.keyforge.core.error.PeerSendException;
import com.keyforge.core.error.ResourceLockedException;
import com.keyforge.core.error.ResourceNotFoundException;
import com.keyforge.core.spi.CryptoBackend;
import com.keyforge.core.spi.PeerAck;
import com.keyforge.core.spi.PeerMessage;
import com.keyforge.core.spi.PeerTransport;
import com.keyforge.core.spi.RemoteCacheStore;
import com.keyforge.node.batch.BatchedRequestService;
import com.keyforge.node.batch.SignRequest;
import com.keyforge.node.batch.VerifyRequest;
import com.keyforge.node.cache.MultiTierCache;
import com.keyforge.node.consensus.ProposalEvaluator;
import com.keyforge.node.event.EventBus;
import com.keyforge.node.event.NodeEvent;
import com.keyforge.node.event.NodeEventType;
import com.keyforge.node.health.HealthMonitor;
import com.keyforge.node.health.HealthReport;
import com.keyforge.node.health.ManagedComponent;
import com.keyforge.node.pool.Task;
import com.keyforge.node.pool.TaskType;
import com.keyforge.node.pool.WorkerPool;
import com.keyforge.node.resource.AdaptiveResourceManager;
import com.keyforge.node.resource.MigrationReceipt;
import com.keyforge.node.transport.PeerRegistry;
import com.keyforge.node.transport.RetryingPeerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of a Keyforge node.
 * <p>
 * Owns the worker pool, the multi-tier cache, the batched request service and the
 * adaptive resource manager, together with the event bus, the peer registry and the one
 * scheduler all periodic work runs on. Nothing is shared between coordinators.
 * <p>
 * Key generation goes straight to the worker pool; sign and verify go through the batch
 * service; adaptations go through the resource manager's consensus round. Resource
 * snapshots are cached under {@code resource:<id>} and invalidated on every change this
 * node makes.
 * <p>
 * Lifecycle: {@link #create} → {@link #start()} → {@link #shutdown(Duration)}.
 */
public class Coordinator {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);
    private static final String SOURCE = "coordinator";
    private static final String RESOURCE_KEY_PREFIX = "resource:";

    private final KeyforgeConfig config;
    private final Clock clock;
    private final AtomicReference<State> state;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final PeerRegistry peers;
    private final CryptoBackend backend;
    private final WorkerPool pool;
    private final MultiTierCache cache;
    private final BatchedRequestService batch;
    private final AdaptiveResourceManager resources;
    private final HealthMonitor healthMonitor;
    private final List<ScheduledFuture<?>> periodicTasks = new ArrayList<>();
    private final List<String> subscriptions = new ArrayList<>();

    private final AtomicLong operations = new AtomicLong();
    private final AtomicLong failedOperations = new AtomicLong();
    private final AtomicLong resourcesCreated = new AtomicLong();
    private final AtomicLong signaturesIssued = new AtomicLong();
    private final AtomicLong verifications = new AtomicLong();
    private final AtomicLong adaptationsProposed = new AtomicLong();
    private final AtomicLong loadRebalanceSignals = new AtomicLong();
    private final AtomicLong autoScaleEvents = new AtomicLong();

    private volatile Instant startedAt;
    private CompletableFuture<Void> shutdownFuture;

    private Coordinator(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.state = new AtomicReference<>(State.CREATED);
        this.eventBus = builder.eventBus != null ? builder.eventBus : new EventBus();
        this.scheduler = newScheduler(config.nodeId());
        this.peers = new PeerRegistry(config.nodeId(), builder.peers);

        this.backend = builder.cryptoBackend != null ? builder.cryptoBackend : new JcaCryptoBackend();
        PeerTransport transport = builder.transport != null ? builder.transport : Coordinator::noTransport;
        if (builder.retryingTransport) {
            transport = new RetryingPeerTransport(transport, scheduler);
        }

        this.pool = new WorkerPool(config.pool(), eventBus, scheduler, clock);
        this.cache = new MultiTierCache(config.cache(), builder.remoteCache, eventBus, scheduler, clock);
        this.batch = new BatchedRequestService(config.batch(), pool, cache, backend, eventBus, scheduler, clock);
        this.resources = new AdaptiveResourceManager(peers, config.consensus(), transport, pool, backend,
                eventBus, scheduler, clock, builder.evaluator);
        this.healthMonitor = new HealthMonitor(List.of(pool, cache, batch, resources), eventBus, clock,
                config.coordinator().failoverEnabled());
    }

    public static Builder builder(KeyforgeConfig config) {
        return new Builder(config);
    }

    /**
     * Creates a coordinator with the given collaborators and no initial peers.
     */
    public static Coordinator create(KeyforgeConfig config, CryptoBackend backend, PeerTransport transport) {
        return builder(config).cryptoBackend(backend).transport(transport).build();
    }

    // ==================== Lifecycle ====================

    /**
     * Starts cache maintenance, the health loop and the load-balance loop. Idempotent.
     */
    public void start() {
        if (state.get() == State.RUNNING) {
            return;
        }
        if (!state.compareAndSet(State.CREATED, State.RUNNING)) {
            throw new ComponentUnavailableException(SOURCE, "cannot start from state " + state.get());
        }
        startedAt = clock.instant();
        cache.start();

        subscriptions.add(eventBus.subscribe(NodeEventType.WORKER_REPLACED,
                event -> healthMonitor.failover(pool, "worker " + event.subjectId() + " replaced")));
        subscriptions.add(eventBus.subscribe(NodeEventType.BATCH_FAILED,
                event -> healthMonitor.failover(batch, event.message())));

        long healthMillis = config.coordinator().healthCheckInterval().toMillis();
        long balanceMillis = config.coordinator().loadBalanceInterval().toMillis();
        synchronized (periodicTasks) {
            periodicTasks.add(scheduler.scheduleAtFixedRate(this::runHealthCheck,
                    healthMillis, healthMillis, TimeUnit.MILLISECONDS));
            periodicTasks.add(scheduler.scheduleAtFixedRate(this::runLoadBalance,
                    balanceMillis, balanceMillis, TimeUnit.MILLISECONDS));
        }
        log.info("Coordinator {} started with {} workers and {} peers", config.nodeId(), pool.size(), peers.size());
    }

    /**
     * Stops the node: flushes the batch service, expires open proposals, drains the worker
     * pool, stops the scheduler and clears the cache. The whole sequence shares one
     * {@code timeout}. Calling again returns the same future.
     */
    public synchronized CompletableFuture<Void> shutdown(Duration timeout) {
        if (shutdownFuture != null) {
            return shutdownFuture;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        state.set(State.STOPPING);
        eventBus.emit(new NodeEvent(NodeEventType.SHUTDOWN_STARTED, SOURCE, config.nodeId()));
        log.info("Coordinator {} shutting down", config.nodeId());
        synchronized (periodicTasks) {
            periodicTasks.forEach(task -> task.cancel(false));
            periodicTasks.clear();
        }
        subscriptions.forEach(eventBus::unsubscribe);
        subscriptions.clear();
        cache.stop();

        shutdownFuture = batch.shutdown()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((v, error) -> {
                    if (error != null) {
                        log.warn("Batch service did not drain: {}", Failures.unwrap(error).toString());
                    }
                    resources.shutdown();
                    Duration remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
                    return pool.shutdown(remaining);
                })
                .thenCompose(drained -> drained)
                .whenComplete((v, error) -> {
                    scheduler.shutdownNow();
                    cache.clear();
                    state.set(State.STOPPED);
                    eventBus.emit(new NodeEvent(NodeEventType.SHUTDOWN_COMPLETE, SOURCE, config.nodeId(),
                            error == null ? "Clean shutdown" : Failures.unwrap(error).toString()));
                    log.info("Coordinator {} stopped", config.nodeId());
                });
        return shutdownFuture;
    }

    public State getState() {
        return state.get();
    }

    // ==================== Operations ====================

    /**
     * Computes the energy and tier of a new resource, generates its key material and
     * registers it with the resource manager, which replicates it to known peers.
     */
    public CompletableFuture<ResourceSnapshot> createResource(BigInteger value, BigInteger frequency) {
        Optional<CompletableFuture<ResourceSnapshot>> rejected = rejectUnlessRunning();
        if (rejected.isPresent()) {
            return rejected.get();
        }
        if (value == null || frequency == null || value.signum() < 0 || frequency.signum() < 0) {
            return failed(new IllegalArgumentException("Value and frequency must be non-negative"));
        }
        String id = "res-" + UUID.randomUUID();
        return track(pool.submit(Task.forValue(TaskType.CALCULATE_ENERGY, value, () -> Energy.of(value, frequency)))
                .thenCompose(energy -> {
                    ComplexityTier tier = ComplexityTier.forEnergy(energy);
                    return pool.submit(Task.forValue(TaskType.GENERATE_KEY_MATERIAL, value,
                                    () -> backend.generateKeyMaterial(tier)))
                            .thenCompose(keyRef -> resources.registerResource(id, value, frequency, tier, keyRef));
                })
                .thenApply(snapshot -> {
                    cache.set(resourceKey(id), snapshot, config.coordinator().resourceCacheTtl());
                    resourcesCreated.incrementAndGet();
                    return snapshot;
                }));
    }

    /**
     * Signs data with the resource's current key material. Fails with
     * {@link ResourceLockedException} while a consensus round or migration is in progress.
     */
    public CompletableFuture<Signature> deriveSignature(String resourceId, byte[] data) {
        Optional<CompletableFuture<Signature>> rejected = rejectUnlessRunning();
        if (rejected.isPresent()) {
            return rejected.get();
        }
        Optional<ResourceSnapshot> snapshot = resources.getResource(resourceId);
        if (snapshot.isEmpty()) {
            return failed(new ResourceNotFoundException(resourceId));
        }
        if (snapshot.get().locked()) {
            return failed(new ResourceLockedException(resourceId));
        }
        KeyRef keyRef = snapshot.get().keyMaterialRef();
        SignRequest request = new SignRequest(resourceId, keyRef, snapshot.get().consensusVersion(), data);
        return track(batch.request(request).thenApply(signature -> {
            signaturesIssued.incrementAndGet();
            return signature;
        }));
    }

    /**
     * Verifies a signature against the resource's current key material. A signature made
     * with key material the resource no longer holds does not verify.
     */
    public CompletableFuture<Boolean> verifySignature(String resourceId, Signature signature, byte[] data) {
        Optional<CompletableFuture<Boolean>> rejected = rejectUnlessRunning();
        if (rejected.isPresent()) {
            return rejected.get();
        }
        Optional<ResourceSnapshot> snapshot = resources.getResource(resourceId);
        if (snapshot.isEmpty()) {
            return failed(new ResourceNotFoundException(resourceId));
        }
        KeyRef keyRef = snapshot.get().keyMaterialRef();
        verifications.incrementAndGet();
        if (!resourceId.equals(signature.resourceId()) || !keyRef.keyId().equals(signature.keyId())) {
            operations.incrementAndGet();
            return CompletableFuture.completedFuture(false);
        }
        return track(batch.request(new VerifyRequest(resourceId, keyRef, signature.value(), data)));
    }

    /**
     * Runs an adaptation through consensus. "Not adapted" is a normal outcome.
     */
    public CompletableFuture<AdaptationOutcome> proposeAdaptation(String resourceId, BigInteger newValue,
                                                                  BigInteger newFrequency) {
        Optional<CompletableFuture<AdaptationOutcome>> rejected = rejectUnlessRunning();
        if (rejected.isPresent()) {
            return rejected.get();
        }
        if (resourceId == null) {
            return failed(new IllegalArgumentException("Resource ID cannot be null"));
        }
        if (newValue == null || newFrequency == null || newValue.signum() < 0 || newFrequency.signum() < 0) {
            return failed(new IllegalArgumentException("Value and frequency must be non-negative"));
        }
        adaptationsProposed.incrementAndGet();
        return track(resources.evaluateAdaptation(resourceId, newValue, newFrequency)
                .whenComplete((outcome, error) -> {
                    if (error != null || outcome.adapted()) {
                        cache.remove(resourceKey(resourceId));
                    }
                }));
    }

    /**
     * Moves a resource to another peer.
     *
     * @return future failed with {@link PeerSendException} when the peer did not take it
     */
    public CompletableFuture<MigrationReceipt> migrateResource(String resourceId, String targetPeer) {
        Optional<CompletableFuture<MigrationReceipt>> rejected = rejectUnlessRunning();
        if (rejected.isPresent()) {
            return rejected.get();
        }
        return track(resources.migrate(resourceId, targetPeer)
                .whenComplete((receipt, error) -> cache.remove(resourceKey(resourceId))));
    }

    /**
     * Looks the resource up, serving repeated reads from the cache.
     */
    public Optional<ResourceSnapshot> getResource(String resourceId) {
        String key = resourceKey(resourceId);
        Optional<ResourceSnapshot> cached = cache.get(key, ResourceSnapshot.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<ResourceSnapshot> live = resources.getResource(resourceId);
        if (state.get() == State.RUNNING) {
            live.ifPresent(snapshot -> cache.set(key, snapshot, config.coordinator().resourceCacheTtl()));
        }
        return live;
    }

    /**
     * Runs operations concurrently. The results are in input order; a failed operation
     * does not affect the others.
     */
    public CompletableFuture<List<OperationResult>> processBatch(List<? extends Operation> batchOperations) {
        List<CompletableFuture<OperationResult>> results = new ArrayList<>(batchOperations.size());
        for (int i = 0; i < batchOperations.size(); i++) {
            int index = i;
            Operation operation = batchOperations.get(i);
            results.add(dispatchSafely(operation).handle((result, error) -> error == null
                    ? OperationResult.success(index, operation, result)
                    : OperationResult.failure(index, operation,
                            Failures.asKeyforge(error, "Operation " + index + " failed"))));
        }
        batch.flush();
        return CompletableFuture.allOf(results.toArray(CompletableFuture<?>[]::new))
                .thenApply(v -> results.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Accepts a message from the transport on behalf of this node.
     */
    public PeerAck receive(PeerMessage message) {
        PeerAck ack = resources.handleInbound(message);
        if (ack.accepted() && message.resourceId() != null) {
            cache.remove(resourceKey(message.resourceId()));
        }
        return ack;
    }

    // ==================== Monitoring ====================

    public SystemStats getStats() {
        Duration uptime = startedAt == null ? Duration.ZERO : Duration.between(startedAt, clock.instant());
        CoordinatorStats own = new CoordinatorStats(
                state.get(),
                uptime,
                operations.get(),
                failedOperations.get(),
                resourcesCreated.get(),
                signaturesIssued.get(),
                verifications.get(),
                adaptationsProposed.get(),
                loadRebalanceSignals.get(),
                autoScaleEvents.get());
        return new SystemStats(config.nodeId(), own, pool.getStats(), cache.getStats(), batch.getStats(),
                resources.getStats(), healthMonitor.lastReport());
    }

    /**
     * Health as of the last periodic check.
     */
    public HealthReport health() {
        return healthMonitor.lastReport();
    }

    /**
     * Pings every component now.
     */
    public HealthReport checkHealth() {
        return healthMonitor.check();
    }

    /**
     * Compares pool queue depth and batch backlog against their thresholds. Emits
     * {@code LOAD_REBALANCE_REQUIRED} when either is exceeded, and grows the pool by one
     * worker when auto-scaling is enabled and the pool is below its maximum.
     *
     * @return true if the node was found overloaded
     */
    public boolean rebalanceLoad() {
        int queued = pool.queuedCount();
        int pending = batch.pendingCount();
        boolean poolOverloaded = queued > config.coordinator().poolQueueThreshold();
        boolean batchOverloaded = pending > config.coordinator().batchPendingThreshold();
        if (!poolOverloaded && !batchOverloaded) {
            return false;
        }
        loadRebalanceSignals.incrementAndGet();
        eventBus.emit(new NodeEvent(NodeEventType.LOAD_REBALANCE_REQUIRED, SOURCE, config.nodeId(),
                "Queue " + queued + ", batch backlog " + pending,
                Map.of("queuedTasks", queued, "pendingRequests", pending)));
        if (batchOverloaded) {
            batch.flush();
        }
        if (config.coordinator().autoScaleEnabled() && !pool.isClosed() && pool.size() < pool.maxPoolSize()) {
            int target = pool.size() + 1;
            autoScaleEvents.incrementAndGet();
            log.info("Auto-scaling worker pool to {}", target);
            pool.scale(target).whenComplete((v, error) -> {
                if (error != null) {
                    log.warn("Auto-scale to {} failed: {}", target, Failures.unwrap(error).getMessage());
                }
            });
        }
        return true;
    }

    public String nodeId() {
        return config.nodeId();
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public PeerRegistry peers() {
        return peers;
    }

    List<ManagedComponent> components() {
        return List.of(pool, cache, batch, resources);
    }

    WorkerPool pool() {
        return pool;
    }

    // ==================== Internals ====================

    private CompletableFuture<?> dispatchSafely(Operation operation) {
        try {
            return dispatch(operation);
        } catch (RuntimeException e) {
            return failed(e);
        }
    }

    private CompletableFuture<?> dispatch(Operation operation) {
        if (operation instanceof Operation.CreateOp create) {
            return createResource(create.value(), create.frequency());
        }
        if (operation instanceof Operation.SignOp sign) {
            return deriveSignature(sign.resourceId(), sign.data());
        }
        if (operation instanceof Operation.VerifyOp verify) {
            return verifySignature(verify.resourceId(), verify.signature(), verify.data());
        }
        if (operation instanceof Operation.AdaptOp adapt) {
            return proposeAdaptation(adapt.resourceId(), adapt.newValue(), adapt.newFrequency());
        }
        return failed(new IllegalArgumentException("Unsupported operation: " + operation));
    }

    private <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        operations.incrementAndGet();
        return future.whenComplete((result, error) -> {
            if (error != null) {
                failedOperations.incrementAndGet();
            }
        });
    }

    private <T> CompletableFuture<T> failed(Throwable error) {
        operations.incrementAndGet();
        failedOperations.incrementAndGet();
        return CompletableFuture.failedFuture(error);
    }

    private <T> Optional<CompletableFuture<T>> rejectUnlessRunning() {
        State current = state.get();
        if (current == State.RUNNING) {
            return Optional.empty();
        }
        return Optional.of(failed(new ComponentUnavailableException(SOURCE, "coordinator is " + current)));
    }

    private void runHealthCheck() {
        try {
            healthMonitor.check();
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
        }
    }

    private void runLoadBalance() {
        try {
            rebalanceLoad();
        } catch (RuntimeException e) {
            log.error("Load balance pass failed", e);
        }
    }

    private static String resourceKey(String resourceId) {
        return RESOURCE_KEY_PREFIX + resourceId;
    }

    private static CompletableFuture<PeerAck> noTransport(String peerId, PeerMessage message, Duration timeout) {
        return CompletableFuture.failedFuture(new PeerSendException(peerId, "no peer transport configured"));
    }

    private static ScheduledExecutorService newScheduler(String nodeId) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "keyforge-" + nodeId + "-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Coordinator lifecycle states.
     */
    public enum State {
        CREATED,
        RUNNING,
        STOPPING,
        STOPPED
    }

    /**
     * Collaborators for a {@link Coordinator}. Only the configuration is required.
     */
    public static final class Builder {
        private final KeyforgeConfig config;
        private CryptoBackend cryptoBackend;
        private PeerTransport transport;
        private boolean retryingTransport;
        private RemoteCacheStore remoteCache;
        private Collection<String> peers = List.of();
        private ProposalEvaluator evaluator;
        private EventBus eventBus;
        private Clock clock;

        private Builder(KeyforgeConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("Configuration cannot be null");
            }
            this.config = config;
        }

        public Builder cryptoBackend(CryptoBackend cryptoBackend) {
            this.cryptoBackend = cryptoBackend;
            return this;
        }

        public Builder transport(PeerTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Wraps the transport in a {@link RetryingPeerTransport}.
         */
        public Builder retryingTransport(boolean enabled) {
            this.retryingTransport = enabled;
            return this;
        }

        public Builder remoteCache(RemoteCacheStore remoteCache) {
            this.remoteCache = remoteCache;
            return this;
        }

        public Builder peers(Collection<String> peers) {
            this.peers = peers != null ? List.copyOf(peers) : List.of();
            return this;
        }

        public Builder evaluator(ProposalEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Coordinator build() {
            return new Coordinator(this);
        }
    }
}
