package com.keyforge.node.resource;

import com.keyforge.core.config.ConsensusSettings;
import com.keyforge.core.domain.AdaptationOutcome;
import com.keyforge.core.domain.AdaptationOutcome.Reason;
import com.keyforge.core.domain.AdaptationRecord;
import com.keyforge.core.domain.ComplexityTier;
import com.keyforge.core.domain.Energy;
import com.keyforge.core.domain.EnergyDelta;
import com.keyforge.core.domain.KeyRef;
import com.keyforge.core.domain.ResourceSnapshot;
import com.keyforge.core.error.ComponentUnavailableException;
import com.keyforge.core.error.ConsensusRejectedException;
import com.keyforge.core.error.ConsensusTimeoutException;
import com.keyforge.core.error.Failures;
import com.keyforge.core.error.KeyforgeException;
import com.keyforge.core.error.PeerSendException;
import com.keyforge.core.error.ResourceLockedException;
import com.keyforge.core.error.ResourceNotFoundException;
import com.keyforge.core.spi.CryptoBackend;
import com.keyforge.core.spi.PeerAck;
import com.keyforge.core.spi.PeerMessage;
import com.keyforge.core.spi.PeerMessageType;
import com.keyforge.core.spi.PeerTransport;
import com.keyforge.node.consensus.Proposal;
import com.keyforge.node.consensus.ProposalEvaluator;
import com.keyforge.node.consensus.ProposalMessage;
import com.keyforge.node.consensus.ProposalStatus;
import com.keyforge.node.consensus.QuorumMath;
import com.keyforge.node.consensus.VoteMessage;
import com.keyforge.node.event.EventBus;
import com.keyforge.node.event.NodeEvent;
import com.keyforge.node.event.NodeEventType;
import com.keyforge.node.health.ManagedComponent;
import com.keyforge.node.pool.Task;
import com.keyforge.node.pool.TaskType;
import com.keyforge.node.pool.WorkerPool;
import com.keyforge.node.transport.PeerMessageCodec;
import com.keyforge.node.transport.PeerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns this node's resources and drives their adaptation through peer consensus.
 * <p>
 * Per resource: {@code Unlocked → Voting → Unlocked[v+1]} when a proposal is approved,
 * {@code Voting → Unlocked[v]} when it is rejected or expires. While a round or a
 * migration is in progress the resource is locked and no further proposal or migration
 * is accepted. The consensus version only ever moves by one, on commit.
 * <p>
 * Replication, update propagation and proposal broadcast are best-effort: failures are
 * logged and counted but never fail the caller.
 */
public class AdaptiveResourceManager implements ManagedComponent {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveResourceManager.class);
    private static final String COMPONENT = "resource-manager";

    private final String nodeId;
    private final ConsensusSettings settings;
    private final PeerTransport transport;
    private final PeerRegistry peers;
    private final WorkerPool pool;
    private final CryptoBackend backend;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ProposalEvaluator evaluator;
    private final PeerMessageCodec codec = new PeerMessageCodec();

    private final Map<String, ResourceHandle> resources = new ConcurrentHashMap<>();
    private final Map<String, ResourceSnapshot> replicas = new ConcurrentHashMap<>();
    private final Map<String, Proposal> proposals = new ConcurrentHashMap<>();
    private volatile boolean closed;

    private final AtomicLong adaptations = new AtomicLong();
    private final AtomicLong consensusReached = new AtomicLong();
    private final AtomicLong consensusRejected = new AtomicLong();
    private final AtomicLong consensusTimedOut = new AtomicLong();
    private final AtomicLong adaptationFailures = new AtomicLong();
    private final AtomicLong migrations = new AtomicLong();
    private final AtomicLong migrationFailures = new AtomicLong();
    private final AtomicLong replicationFailures = new AtomicLong();

    public AdaptiveResourceManager(PeerRegistry peers, ConsensusSettings settings, PeerTransport transport,
                                   WorkerPool pool, CryptoBackend backend, EventBus eventBus,
                                   ScheduledExecutorService scheduler, Clock clock, ProposalEvaluator evaluator) {
        this.peers = Objects.requireNonNull(peers, "Peer registry cannot be null");
        this.nodeId = peers.localNodeId();
        this.settings = Objects.requireNonNull(settings, "Consensus settings cannot be null");
        this.transport = Objects.requireNonNull(transport, "Peer transport cannot be null");
        this.pool = Objects.requireNonNull(pool, "Worker pool cannot be null");
        this.backend = Objects.requireNonNull(backend, "Crypto backend cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.evaluator = evaluator != null ? evaluator : ProposalEvaluator.consistentEnergy();
    }

    public String nodeId() {
        return nodeId;
    }

    // ==================== Registration ====================

    /**
     * Registers a new resource at consensus version 1 and replicates it to every known
     * peer. Peers that acknowledge join the replica set.
     *
     * @return future completed with the snapshot after all replication attempts settled
     */
    public CompletableFuture<ResourceSnapshot> registerResource(String id, BigInteger value, BigInteger frequency,
                                                                ComplexityTier initialTier, KeyRef keyRef) {
        if (closed) {
            return CompletableFuture.failedFuture(new ComponentUnavailableException(COMPONENT, "manager is shut down"));
        }
        Objects.requireNonNull(id, "Resource ID cannot be null");
        BigInteger energy = Energy.of(value, frequency);
        ResourceHandle handle = new ResourceHandle(id, nodeId, value, frequency,
                initialTier != null ? initialTier : ComplexityTier.forEnergy(energy), keyRef, clock.instant());
        if (resources.putIfAbsent(id, handle) != null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Resource already registered: " + id));
        }
        log.info("Registered resource {} at tier {}", id, handle.tier());
        eventBus.emit(new NodeEvent(NodeEventType.RESOURCE_REGISTERED, COMPONENT, id,
                "Registered at " + handle.tier(), Map.of("tier", handle.tier().name())));

        PeerMessage message = codec.encode(PeerMessageType.REPLICATE, nodeId, id, handle.snapshot());
        List<CompletableFuture<Void>> sends = new ArrayList<>();
        for (String peerId : peers.peers()) {
            sends.add(sendBestEffort(peerId, message).thenAccept(ack -> {
                if (ack.isPresent()) {
                    handle.addReplica(peerId);
                } else {
                    replicationFailures.incrementAndGet();
                    eventBus.emit(new NodeEvent(NodeEventType.REPLICATION_FAILED, COMPONENT, id,
                            "Replication to " + peerId + " failed", Map.of("peerId", peerId)));
                }
            }));
        }
        return CompletableFuture.allOf(sends.toArray(CompletableFuture<?>[]::new))
                .thenApply(v -> handle.snapshot());
    }

    // ==================== Adaptation ====================

    /**
     * Starts a consensus round if the energy change and the time since the last
     * adaptation warrant one.
     *
     * @return the outcome once the round is decided; "not adapted" outcomes complete
     * normally, a failed key regeneration fails the future
     */
    public CompletableFuture<AdaptationOutcome> evaluateAdaptation(String id, BigInteger newValue,
                                                                   BigInteger newFrequency) {
        ResourceHandle handle = resources.get(id);
        if (handle == null) {
            return CompletableFuture.failedFuture(new ResourceNotFoundException(id));
        }
        if (closed) {
            return CompletableFuture.failedFuture(new ComponentUnavailableException(COMPONENT, "manager is shut down"));
        }
        if (handle.isLocked()) {
            return CompletableFuture.completedFuture(AdaptationOutcome.notAdapted(id, Reason.RESOURCE_LOCKED,
                    "Resource is locked by another round", handle.consensusVersion()));
        }
        BigInteger energyAfter = Energy.of(newValue, newFrequency);
        EnergyDelta delta = EnergyDelta.between(handle.energy(), energyAfter);
        Instant now = clock.instant();
        Duration sinceLast = Duration.between(handle.lastAdaptation(), now);
        boolean intervalPassed = settings.minAdaptationInterval().isZero()
                || sinceLast.compareTo(settings.minAdaptationInterval()) > 0;
        if (!delta.exceeds(settings.energyChangeThreshold()) || !intervalPassed) {
            return CompletableFuture.completedFuture(AdaptationOutcome.notAdapted(id, Reason.NO_ADAPTATION_REQUIRED,
                    "Energy change " + delta.changeRatio() + " within threshold or adapted too recently",
                    handle.consensusVersion()));
        }
        if (!handle.tryLock()) {
            return CompletableFuture.completedFuture(AdaptationOutcome.notAdapted(id, Reason.RESOURCE_LOCKED,
                    "Resource is locked by another round", handle.consensusVersion()));
        }

        int required = QuorumMath.requiredVotes(handle.replicas().size(), settings.quorumRatio());
        Proposal proposal = new Proposal(UUID.randomUUID().toString(), id, nodeId, handle.consensusVersion(),
                newValue, newFrequency, delta, required, now, now.plus(settings.proposalTimeout()));
        proposals.put(proposal.id(), proposal);
        log.info("Proposal {} for {}: energy {} -> {}, {} of {} votes required", proposal.id(), id,
                delta.before(), delta.after(), required, handle.replicas().size());
        eventBus.emit(new NodeEvent(NodeEventType.PROPOSAL_CREATED, COMPONENT, proposal.id(), null,
                Map.of("resourceId", id, "requiredVotes", required)));

        try {
            scheduler.schedule(() -> expire(proposal), settings.proposalTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Expiry for proposal {} could not be scheduled: {}", proposal.id(), e.getMessage());
        }

        PeerMessage message = codec.encode(PeerMessageType.ADAPTATION_PROPOSAL, nodeId, id, proposal.toMessage());
        for (String peerId : handle.replicas()) {
            if (!peerId.equals(nodeId)) {
                sendBestEffort(peerId, message);
            }
        }
        // a single-replica resource is decided by the proposer's own vote
        resolveIfDecided(proposal);
        return proposal.outcome();
    }

    /**
     * Records a vote on an open proposal. Votes from outside the replica set, repeated
     * votes and votes on a decided proposal are ignored. A vote arriving after the expiry
     * closes the round as timed out.
     *
     * @return true if the vote was counted
     */
    public boolean vote(String proposalId, String voterId, boolean approve) {
        Proposal proposal = proposals.get(proposalId);
        if (proposal == null) {
            log.debug("Vote from {} for unknown or closed proposal {}", voterId, proposalId);
            return false;
        }
        ResourceHandle handle = resources.get(proposal.resourceId());
        if (handle == null || !handle.replicas().contains(voterId)) {
            log.debug("Ignoring vote from non-replica {} on {}", voterId, proposalId);
            return false;
        }
        Instant now = clock.instant();
        if (proposal.isExpiredAt(now)) {
            log.debug("Vote from {} arrived after proposal {} expired", voterId, proposalId);
            expire(proposal);
            return false;
        }
        if (!proposal.recordVote(voterId, approve, now)) {
            return false;
        }
        eventBus.emit(new NodeEvent(NodeEventType.VOTE_RECORDED, COMPONENT, proposalId, null,
                Map.of("voterId", voterId, "approve", approve)));
        resolveIfDecided(proposal);
        return true;
    }

    public Optional<Proposal> getProposal(String proposalId) {
        return Optional.ofNullable(proposals.get(proposalId));
    }

    // ==================== Migration ====================

    /**
     * Hands the resource over to another peer. The local copy is dropped only after the
     * peer acknowledged; otherwise it is kept, unlocked, and the future fails with
     * {@link PeerSendException}.
     */
    public CompletableFuture<MigrationReceipt> migrate(String id, String targetPeer) {
        ResourceHandle handle = resources.get(id);
        if (handle == null) {
            return CompletableFuture.failedFuture(new ResourceNotFoundException(id));
        }
        if (!handle.tryLock()) {
            return CompletableFuture.failedFuture(new ResourceLockedException(id));
        }
        ResourceSnapshot snapshot = handle.snapshot();
        PeerMessage message = codec.encode(PeerMessageType.MIGRATE, nodeId, id, snapshot);
        log.info("Migrating {} at version {} to {}", id, snapshot.consensusVersion(), targetPeer);
        return send(targetPeer, message).handle((ack, error) -> {
            if (error == null && ack.accepted()) {
                resources.remove(id, handle);
                migrations.incrementAndGet();
                eventBus.emit(new NodeEvent(NodeEventType.RESOURCE_MIGRATED, COMPONENT, id,
                        "Migrated to " + targetPeer, Map.of("targetPeer", targetPeer)));
                return new MigrationReceipt(id, targetPeer, snapshot.consensusVersion(), clock.instant());
            }
            handle.unlock();
            migrationFailures.incrementAndGet();
            PeerSendException failure = error != null
                    ? asSendFailure(targetPeer, error)
                    : new PeerSendException(targetPeer, "migration refused: " + ack.detail());
            log.warn("Migration of {} to {} failed, keeping local copy: {}", id, targetPeer, failure.getMessage());
            eventBus.emit(new NodeEvent(NodeEventType.MIGRATION_FAILED, COMPONENT, id, failure.getMessage(),
                    Map.of("targetPeer", targetPeer)));
            throw failure;
        });
    }

    // ==================== Inbound protocol ====================

    /**
     * Handles a message delivered by the transport and returns the acknowledgement to send
     * back to its sender.
     */
    public PeerAck handleInbound(PeerMessage message) {
        try {
            return switch (message.type()) {
                case REPLICATE, RESOURCE_UPDATE -> storeReplica(message);
                case MIGRATE -> adoptMigrated(message);
                case ADAPTATION_PROPOSAL -> answerProposal(message);
                case VOTE -> tallyVote(message);
                case PING -> PeerAck.accepted(nodeId, message.messageId());
            };
        } catch (KeyforgeException | IllegalArgumentException e) {
            log.warn("Rejected {} from {}: {}", message.type(), message.senderId(), e.getMessage());
            return PeerAck.refused(nodeId, message.messageId(), e.getMessage());
        }
    }

    private PeerAck storeReplica(PeerMessage message) {
        ResourceSnapshot snapshot = codec.decode(message, ResourceSnapshot.class);
        replicas.merge(snapshot.id(), snapshot,
                (current, incoming) -> incoming.consensusVersion() >= current.consensusVersion() ? incoming : current);
        log.debug("Stored replica of {} at version {} from {}", snapshot.id(), snapshot.consensusVersion(),
                message.senderId());
        return PeerAck.accepted(nodeId, message.messageId());
    }

    private PeerAck adoptMigrated(PeerMessage message) {
        if (closed) {
            return PeerAck.refused(nodeId, message.messageId(), "manager is shut down");
        }
        ResourceSnapshot snapshot = codec.decode(message, ResourceSnapshot.class);
        ResourceHandle adopted = ResourceHandle.adopt(snapshot, nodeId);
        if (resources.putIfAbsent(snapshot.id(), adopted) != null) {
            return PeerAck.refused(nodeId, message.messageId(), "resource already managed here");
        }
        replicas.remove(snapshot.id());
        log.info("Adopted resource {} at version {} from {}", snapshot.id(), snapshot.consensusVersion(),
                message.senderId());
        eventBus.emit(new NodeEvent(NodeEventType.MIGRATION_RECEIVED, COMPONENT, snapshot.id(),
                "Migrated from " + message.senderId(), Map.of("sourcePeer", message.senderId())));
        return PeerAck.accepted(nodeId, message.messageId());
    }

    private PeerAck answerProposal(PeerMessage message) {
        ProposalMessage proposal = codec.decode(message, ProposalMessage.class);
        Optional<ResourceSnapshot> local = Optional.ofNullable(replicas.get(proposal.resourceId()))
                .or(() -> getResource(proposal.resourceId()));
        boolean approve = evaluator.evaluate(proposal, local);
        log.debug("Voting {} on proposal {} from {}", approve ? "for" : "against", proposal.proposalId(),
                proposal.proposerId());
        VoteMessage vote = new VoteMessage(proposal.proposalId(), proposal.resourceId(), nodeId, approve);
        sendBestEffort(message.senderId(), codec.encode(PeerMessageType.VOTE, nodeId, proposal.resourceId(), vote));
        return PeerAck.accepted(nodeId, message.messageId());
    }

    private PeerAck tallyVote(PeerMessage message) {
        VoteMessage vote = codec.decode(message, VoteMessage.class);
        // the transport-level sender is authoritative over the payload's voter id
        if (vote(vote.proposalId(), message.senderId(), vote.approve())) {
            return PeerAck.accepted(nodeId, message.messageId());
        }
        return PeerAck.refused(nodeId, message.messageId(), "vote not counted");
    }

    // ==================== Queries ====================

    public Optional<ResourceSnapshot> getResource(String id) {
        return Optional.ofNullable(resources.get(id)).map(ResourceHandle::snapshot);
    }

    public Optional<ResourceSnapshot> getReplica(String id) {
        return Optional.ofNullable(replicas.get(id));
    }

    public List<ResourceSnapshot> listResources() {
        return resources.values().stream().map(ResourceHandle::snapshot).toList();
    }

    public ResourceStats getStats() {
        int open = (int) proposals.values().stream().filter(p -> p.status() == ProposalStatus.OPEN).count();
        return new ResourceStats(
                resources.size(),
                replicas.size(),
                open,
                adaptations.get(),
                consensusReached.get(),
                consensusRejected.get(),
                consensusTimedOut.get(),
                adaptationFailures.get(),
                migrations.get(),
                migrationFailures.get(),
                replicationFailures.get());
    }

    // ==================== Lifecycle ====================

    /**
     * Refuses further work and expires every open proposal.
     */
    public void shutdown() {
        closed = true;
        List<Proposal> open = new ArrayList<>(proposals.values());
        open.forEach(this::expire);
        log.info("Resource manager stopped with {} resources", resources.size());
    }

    @Override
    public String componentName() {
        return COMPONENT;
    }

    @Override
    public void ping() {
        if (closed) {
            throw new ComponentUnavailableException(COMPONENT, "manager is shut down");
        }
    }

    /**
     * Expires proposals whose deadline passed without the scheduled expiry running.
     */
    @Override
    public void recover() {
        Instant now = clock.instant();
        for (Proposal proposal : new ArrayList<>(proposals.values())) {
            if (proposal.isExpiredAt(now)) {
                expire(proposal);
            }
        }
    }

    // ==================== Internals ====================

    private void resolveIfDecided(Proposal proposal) {
        ProposalStatus status = proposal.decide();
        if (status == ProposalStatus.APPROVED) {
            commit(proposal);
        } else if (status == ProposalStatus.REJECTED) {
            reject(proposal);
        }
    }

    private void commit(Proposal proposal) {
        ResourceHandle handle = resources.get(proposal.resourceId());
        if (handle == null) {
            // cannot happen while the handle is locked, migration requires the lock
            finish(proposal);
            proposal.outcome().completeExceptionally(new ResourceNotFoundException(proposal.resourceId()));
            return;
        }
        consensusReached.incrementAndGet();
        ComplexityTier oldTier = handle.tier();
        ComplexityTier newTier = ComplexityTier.forEnergy(proposal.metrics().after());
        CompletableFuture<KeyRef> rotation;
        if (newTier != oldTier) {
            rotation = pool.submit(Task.forValue(TaskType.GENERATE_KEY_MATERIAL, proposal.newValue(),
                    () -> backend.generateKeyMaterial(newTier)));
        } else {
            rotation = CompletableFuture.completedFuture(null);
        }
        rotation.whenComplete((keyRef, error) -> {
            if (error != null) {
                KeyforgeException failure = Failures.asKeyforge(error, "Key regeneration failed");
                handle.unlock();
                finish(proposal);
                adaptationFailures.incrementAndGet();
                log.error("Proposal {} approved but key regeneration failed: {}", proposal.id(), failure.getMessage());
                eventBus.emit(new NodeEvent(NodeEventType.ADAPTATION_FAILED, COMPONENT, proposal.resourceId(),
                        failure.getMessage(), Map.of("proposalId", proposal.id())));
                proposal.outcome().completeExceptionally(failure);
                return;
            }
            AdaptationRecord committed = handle.commit(proposal.id(), proposal.newValue(), proposal.newFrequency(), newTier, keyRef,
                    proposal.metrics().changeRatio(), clock.instant());
            handle.unlock();
            finish(proposal);
            adaptations.incrementAndGet();
            log.info("Resource {} adapted to version {} ({} -> {}, key rotated: {})", proposal.resourceId(),
                    committed.resultingVersion(), oldTier, newTier, committed.keyRotated());
            eventBus.emit(new NodeEvent(NodeEventType.RESOURCE_ADAPTED, COMPONENT, proposal.resourceId(), null,
                    Map.of("proposalId", proposal.id(),
                            "version", committed.resultingVersion(),
                            "tier", newTier.name(),
                            "keyRotated", committed.keyRotated())));
            propagateUpdate(handle);
            proposal.outcome().complete(AdaptationOutcome.adapted(proposal.resourceId(), proposal.id(), newTier,
                    committed.resultingVersion()));
        });
    }

    private void reject(Proposal proposal) {
        ResourceHandle handle = resources.get(proposal.resourceId());
        long version = handle != null ? handle.consensusVersion() : proposal.baseVersion();
        if (handle != null) {
            handle.unlock();
        }
        finish(proposal);
        consensusRejected.incrementAndGet();
        ConsensusRejectedException failure = new ConsensusRejectedException(proposal.id(), proposal.approvals(),
                proposal.requiredVotes());
        log.info("{}", failure.getMessage());
        eventBus.emit(new NodeEvent(NodeEventType.ADAPTATION_REJECTED, COMPONENT, proposal.resourceId(),
                failure.getMessage(), Map.of("proposalId", proposal.id())));
        proposal.outcome().complete(AdaptationOutcome.failedConsensus(proposal.resourceId(),
                Reason.CONSENSUS_REJECTED, proposal.id(), version, failure));
    }

    private void expire(Proposal proposal) {
        if (!proposal.expire()) {
            return;
        }
        ResourceHandle handle = resources.get(proposal.resourceId());
        long version = handle != null ? handle.consensusVersion() : proposal.baseVersion();
        if (handle != null) {
            handle.unlock();
        }
        finish(proposal);
        consensusTimedOut.incrementAndGet();
        ConsensusTimeoutException failure = new ConsensusTimeoutException(proposal.id(), proposal.voteCount(),
                proposal.requiredVotes());
        log.warn("{}", failure.getMessage());
        eventBus.emit(new NodeEvent(NodeEventType.ADAPTATION_EXPIRED, COMPONENT, proposal.resourceId(),
                failure.getMessage(), Map.of("proposalId", proposal.id())));
        proposal.outcome().complete(AdaptationOutcome.failedConsensus(proposal.resourceId(),
                Reason.CONSENSUS_TIMEOUT, proposal.id(), version, failure));
    }

    private void finish(Proposal proposal) {
        proposals.remove(proposal.id(), proposal);
    }

    private void propagateUpdate(ResourceHandle handle) {
        ResourceSnapshot snapshot = handle.snapshot();
        PeerMessage message = codec.encode(PeerMessageType.RESOURCE_UPDATE, nodeId, snapshot.id(), snapshot);
        for (String peerId : snapshot.replicaSet()) {
            if (!peerId.equals(nodeId)) {
                sendBestEffort(peerId, message);
            }
        }
    }

    private CompletableFuture<PeerAck> send(String peerId, PeerMessage message) {
        try {
            return transport.send(peerId, message, settings.peerSendTimeout());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Sends without failing the caller. Completes with the ack when the peer accepted,
     * empty when it refused or delivery failed.
     */
    private CompletableFuture<Optional<PeerAck>> sendBestEffort(String peerId, PeerMessage message) {
        return send(peerId, message).handle((ack, error) -> {
            if (error != null) {
                log.warn("{} for {} to {} failed: {}", message.type(), message.resourceId(), peerId,
                        Failures.unwrap(error).getMessage());
                return Optional.<PeerAck>empty();
            }
            if (!ack.accepted()) {
                log.warn("{} for {} refused by {}: {}", message.type(), message.resourceId(), peerId, ack.detail());
                return Optional.<PeerAck>empty();
            }
            return Optional.of(ack);
        });
    }

    private static PeerSendException asSendFailure(String peerId, Throwable error) {
        Throwable cause = Failures.unwrap(error);
        if (cause instanceof PeerSendException send) {
            return send;
        }
        return new PeerSendException(peerId, cause.getMessage(), cause);
    }
}
