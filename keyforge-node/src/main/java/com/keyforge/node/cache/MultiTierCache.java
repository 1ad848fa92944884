package com.keyforge.node.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.keyforge.core.config.CacheSettings;
import com.keyforge.core.error.ComponentUnavailableException;
import com.keyforge.core.spi.RemoteCacheStore;
import com.keyforge.node.event.EventBus;
import com.keyforge.node.event.NodeEvent;
import com.keyforge.node.event.NodeEventType;
import com.keyforge.node.health.ManagedComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Three local tiers (HOT, WARM, COLD) in front of an optional remote store.
 * <p>
 * A key lives in at most one local tier. Lookups walk the tiers fastest first, promote a
 * hit one tier up and fall back to the remote store on a local miss; remote hits land in
 * WARM. Each tier holds at most {@code tierCapacity} entries and evicts its least recently
 * accessed entry when full. Entries expire {@code ttl} after they were written.
 * <p>
 * Periodic maintenance started by {@link #start()} sweeps expired entries and rebalances
 * tiers by access count and inactivity. Remote store failures are logged, counted and
 * treated as misses.
 */
public class MultiTierCache implements ManagedComponent {

    private static final Logger log = LoggerFactory.getLogger(MultiTierCache.class);
    private static final String COMPONENT = "multi-tier-cache";

    private final CacheSettings settings;
    private final RemoteCacheStore remote;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ObjectMapper sizeMapper;

    private final Map<CacheTier, LinkedHashMap<String, CacheEntry>> tiers = new EnumMap<>(CacheTier.class);
    private final Map<CacheTier, Long> tierHits = new EnumMap<>(CacheTier.class);
    private long remoteHits;
    private long misses;
    private long evictions;
    private long expirations;
    private long promotions;
    private long demotions;
    private long remoteErrors;

    private ScheduledFuture<?> sweepTask;
    private ScheduledFuture<?> rebalanceTask;
    private boolean closed;

    public MultiTierCache(CacheSettings settings, RemoteCacheStore remote, EventBus eventBus,
                          ScheduledExecutorService scheduler, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "Cache settings cannot be null");
        this.remote = remote;
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.scheduler = scheduler;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.sizeMapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
        for (CacheTier tier : CacheTier.values()) {
            tiers.put(tier, new LinkedHashMap<>());
            tierHits.put(tier, 0L);
        }
    }

    /**
     * Schedules the expiry sweep and the tier rebalance on the shared scheduler.
     */
    public synchronized void start() {
        if (scheduler == null) {
            throw new IllegalStateException("No scheduler configured for cache maintenance");
        }
        if (sweepTask != null) {
            return;
        }
        closed = false;
        long sweepMillis = settings.sweepInterval().toMillis();
        long rebalanceMillis = settings.rebalanceInterval().toMillis();
        sweepTask = scheduler.scheduleAtFixedRate(this::runSweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
        rebalanceTask = scheduler.scheduleAtFixedRate(this::runRebalance, rebalanceMillis, rebalanceMillis,
                TimeUnit.MILLISECONDS);
        log.debug("Cache maintenance scheduled: sweep every {}ms, rebalance every {}ms", sweepMillis, rebalanceMillis);
    }

    /**
     * Cancels periodic maintenance. Cached entries stay readable.
     */
    public synchronized void stop() {
        closed = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (rebalanceTask != null) {
            rebalanceTask.cancel(false);
            rebalanceTask = null;
        }
    }

    // ==================== Reads ====================

    public Optional<Object> get(String key) {
        List<NodeEvent> events = new ArrayList<>();
        Optional<Object> local = lookupLocal(key, events);
        eventBus.emitAll(events);
        if (local.isPresent()) {
            return local;
        }
        Optional<Object> fetched = fetchRemote(key);
        List<NodeEvent> insertEvents = new ArrayList<>();
        synchronized (this) {
            if (fetched.isEmpty()) {
                misses++;
                return Optional.empty();
            }
            remoteHits++;
            Optional<Object> current = peekLocal(key, Object.class);
            if (current.isPresent()) {
                return current;
            }
            insert(key, fetched.get(), CacheTier.WARM, settings.defaultTtl(), estimateSize(fetched.get()), insertEvents);
        }
        eventBus.emitAll(insertEvents);
        return fetched;
    }

    /**
     * Typed lookup. A cached value of another type counts as a miss.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    /**
     * Reads a live local entry without promoting it, touching it or counting a hit.
     * Never consults the remote store.
     */
    public synchronized <T> Optional<T> peekLocal(String key, Class<T> type) {
        Instant now = clock.instant();
        for (CacheTier tier : CacheTier.values()) {
            CacheEntry entry = tiers.get(tier).get(key);
            if (entry != null) {
                return entry.isExpired(now)
                        ? Optional.empty()
                        : Optional.of(entry.value()).filter(type::isInstance).map(type::cast);
            }
        }
        return Optional.empty();
    }

    public synchronized boolean containsLocal(String key) {
        Instant now = clock.instant();
        for (CacheTier tier : CacheTier.values()) {
            CacheEntry entry = tiers.get(tier).get(key);
            if (entry != null) {
                return !entry.isExpired(now);
            }
        }
        return false;
    }

    /**
     * The tier currently holding the key, without counting as an access.
     */
    public synchronized Optional<CacheTier> tierOf(String key) {
        for (CacheTier tier : CacheTier.values()) {
            if (tiers.get(tier).containsKey(key)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    // ==================== Writes ====================

    public void set(String key, Object value) {
        set(key, value, CacheTier.HOT, settings.defaultTtl());
    }

    public void set(String key, Object value, Duration ttl) {
        set(key, value, CacheTier.HOT, ttl);
    }

    public void set(String key, Object value, CacheTier tier, Duration ttl) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        CacheTier target = tier != null ? tier : CacheTier.HOT;
        Duration effectiveTtl = ttl != null ? ttl : settings.defaultTtl();
        long size = estimateSize(value);
        List<NodeEvent> events = new ArrayList<>();
        synchronized (this) {
            removeLocal(key);
            insert(key, value, target, effectiveTtl, size, events);
        }
        eventBus.emitAll(events);
        if (remote != null && size >= settings.remoteWriteThreshold()) {
            try {
                remote.store(key, value, effectiveTtl);
            } catch (RuntimeException e) {
                recordRemoteError("store", key, e);
            }
        }
    }

    /**
     * Removes the key from every local tier and from the remote store.
     *
     * @return true if a local entry was removed
     */
    public boolean remove(String key) {
        boolean removed;
        synchronized (this) {
            removed = removeLocal(key) != null;
        }
        if (remote != null) {
            try {
                remote.evict(key);
            } catch (RuntimeException e) {
                recordRemoteError("evict", key, e);
            }
        }
        return removed;
    }

    public synchronized void clear() {
        for (CacheTier tier : CacheTier.values()) {
            tiers.get(tier).clear();
        }
    }

    public synchronized void clear(CacheTier tier) {
        tiers.get(tier).clear();
    }

    /**
     * Computes and stores a value in COLD unless the key is already cached locally.
     *
     * @return true if the supplier ran
     */
    public boolean prefetch(String key, Supplier<?> supplier) {
        if (containsLocal(key)) {
            return false;
        }
        Object value = supplier.get();
        if (value == null) {
            return false;
        }
        set(key, value, CacheTier.COLD, settings.defaultTtl());
        return true;
    }

    // ==================== Maintenance ====================

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        List<NodeEvent> events = new ArrayList<>();
        int removed = 0;
        synchronized (this) {
            Instant now = clock.instant();
            for (CacheTier tier : CacheTier.values()) {
                Iterator<CacheEntry> it = tiers.get(tier).values().iterator();
                while (it.hasNext()) {
                    CacheEntry entry = it.next();
                    if (entry.isExpired(now)) {
                        it.remove();
                        expirations++;
                        removed++;
                        events.add(event(NodeEventType.CACHE_EXPIRED, entry.key(), tier));
                    }
                }
            }
        }
        eventBus.emitAll(events);
        return removed;
    }

    /**
     * Moves frequently read entries up and inactive HOT entries down. Candidates are
     * chosen from the tier layout before any move, so an entry moves at most once per pass.
     *
     * @return number of entries moved
     */
    public int rebalance() {
        int moved;
        List<NodeEvent> events = new ArrayList<>();
        synchronized (this) {
            Instant now = clock.instant();
            List<CacheEntry> fromCold = new ArrayList<>();
            List<CacheEntry> fromWarm = new ArrayList<>();
            List<CacheEntry> fromHot = new ArrayList<>();
            for (CacheEntry entry : tiers.get(CacheTier.COLD).values()) {
                if (entry.accessCount() >= settings.coldPromotionThreshold()) {
                    fromCold.add(entry);
                }
            }
            for (CacheEntry entry : tiers.get(CacheTier.WARM).values()) {
                if (entry.accessCount() >= settings.warmPromotionThreshold()) {
                    fromWarm.add(entry);
                }
            }
            for (CacheEntry entry : tiers.get(CacheTier.HOT).values()) {
                if (Duration.between(entry.lastAccessedAt(), now).compareTo(settings.inactivityWindow()) > 0) {
                    fromHot.add(entry);
                }
            }
            fromHot.forEach(entry -> move(entry, CacheTier.WARM, events));
            demotions += fromHot.size();
            fromWarm.forEach(entry -> move(entry, CacheTier.HOT, events));
            fromCold.forEach(entry -> move(entry, CacheTier.WARM, events));
            promotions += fromWarm.size() + fromCold.size();
            moved = fromHot.size() + fromWarm.size() + fromCold.size();
        }
        eventBus.emitAll(events);
        if (moved > 0) {
            eventBus.emit(new NodeEvent(NodeEventType.CACHE_REBALANCED, COMPONENT, null,
                    moved + " entries moved", Map.of("moved", moved)));
        }
        return moved;
    }

    public synchronized CacheStats getStats() {
        long hot = tierHits.get(CacheTier.HOT);
        long warm = tierHits.get(CacheTier.WARM);
        long cold = tierHits.get(CacheTier.COLD);
        long hits = hot + warm + cold + remoteHits;
        long lookups = hits + misses;
        double weighted = hot * CacheTier.HOT.weight()
                + warm * CacheTier.WARM.weight()
                + cold * CacheTier.COLD.weight()
                + remoteHits * CacheTier.REMOTE_WEIGHT;
        long bytes = 0;
        for (CacheTier tier : CacheTier.values()) {
            for (CacheEntry entry : tiers.get(tier).values()) {
                bytes += entry.sizeEstimate();
            }
        }
        return new CacheStats(
                tiers.get(CacheTier.HOT).size(),
                tiers.get(CacheTier.WARM).size(),
                tiers.get(CacheTier.COLD).size(),
                hot, warm, cold, remoteHits, misses,
                evictions, expirations, promotions, demotions, remoteErrors,
                lookups == 0 ? 0.0 : (double) hits / lookups,
                lookups == 0 ? 0.0 : weighted / lookups,
                bytes);
    }

    @Override
    public String componentName() {
        return COMPONENT;
    }

    @Override
    public synchronized void ping() {
        if (closed) {
            throw new ComponentUnavailableException(COMPONENT, "maintenance stopped");
        }
    }

    /**
     * Drops expired entries and restarts maintenance if it was stopped.
     */
    @Override
    public void recover() {
        sweepExpired();
        synchronized (this) {
            if (closed && scheduler != null && !scheduler.isShutdown()) {
                start();
            }
        }
    }

    // ==================== Internals ====================

    private synchronized Optional<Object> lookupLocal(String key, List<NodeEvent> events) {
        Instant now = clock.instant();
        for (CacheTier tier : CacheTier.values()) {
            CacheEntry entry = tiers.get(tier).get(key);
            if (entry == null) {
                continue;
            }
            if (entry.isExpired(now)) {
                tiers.get(tier).remove(key);
                expirations++;
                events.add(event(NodeEventType.CACHE_EXPIRED, key, tier));
                return Optional.empty();
            }
            entry.touch(now);
            tierHits.merge(tier, 1L, Long::sum);
            if (tier != CacheTier.HOT) {
                move(entry, tier.promoted(), events);
                promotions++;
            }
            return Optional.of(entry.value());
        }
        return Optional.empty();
    }

    private Optional<Object> fetchRemote(String key) {
        if (remote == null) {
            return Optional.empty();
        }
        try {
            return remote.fetch(key);
        } catch (RuntimeException e) {
            recordRemoteError("fetch", key, e);
            return Optional.empty();
        }
    }

    private void insert(String key, Object value, CacheTier tier, Duration ttl, long size, List<NodeEvent> events) {
        makeRoom(tier, events);
        tiers.get(tier).put(key, new CacheEntry(key, value, tier, clock.instant(), ttl, size));
    }

    private void move(CacheEntry entry, CacheTier destination, List<NodeEvent> events) {
        tiers.get(entry.tier()).remove(entry.key());
        makeRoom(destination, events);
        entry.moveTo(destination);
        tiers.get(destination).put(entry.key(), entry);
    }

    private void makeRoom(CacheTier tier, List<NodeEvent> events) {
        LinkedHashMap<String, CacheEntry> entries = tiers.get(tier);
        while (entries.size() >= settings.tierCapacity()) {
            CacheEntry lru = null;
            for (CacheEntry candidate : entries.values()) {
                if (lru == null || candidate.lastAccessedAt().isBefore(lru.lastAccessedAt())) {
                    lru = candidate;
                }
            }
            entries.remove(lru.key());
            evictions++;
            events.add(event(NodeEventType.CACHE_EVICTED, lru.key(), tier));
        }
    }

    private CacheEntry removeLocal(String key) {
        CacheEntry removed = null;
        for (CacheTier tier : CacheTier.values()) {
            CacheEntry entry = tiers.get(tier).remove(key);
            if (entry != null) {
                removed = entry;
            }
        }
        return removed;
    }

    private long estimateSize(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes.length * 2L;
        }
        try {
            return sizeMapper.writeValueAsString(value).length() * 2L;
        } catch (JsonProcessingException e) {
            log.debug("Size estimate for {} fell back to toString: {}", value.getClass().getSimpleName(),
                    e.getOriginalMessage());
            return String.valueOf(value).length() * 2L;
        }
    }

    private void recordRemoteError(String operation, String key, RuntimeException e) {
        synchronized (this) {
            remoteErrors++;
        }
        log.warn("Remote cache {} failed for {}: {}", operation, key, e.getMessage());
        eventBus.emit(new NodeEvent(NodeEventType.REMOTE_CACHE_ERROR, COMPONENT, key, e.getMessage(),
                Map.of("operation", operation)));
    }

    private void runSweep() {
        try {
            int removed = sweepExpired();
            if (removed > 0) {
                log.debug("Swept {} expired cache entries", removed);
            }
        } catch (RuntimeException e) {
            log.error("Cache sweep failed", e);
        }
    }

    private void runRebalance() {
        try {
            rebalance();
        } catch (RuntimeException e) {
            log.error("Cache rebalance failed", e);
        }
    }

    private static NodeEvent event(NodeEventType type, String key, CacheTier tier) {
        return new NodeEvent(type, COMPONENT, key, null, Map.of("tier", tier.name()));
    }
}
