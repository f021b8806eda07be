package com.phillippitts.signbridge.service.cache;

import com.phillippitts.signbridge.exception.CacheDeserializationException;
import com.phillippitts.signbridge.exception.PersistenceException;
import com.phillippitts.signbridge.service.cache.store.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Capacity-bounded, TTL-limited cache with strict least-recently-accessed eviction and
 * whole-namespace persistence to a {@link KeyValueStore}.
 *
 * <p><b>Eviction:</b> when a {@link #set} pushes the size above capacity, exactly one
 * entry is removed: the one with the oldest {@code lastAccessedAt}, ties broken by the
 * earliest {@code createdAt}. Usage frequency plays no part. Expired entries are swept
 * before the capacity check since they are already logically absent.
 *
 * <p><b>Persistence:</b> every successful {@code set} writes the full namespace. On
 * construction the prior state is loaded; a missing or corrupt blob starts the cache
 * empty. Store failures are logged at WARN and flip the cache into memory-only mode
 * ({@link #isPersistenceDegraded()}) until a later write succeeds. They never propagate
 * to callers.
 *
 * <p><b>Thread Safety:</b> reads are lock-free. Writers ({@code set}, eviction,
 * {@code clear}) are serialized by a lock that also covers the store write, so blobs
 * reach the store in the same order as the mutations that produced them.
 *
 * @param <T> payload type
 */
public final class LruContentCache<T> {

    private static final Logger LOG = LogManager.getLogger(LruContentCache.class);

    static final int FORMAT_VERSION = 1;

    private final String namespace;
    private final int capacity;
    private final Duration ttl;
    private final KeyValueStore store;
    private final PayloadCodec<T> codec;
    private final Clock clock;

    private final Map<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean persistenceDegraded = new AtomicBoolean(false);
    private final LongAdder requests = new LongAdder();
    private final LongAdder hits = new LongAdder();

    public LruContentCache(String namespace, int capacity, Duration ttl, KeyValueStore store,
                           PayloadCodec<T> codec, Clock clock) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        load();
    }

    /**
     * Returns the entry if present and not expired. A hit increments the usage count and
     * refreshes {@code lastAccessedAt}; a miss leaves entries untouched except that an
     * expired entry found under the key is dropped.
     */
    public Optional<CacheEntry<T>> get(String key) {
        requests.increment();
        if (key == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        CacheEntry<T> current = entries.get(key);
        if (current == null) {
            LOG.debug("[{}] MISS {}", namespace, key);
            return Optional.empty();
        }
        if (current.isExpired(now, ttl)) {
            entries.remove(key, current);
            LOG.debug("[{}] EXPIRED {}", namespace, key);
            return Optional.empty();
        }
        CacheEntry<T> touched = entries.computeIfPresent(key,
                (k, e) -> e.isExpired(now, ttl) ? e : e.touched(now));
        if (touched == null || touched.isExpired(now, ttl)) {
            return Optional.empty();
        }
        hits.increment();
        LOG.debug("[{}] HIT {} (usage={})", namespace, key, touched.usageCount());
        return Optional.of(touched);
    }

    /**
     * Stores a fresh entry (usage count 1), evicts at most one entry if over capacity,
     * then persists the namespace.
     */
    public void set(String key, T payload) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
        writeLock.lock();
        try {
            Instant now = clock.instant();
            entries.put(key, CacheEntry.fresh(key, payload, now));
            sweepExpired(now);
            if (entries.size() > capacity) {
                selectVictim(key).ifPresent(victim -> {
                    entries.remove(victim);
                    LOG.debug("[{}] Evicted LRU entry {}", namespace, victim);
                });
            }
            persist();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes expired entries and persists the result if anything was removed.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        writeLock.lock();
        try {
            int before = entries.size();
            sweepExpired(clock.instant());
            int removed = before - entries.size();
            if (removed > 0) {
                LOG.debug("[{}] Purged {} expired entries", namespace, removed);
                persist();
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Empties the cache and removes its persisted blob.
     */
    public void clear() {
        writeLock.lock();
        try {
            entries.clear();
            try {
                store.remove(namespace);
            } catch (PersistenceException e) {
                markDegraded("clear", e);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Keys ordered by usage count, highest first.
     */
    public List<String> mostUsedKeys(int limit) {
        return entries.values().stream()
                .sorted(Comparator.comparingLong((CacheEntry<T> e) -> e.usageCount()).reversed())
                .limit(Math.max(0, limit))
                .map(CacheEntry::key)
                .toList();
    }

    public CacheMetrics metrics() {
        long total = requests.sum();
        long hitCount = hits.sum();
        long bytes = serialize().getBytes(StandardCharsets.UTF_8).length;
        return new CacheMetrics(total == 0 ? 0.0 : (double) hitCount / total, total, hitCount,
                entries.size(), bytes);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public String namespace() {
        return namespace;
    }

    public boolean isPersistenceDegraded() {
        return persistenceDegraded.get();
    }

    // Caller holds writeLock. The just-inserted key is never the victim.
    private Optional<String> selectVictim(String insertedKey) {
        return entries.values().stream()
                .filter(e -> !e.key().equals(insertedKey))
                .min(Comparator.comparing((CacheEntry<T> e) -> e.lastAccessedAt())
                        .thenComparing(CacheEntry::createdAt))
                .map(CacheEntry::key);
    }

    private void sweepExpired(Instant now) {
        entries.values().removeIf(e -> e.isExpired(now, ttl));
    }

    private void persist() {
        try {
            store.set(namespace, serialize());
            if (persistenceDegraded.compareAndSet(true, false)) {
                LOG.info("[{}] Persistence recovered", namespace);
            }
        } catch (PersistenceException e) {
            markDegraded("write", e);
        }
    }

    String serialize() {
        JSONObject items = new JSONObject();
        for (CacheEntry<T> e : entries.values()) {
            items.put(e.key(), new JSONObject()
                    .put("payload", codec.encode(e.payload()))
                    .put("createdAt", e.createdAt().toEpochMilli())
                    .put("lastAccessedAt", e.lastAccessedAt().toEpochMilli())
                    .put("usageCount", e.usageCount()));
        }
        return new JSONObject().put("version", FORMAT_VERSION).put("entries", items).toString();
    }

    private void load() {
        Optional<String> blob;
        try {
            blob = store.get(namespace);
        } catch (PersistenceException e) {
            markDegraded("read", e);
            return;
        }
        if (blob.isEmpty()) {
            LOG.debug("[{}] No persisted state, starting empty", namespace);
            return;
        }
        try {
            List<CacheEntry<T>> loaded = deserialize(blob.get());
            Instant now = clock.instant();
            loaded.stream()
                    .filter(e -> !e.isExpired(now, ttl))
                    .sorted(Comparator.comparing((CacheEntry<T> e) -> e.lastAccessedAt()).reversed())
                    .limit(capacity)
                    .forEach(e -> entries.put(e.key(), e));
            LOG.info("[{}] Loaded {} cache entries", namespace, entries.size());
        } catch (CacheDeserializationException e) {
            entries.clear();
            LOG.warn("[{}] Ignoring corrupt persisted cache: {}", namespace, e.getMessage());
        }
    }

    private List<CacheEntry<T>> deserialize(String blob) {
        try {
            JSONObject root = new JSONObject(blob);
            JSONObject items = root.getJSONObject("entries");
            List<CacheEntry<T>> result = new ArrayList<>(items.length());
            for (String key : items.keySet()) {
                JSONObject item = items.getJSONObject(key);
                result.add(new CacheEntry<>(key,
                        codec.decode(item.getJSONObject("payload")),
                        Instant.ofEpochMilli(item.getLong("createdAt")),
                        Instant.ofEpochMilli(item.getLong("lastAccessedAt")),
                        item.getLong("usageCount")));
            }
            return result;
        } catch (JSONException | IllegalArgumentException | NullPointerException e) {
            throw new CacheDeserializationException(namespace, "Malformed cache blob", e);
        }
    }

    private void markDegraded(String operation, PersistenceException e) {
        if (persistenceDegraded.compareAndSet(false, true)) {
            LOG.warn("[{}] Store {} failed, continuing memory-only: {}", namespace, operation, e.getMessage());
        } else {
            LOG.debug("[{}] Store {} failed again: {}", namespace, operation, e.getMessage());
        }
    }
}
