package com.phillippitts.signbridge.service.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable content-cache entry. A read produces a new instance via {@link #touched(Instant)}.
 *
 * @param key            cache key
 * @param payload        cached value
 * @param createdAt      time of the {@code set} that created the entry
 * @param lastAccessedAt time of the most recent hit (or creation)
 * @param usageCount     number of successful reads plus one
 * @param <T>            payload type
 */
public record CacheEntry<T>(String key, T payload, Instant createdAt, Instant lastAccessedAt, long usageCount) {

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(lastAccessedAt, "lastAccessedAt");
        if (usageCount < 1) {
            throw new IllegalArgumentException("usageCount must be >= 1, got: " + usageCount);
        }
    }

    static <T> CacheEntry<T> fresh(String key, T payload, Instant now) {
        return new CacheEntry<>(key, payload, now, now, 1);
    }

    CacheEntry<T> touched(Instant now) {
        return new CacheEntry<>(key, payload, createdAt, now, usageCount + 1);
    }

    /**
     * Expiry is measured from creation; reads do not extend an entry's life.
     */
    public boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
