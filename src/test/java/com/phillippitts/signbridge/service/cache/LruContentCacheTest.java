package com.phillippitts.signbridge.service.cache;

import com.phillippitts.signbridge.domain.SignRecognition;
import com.phillippitts.signbridge.service.cache.store.InMemoryKeyValueStore;
import com.phillippitts.signbridge.service.cache.store.KeyValueStore;
import com.phillippitts.signbridge.testutil.FailingKeyValueStore;
import com.phillippitts.signbridge.testutil.MutableClock;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LruContentCacheTest {

    private static final String NS = "test_signs";
    private static final Duration TTL = Duration.ofHours(24);

    private MutableClock clock;
    private KeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T10:00:00Z");
        store = new InMemoryKeyValueStore();
    }

    private LruContentCache<SignRecognition> newCache(int capacity) {
        return new LruContentCache<>(NS, capacity, TTL, store, new SignRecognitionCodec(), clock);
    }

    private static SignRecognition signs(String... glosses) {
        return new SignRecognition(List.of(glosses), 0.9);
    }

    @Test
    void hitIncrementsUsageAndRefreshesAccessTime() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("a", signs("HELLO"));
        clock.advanceMillis(500);

        CacheEntry<SignRecognition> entry = cache.get("a").orElseThrow();

        assertThat(entry.usageCount()).isEqualTo(2);
        assertThat(entry.lastAccessedAt()).isEqualTo(clock.instant());
        assertThat(entry.createdAt()).isBefore(entry.lastAccessedAt());
        assertThat(entry.payload().recognizedSigns()).containsExactly("HELLO");
    }

    @Test
    void missLeavesCacheUnchanged() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("a", signs("HELLO"));

        assertThat(cache.get("zzz")).isEmpty();
        assertThat(cache.get(null)).isEmpty();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void evictsLeastRecentlyAccessedRegardlessOfUsage() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("k1", signs("ONE"));
        clock.advanceMillis(10);
        cache.set("k2", signs("TWO"));
        clock.advanceMillis(10);
        cache.set("k3", signs("THREE"));
        clock.advanceMillis(10);

        // k1 has the highest usage, but k2 is the least recently accessed after this read
        cache.get("k1");
        cache.get("k1");
        clock.advanceMillis(10);
        cache.get("k3");
        clock.advanceMillis(10);

        cache.set("k4", signs("FOUR"));

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("k2")).isEmpty();
        assertThat(cache.get("k1")).isPresent();
        assertThat(cache.get("k3")).isPresent();
        assertThat(cache.get("k4")).isPresent();
    }

    @Test
    void unreadEntryWithOldestInsertIsEvicted() {
        LruContentCache<SignRecognition> cache = newCache(2);
        cache.set("older", signs("A"));
        clock.advanceMillis(5);
        cache.set("newer", signs("B"));
        clock.advanceMillis(5);

        cache.set("third", signs("C"));

        assertThat(cache.mostUsedKeys(Integer.MAX_VALUE)).containsExactlyInAnyOrder("newer", "third");
    }

    @Test
    void accessTimeTieBrokenByCreationTime() {
        LruContentCache<SignRecognition> cache = newCache(2);
        cache.set("older", signs("A"));
        clock.advanceMillis(5);
        cache.set("newer", signs("B"));
        clock.advanceMillis(5);
        // both read at the same instant, so only creation time separates them
        cache.get("newer");
        cache.get("older");
        clock.advanceMillis(5);

        cache.set("third", signs("C"));

        assertThat(cache.mostUsedKeys(Integer.MAX_VALUE)).containsExactlyInAnyOrder("newer", "third");
    }

    @Test
    void mixedReadsAndWritesMatchAccessOrderedMap() {
        int capacity = 3;
        LruContentCache<SignRecognition> cache = newCache(capacity);
        Map<String, Boolean> expected = new LinkedHashMap<>(16, 0.75f, true);
        Random random = new Random(42);

        for (int step = 0; step < 300; step++) {
            String key = "k" + random.nextInt(6);
            clock.advanceMillis(1);
            if (random.nextInt(3) == 0) {
                boolean resident = expected.get(key) != null;
                assertThat(cache.get(key).isPresent()).as("read %s at step %d", key, step).isEqualTo(resident);
            } else {
                expected.put(key, Boolean.TRUE);
                if (expected.size() > capacity) {
                    Iterator<String> eldest = expected.keySet().iterator();
                    eldest.next();
                    eldest.remove();
                }
                cache.set(key, signs(key.toUpperCase()));
            }
            assertThat(cache.size()).isLessThanOrEqualTo(capacity);
            assertThat(cache.mostUsedKeys(Integer.MAX_VALUE))
                    .as("keys after step %d", step)
                    .containsExactlyInAnyOrderElementsOf(expected.keySet());
        }
    }

    @Test
    void neverEvictsTheEntryJustInserted() {
        LruContentCache<SignRecognition> cache = newCache(1);
        cache.set("first", signs("A"));
        cache.set("second", signs("B"));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("second")).isPresent();
    }

    @Test
    void expiredEntryIsAMissAndIsRemoved() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("a", signs("HELLO"));

        clock.advance(TTL.plusMillis(1));

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void readsDoNotExtendLifetime() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("a", signs("HELLO"));
        clock.advance(TTL.minusMinutes(1));
        assertThat(cache.get("a")).isPresent();

        clock.advance(Duration.ofMinutes(2));

        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void expiredEntriesAreSweptBeforeEviction() {
        LruContentCache<SignRecognition> cache = newCache(2);
        cache.set("stale", signs("OLD"));
        clock.advance(Duration.ofHours(23));
        cache.set("fresh", signs("NEW"));
        clock.advance(Duration.ofHours(2));

        cache.set("another", signs("MORE"));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("fresh")).isPresent();
        assertThat(cache.get("another")).isPresent();
    }

    @Test
    void purgeExpiredRemovesAndPersists() {
        LruContentCache<SignRecognition> cache = newCache(5);
        cache.set("a", signs("A"));
        clock.advance(Duration.ofHours(12));
        cache.set("b", signs("B"));
        clock.advance(Duration.ofHours(13));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(new JSONObject(store.get(NS).orElseThrow()).getJSONObject("entries").keySet())
                .containsExactly("b");
    }

    @Test
    void stateSurvivesRecreationFromStore() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("a", signs("HELLO", "WORLD"));
        cache.get("a");

        LruContentCache<SignRecognition> reloaded = newCache(3);

        CacheEntry<SignRecognition> entry = reloaded.get("a").orElseThrow();
        assertThat(entry.payload().recognizedSigns()).containsExactly("HELLO", "WORLD");
        // only writes persist; the earlier read is not in the blob
        assertThat(entry.usageCount()).isEqualTo(2);
        assertThat(entry.createdAt()).isEqualTo(clock.instant());
    }

    @Test
    void reloadSkipsExpiredEntriesAndRespectsCapacity() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("old", signs("OLD"));
        clock.advance(Duration.ofHours(20));
        cache.set("b", signs("B"));
        clock.advanceMillis(10);
        cache.set("c", signs("C"));
        clock.advance(Duration.ofHours(5));

        LruContentCache<SignRecognition> reloaded = newCache(1);

        assertThat(reloaded.size()).isEqualTo(1);
        assertThat(reloaded.get("c")).isPresent();
    }

    @Test
    void corruptBlobStartsEmpty() {
        store.set(NS, "{not json");

        LruContentCache<SignRecognition> cache = newCache(3);

        assertThat(cache.size()).isZero();
        assertThat(cache.isPersistenceDegraded()).isFalse();
        cache.set("a", signs("A"));
        assertThat(cache.get("a")).isPresent();
    }

    @Test
    void blobWithBadEntryShapeStartsEmpty() {
        store.set(NS, "{\"version\":1,\"entries\":{\"a\":{\"payload\":{},\"createdAt\":1}}}");

        assertThat(newCache(3).size()).isZero();
    }

    @Test
    void storeWriteFailureDegradesWithoutThrowing() {
        FailingKeyValueStore failing = new FailingKeyValueStore();
        LruContentCache<SignRecognition> cache =
                new LruContentCache<>(NS, 3, TTL, failing, new SignRecognitionCodec(), clock);
        failing.failWrites(true);

        cache.set("a", signs("A"));

        assertThat(cache.isPersistenceDegraded()).isTrue();
        assertThat(cache.get("a")).isPresent();

        failing.failWrites(false);
        cache.set("b", signs("B"));
        assertThat(cache.isPersistenceDegraded()).isFalse();
    }

    @Test
    void storeReadFailureStartsEmptyAndDegraded() {
        FailingKeyValueStore failing = new FailingKeyValueStore();
        failing.failReads(true);

        LruContentCache<SignRecognition> cache =
                new LruContentCache<>(NS, 3, TTL, failing, new SignRecognitionCodec(), clock);

        assertThat(cache.size()).isZero();
        assertThat(cache.isPersistenceDegraded()).isTrue();
    }

    @Test
    void clearEmptiesMemoryAndStore() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("a", signs("A"));

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(store.get(NS)).isEmpty();
        assertThat(newCache(3).size()).isZero();
    }

    @Test
    void metricsCountRequestsAndHits() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("a", signs("A"));
        cache.get("a");
        cache.get("b");

        CacheMetrics metrics = cache.metrics();

        assertThat(metrics.totalRequests()).isEqualTo(2);
        assertThat(metrics.totalHits()).isEqualTo(1);
        assertThat(metrics.hitRate()).isEqualTo(0.5);
        assertThat(metrics.cacheSize()).isEqualTo(1);
        assertThat(metrics.estimatedMemoryBytes()).isPositive();
    }

    @Test
    void mostUsedKeysOrderedByUsage() {
        LruContentCache<SignRecognition> cache = newCache(5);
        cache.set("a", signs("A"));
        cache.set("b", signs("B"));
        cache.set("c", signs("C"));
        cache.get("b");
        cache.get("b");
        cache.get("c");

        assertThat(cache.mostUsedKeys(2)).containsExactly("b", "c");
    }

    @Test
    void serializedFormCarriesVersionAndTimestamps() {
        LruContentCache<SignRecognition> cache = newCache(3);
        cache.set("a", signs("A"));

        JSONObject root = new JSONObject(cache.serialize());

        assertThat(root.getInt("version")).isEqualTo(LruContentCache.FORMAT_VERSION);
        JSONObject entry = root.getJSONObject("entries").getJSONObject("a");
        assertThat(entry.getLong("createdAt")).isEqualTo(clock.instant().toEpochMilli());
        assertThat(entry.getLong("usageCount")).isEqualTo(1);
        assertThat(entry.getJSONObject("payload").getJSONArray("recognizedSigns").getString(0)).isEqualTo("A");
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> newCache(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LruContentCache<>(NS, 1, Duration.ZERO, store, new SignRecognitionCodec(), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
