package com.phillippitts.signbridge.service.phrase;

import com.phillippitts.signbridge.domain.PhraseEntry;
import com.phillippitts.signbridge.util.LogSanitizer;
import com.phillippitts.signbridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exact-match phrase table keyed by {@link PhraseNormalizer normalized} text.
 *
 * <p>Two instances back the emergency fast path of the mediation pipeline:
 * <ul>
 *   <li><b>Emergency table:</b> loaded once, immutable; {@link #addTerm} is rejected.</li>
 *   <li><b>Medical table:</b> seeded at startup and growable at runtime. Entries never expire.</li>
 * </ul>
 *
 * <p><b>Performance:</b> lookups are a normalization pass plus one hash probe, so their cost
 * is independent of table size. Each lookup reports its own duration in microseconds for
 * latency auditing against the pipeline's emergency budget.
 *
 * <p><b>Thread Safety:</b> any number of threads may call {@link #lookup} concurrently.
 * Writers are serialized by a lock; a reader observes either the old or the new entry,
 * never a partial one, because entries are immutable and published through a
 * {@link ConcurrentHashMap}.
 *
 * @since 1.0
 */
public class NormalizedPhraseCache {

    private static final Logger LOG = LogManager.getLogger(NormalizedPhraseCache.class);

    /** Confidence assigned to runtime-added terms when the caller does not supply one. */
    public static final double DEFAULT_LEARNED_CONFIDENCE = 0.8;

    private final String name;
    private final boolean mutable;
    private final Map<String, PhraseEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> usage = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    private final LongAdder lookups = new LongAdder();
    private final LongAdder hits = new LongAdder();
    private final LongAdder lookupNanos = new LongAdder();

    /**
     * Creates a table pre-populated with seed phrases (confidence 1.0).
     *
     * @param name    table name for logs ("emergency", "medical")
     * @param seeds   initial phrases
     * @param mutable whether {@link #addTerm} is permitted after construction
     */
    public NormalizedPhraseCache(String name, Collection<PhraseSeed> seeds, boolean mutable) {
        this.name = Objects.requireNonNull(name, "name");
        this.mutable = mutable;
        for (PhraseSeed seed : Objects.requireNonNull(seeds, "seeds")) {
            put(seed.phrase(), seed.mediatedText(), seed.signIntent(), 1.0);
        }
        LOG.info("Phrase table '{}' initialized with {} entries (mutable={})", name, entries.size(), mutable);
    }

    public static NormalizedPhraseCache immutable(String name, Collection<PhraseSeed> seeds) {
        return new NormalizedPhraseCache(name, seeds, false);
    }

    public static NormalizedPhraseCache growable(String name, Collection<PhraseSeed> seeds) {
        return new NormalizedPhraseCache(name, seeds, true);
    }

    /**
     * Looks up a raw phrase after normalization.
     *
     * @param raw phrase as typed, spoken or recognized (null treated as empty)
     * @return hit/miss with the entry and the lookup cost in microseconds
     */
    public PhraseLookupResult lookup(String raw) {
        long t0 = System.nanoTime();
        String key = PhraseNormalizer.normalize(raw);
        PhraseEntry entry = key.isEmpty() ? null : entries.get(key);
        long nanos = System.nanoTime() - t0;

        lookups.increment();
        lookupNanos.add(nanos);
        double micros = TimeUtils.nanosToMicros(nanos);

        if (entry != null) {
            hits.increment();
            usage.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
            LOG.debug("Phrase HIT in '{}': {} ({} us)", name, key, String.format("%.1f", micros));
            return PhraseLookupResult.hit(entry, micros);
        }
        LOG.debug("Phrase MISS in '{}': {} ({} us)", name, LogSanitizer.preview(key), String.format("%.1f", micros));
        return PhraseLookupResult.miss(micros);
    }

    /**
     * Checks membership without touching statistics or usage counts.
     */
    public boolean isCached(String raw) {
        String key = PhraseNormalizer.normalize(raw);
        return !key.isEmpty() && entries.containsKey(key);
    }

    /**
     * Inserts or overwrites a phrase with {@link #DEFAULT_LEARNED_CONFIDENCE}.
     * Visible to lookups as soon as this method returns.
     *
     * @throws UnsupportedOperationException if this table is immutable
     * @throws IllegalArgumentException      if the phrase normalizes to empty or text is blank
     */
    public void addTerm(String raw, String mediatedText) {
        addTerm(raw, mediatedText, null, DEFAULT_LEARNED_CONFIDENCE);
    }

    /**
     * Inserts or overwrites a phrase with an explicit intent and confidence.
     *
     * @see #addTerm(String, String)
     */
    public void addTerm(String raw, String mediatedText, String signIntent, double confidence) {
        if (!mutable) {
            throw new UnsupportedOperationException("Phrase table '" + name + "' is immutable");
        }
        if (mediatedText == null || mediatedText.isBlank()) {
            throw new IllegalArgumentException("mediatedText must not be blank");
        }
        put(raw, mediatedText, signIntent, confidence);
        LOG.info("Added phrase to '{}' ({})", name, LogSanitizer.describe(mediatedText));
    }

    private void put(String raw, String mediatedText, String signIntent, double confidence) {
        String key = PhraseNormalizer.normalize(raw);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("phrase must contain at least one letter or digit");
        }
        PhraseEntry entry = new PhraseEntry(key, raw.trim(), mediatedText, signIntent, confidence);
        writeLock.lock();
        try {
            entries.put(key, entry);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns lookup statistics since construction or the last {@link #resetStats()}.
     */
    public PhraseCacheStats getStats() {
        long total = lookups.sum();
        long hitCount = hits.sum();
        double hitRate = total == 0 ? 0.0 : (double) hitCount / total;
        double avgMicros = total == 0 ? 0.0 : TimeUtils.nanosToMicros(lookupNanos.sum()) / total;
        return new PhraseCacheStats(total, hitCount, total - hitCount, hitRate, avgMicros);
    }

    public void resetStats() {
        lookups.reset();
        hits.reset();
        lookupNanos.reset();
    }

    /**
     * Most frequently hit entries, highest usage first.
     */
    public List<PhraseEntry> getMostUsedTerms(int limit) {
        return entries.values().stream()
                .sorted(Comparator.comparingLong((PhraseEntry e) -> usageOf(e.phrase())).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Number of lookups that hit the given phrase.
     */
    public long usageOf(String raw) {
        AtomicLong count = usage.get(PhraseNormalizer.normalize(raw));
        return count == null ? 0 : count.get();
    }

    public int size() {
        return entries.size();
    }

    public boolean isMutable() {
        return mutable;
    }

    public String getName() {
        return name;
    }
}
