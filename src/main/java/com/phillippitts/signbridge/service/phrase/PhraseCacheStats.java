package com.phillippitts.signbridge.service.phrase;

/**
 * Snapshot of lookup statistics for one phrase table.
 *
 * @param totalLookups        lookups since the last reset
 * @param hits                lookups that found an entry
 * @param misses              lookups that found nothing
 * @param hitRate             hits / totalLookups, 0 when no lookups
 * @param averageLookupMicros mean lookup cost in microseconds
 */
public record PhraseCacheStats(
        long totalLookups,
        long hits,
        long misses,
        double hitRate,
        double averageLookupMicros
) {
}
