package com.phillippitts.signbridge.service.cache;

/**
 * Aggregated content-cache statistics.
 *
 * @param hitRate              hits / requests, 0 when there were no requests
 * @param totalRequests        {@code get} calls across namespaces
 * @param totalHits            successful {@code get} calls
 * @param cacheSize            live entries across namespaces
 * @param estimatedMemoryBytes size of the serialized state in bytes
 */
public record CacheMetrics(double hitRate, long totalRequests, long totalHits, int cacheSize,
                           long estimatedMemoryBytes) {

    public static CacheMetrics combine(CacheMetrics a, CacheMetrics b) {
        long requests = a.totalRequests + b.totalRequests;
        long hits = a.totalHits + b.totalHits;
        return new CacheMetrics(requests == 0 ? 0.0 : (double) hits / requests,
                requests, hits, a.cacheSize + b.cacheSize,
                a.estimatedMemoryBytes + b.estimatedMemoryBytes);
    }
}
