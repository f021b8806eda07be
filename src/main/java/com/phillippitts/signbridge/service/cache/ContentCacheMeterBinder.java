package com.phillippitts.signbridge.service.cache;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Exposes content-cache statistics as Micrometer gauges.
 *
 * <ul>
 *   <li>signbridge.cache.hit.rate - aggregated hit rate across namespaces</li>
 *   <li>signbridge.cache.requests - cumulative {@code get} calls</li>
 *   <li>signbridge.cache.size - live entries</li>
 *   <li>signbridge.cache.bytes - estimated serialized size</li>
 *   <li>signbridge.cache.degraded - 1 while running memory-only</li>
 * </ul>
 */
public class ContentCacheMeterBinder implements MeterBinder {

    private static final Logger LOG = LogManager.getLogger(ContentCacheMeterBinder.class);

    private final AvatarContentCache cache;

    public ContentCacheMeterBinder(AvatarContentCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("signbridge.cache.hit.rate", cache, c -> c.getMetrics().hitRate())
                .description("Content cache hit rate across sign and animation namespaces")
                .register(registry);

        Gauge.builder("signbridge.cache.requests", cache, c -> c.getMetrics().totalRequests())
                .description("Cumulative content cache lookups")
                .register(registry);

        Gauge.builder("signbridge.cache.size", cache, c -> c.getMetrics().cacheSize())
                .description("Live content cache entries")
                .register(registry);

        Gauge.builder("signbridge.cache.bytes", cache, c -> c.getMetrics().estimatedMemoryBytes())
                .description("Estimated serialized size of the content caches")
                .baseUnit("bytes")
                .register(registry);

        Gauge.builder("signbridge.cache.degraded", cache, c -> c.isPersistenceDegraded() ? 1 : 0)
                .description("1 while a content cache runs memory-only after a store failure")
                .register(registry);

        LOG.info("Content cache metrics registered: signbridge.cache.* available via /actuator/metrics");
    }
}
