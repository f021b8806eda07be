package com.phillippitts.signbridge.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic expiry sweep and summary log for the content caches. Reads already treat
 * expired entries as misses; the sweep keeps untouched expired entries from holding
 * capacity and bloating the persisted blob.
 */
@Component
public class ContentCacheSweeper {

    private static final Logger LOG = LogManager.getLogger(ContentCacheSweeper.class);

    private final AvatarContentCache cache;

    public ContentCacheSweeper(AvatarContentCache cache) {
        this.cache = cache;
    }

    @Scheduled(fixedRateString = "${cache.sweep-interval-ms:600000}", initialDelayString = "${cache.sweep-interval-ms:600000}")
    public void sweep() {
        int removed = cache.purgeExpired();
        CacheMetrics metrics = cache.getMetrics();
        LOG.info("Content cache sweep: removed={}, size={}, hitRate={}, requests={}, degraded={}",
                removed, metrics.cacheSize(), String.format("%.2f", metrics.hitRate()),
                metrics.totalRequests(), cache.isPersistenceDegraded());
    }
}
