package com.phillippitts.signbridge.service.health;

import com.phillippitts.signbridge.service.cache.AvatarContentCache;
import com.phillippitts.signbridge.service.idle.IdleStateManager;
import com.phillippitts.signbridge.service.pipeline.MediationPipelineController;
import com.phillippitts.signbridge.service.pipeline.event.PipelineCycleCompletedEvent;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Health of the mediation pipeline.
 *
 * <ul>
 *   <li>UP: caches persisting normally</li>
 *   <li>DEGRADED: a content cache runs memory-only after a store failure</li>
 * </ul>
 *
 * <p>Details include the current pipeline status, the avatar idle state and the last
 * completed cycle. Exposed via /actuator/health.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final MediationPipelineController controller;
    private final AvatarContentCache contentCache;
    private final IdleStateManager idleStateManager;
    private final AtomicReference<PipelineCycleCompletedEvent> lastCycle = new AtomicReference<>();

    public PipelineHealthIndicator(MediationPipelineController controller,
                                   AvatarContentCache contentCache,
                                   IdleStateManager idleStateManager) {
        this.controller = controller;
        this.contentCache = contentCache;
        this.idleStateManager = idleStateManager;
    }

    @EventListener
    void onCycleCompleted(PipelineCycleCompletedEvent event) {
        lastCycle.set(event);
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        if (contentCache.isPersistenceDegraded()) {
            builder.status("DEGRADED").withDetail("cache", "memory-only (store unavailable)");
        } else {
            builder.up().withDetail("cache", "persisting");
        }
        builder.withDetail("pipelineStatus", controller.getCurrentStatus().name())
                .withDetail("idleState", idleStateManager.getState().name());

        PipelineCycleCompletedEvent last = lastCycle.get();
        if (last != null) {
            builder.withDetail("lastCyclePath", last.path().metricTag())
                    .withDetail("lastCycleMs", last.elapsedMs())
                    .withDetail("lastCycleAt", last.timestamp().toString());
        }
        return builder.build();
    }
}
