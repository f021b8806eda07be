package com.phillippitts.signbridge.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe front for {@link PipelineMetrics} so the pipeline controller runs unchanged
 * without a meter registry.
 *
 * @since 1.0
 */
@Component
public final class PipelineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PipelineMetricsPublisher.class);

    /**
     * No-op instance for tests and hand-wired controllers.
     */
    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null);

    private final PipelineMetrics metrics;

    /**
     * @param metrics metrics sink (nullable for test mode)
     */
    public PipelineMetricsPublisher(PipelineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PipelineMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records a cycle that reached speaking.
     *
     * @param path           fast, mediated or fallback
     * @param elapsedMillis  input to speaking
     * @param budgetExceeded true if a fast-path cycle missed the emergency budget
     */
    public void recordCycle(String path, long elapsedMillis, boolean budgetExceeded) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(path, elapsedMillis);
        if (budgetExceeded) {
            metrics.incrementBudgetOverrun();
        }
    }

    public void recordMediationFailure(String backend, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementMediationFailure(backend, reason);
    }

    public void recordSuperseded() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSuperseded();
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
