package com.phillippitts.signbridge.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the mediation pipeline.
 *
 * <ul>
 *   <li>{@code signbridge.pipeline.latency} - input to speaking, tagged by path (fast, mediated, fallback)</li>
 *   <li>{@code signbridge.pipeline.budget.overrun} - fast-path cycles slower than the emergency budget</li>
 *   <li>{@code signbridge.mediation.failure} - mediation failures tagged by reason (error, timeout, invalid)</li>
 *   <li>{@code signbridge.pipeline.superseded} - cycles cancelled by a newer input</li>
 * </ul>
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "signbridge";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(String path, long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".pipeline.latency")
                .description("Time from input to speaking status")
                .tag("path", path)
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    public void incrementBudgetOverrun() {
        Counter.builder(METRIC_PREFIX + ".pipeline.budget.overrun")
                .description("Fast-path cycles that exceeded the emergency latency budget")
                .register(registry)
                .increment();
    }

    public void incrementMediationFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".mediation.failure")
                .description("Mediation calls recovered by fallback")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementSuperseded() {
        Counter.builder(METRIC_PREFIX + ".pipeline.superseded")
                .description("Cycles cancelled by a newer input")
                .register(registry)
                .increment();
    }
}
