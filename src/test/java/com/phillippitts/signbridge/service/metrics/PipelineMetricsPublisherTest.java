package com.phillippitts.signbridge.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PipelineMetricsPublisherTest {

    private SimpleMeterRegistry registry;
    private PipelineMetricsPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new PipelineMetricsPublisher(new PipelineMetrics(registry));
    }

    @Test
    void noopPublisherIsDisabledAndSilent() {
        assertThat(PipelineMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThatCode(() -> {
            PipelineMetricsPublisher.NOOP.recordCycle("fast", 10, true);
            PipelineMetricsPublisher.NOOP.recordMediationFailure("rules", "timeout");
            PipelineMetricsPublisher.NOOP.recordSuperseded();
        }).doesNotThrowAnyException();
    }

    @Test
    void recordsLatencyPerPath() {
        publisher.recordCycle("fast", 40, false);
        publisher.recordCycle("fast", 60, false);
        publisher.recordCycle("mediated", 900, false);

        assertThat(registry.get("signbridge.pipeline.latency").tag("path", "fast").timer().count()).isEqualTo(2);
        assertThat(registry.get("signbridge.pipeline.latency").tag("path", "mediated").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(900.0);
        assertThat(registry.find("signbridge.pipeline.budget.overrun").counter()).isNull();
    }

    @Test
    void countsBudgetOverrun() {
        publisher.recordCycle("fast", 180, true);

        assertThat(registry.get("signbridge.pipeline.budget.overrun").counter().count()).isEqualTo(1.0);
    }

    @Test
    void countsFailuresByBackendAndReason() {
        publisher.recordMediationFailure("rules", "timeout");
        publisher.recordMediationFailure("rules", "timeout");
        publisher.recordMediationFailure("rules", "invalid");
        publisher.recordSuperseded();

        assertThat(registry.get("signbridge.mediation.failure")
                .tags("backend", "rules", "reason", "timeout").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("signbridge.mediation.failure")
                .tags("backend", "rules", "reason", "invalid").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("signbridge.pipeline.superseded").counter().count()).isEqualTo(1.0);
        assertThat(publisher.isEnabled()).isTrue();
    }
}
