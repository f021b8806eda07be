package com.phillippitts.signbridge.service.pipeline;

import com.phillippitts.signbridge.domain.PipelineContext;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * One input-processing cycle. Identity is by instance; the id is for logs and observers.
 */
final class Cycle {

    static final String MDC_CYCLE_ID = "cycleId";
    static final String MDC_MODE = "mode";
    static final String MDC_SCENARIO = "scenario";

    private final UUID id;
    private final PipelineContext context;
    private final Instant startedAt;
    private final CompletableFuture<PipelineOutcome> outcome = new CompletableFuture<>();

    Cycle(UUID id, PipelineContext context, Instant startedAt) {
        this.id = id;
        this.context = context;
        this.startedAt = startedAt;
    }

    UUID id() {
        return id;
    }

    PipelineContext context() {
        return context;
    }

    Instant startedAt() {
        return startedAt;
    }

    CompletableFuture<PipelineOutcome> outcome() {
        return outcome;
    }

    /**
     * Completes the caller-facing future. Later completions are ignored.
     */
    boolean complete(PipelineOutcome result) {
        return outcome.complete(result);
    }

    Map<String, String> mdc() {
        return Map.of(MDC_CYCLE_ID, id.toString(),
                MDC_MODE, context.mode().label(),
                MDC_SCENARIO, context.scenario().key());
    }
}
