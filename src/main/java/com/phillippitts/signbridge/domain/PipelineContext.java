package com.phillippitts.signbridge.domain;

import java.util.Objects;

/**
 * Immutable per-invocation context for a pipeline cycle.
 *
 * @param mode     conversation direction
 * @param scenario hospital, emergency or default setting
 */
public record PipelineContext(MediationMode mode, Scenario scenario) {

    public PipelineContext {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(scenario, "scenario must not be null");
    }

    public static PipelineContext of(MediationMode mode, Scenario scenario) {
        return new PipelineContext(mode, scenario);
    }
}
