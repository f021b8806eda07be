package com.phillippitts.signbridge.service.pipeline;

import java.time.Instant;
import java.util.UUID;

/**
 * Recovered failure reported on the error channel. The cycle still completes.
 */
public record PipelineError(UUID cycleId, Kind kind, String message, Instant at) {

    public enum Kind {
        MEDIATION_FAILURE,
        MEDIATION_TIMEOUT,
        SPEECH_FAILURE
    }
}
