package com.phillippitts.signbridge.service.pipeline;

import com.phillippitts.signbridge.domain.PipelineStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * A status transition of the pipeline.
 */
public record StatusUpdate(UUID cycleId, PipelineStatus status, Instant at) {
}
