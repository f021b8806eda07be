package com.phillippitts.signbridge.service.pipeline.event;

import com.phillippitts.signbridge.service.pipeline.ResolutionPath;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a cycle reaches speaking.
 *
 * @param cycleId   pipeline cycle
 * @param path      fast path, mediated or fallback
 * @param elapsedMs input to speaking
 * @param timestamp when speaking was reached
 */
public record PipelineCycleCompletedEvent(
        UUID cycleId,
        ResolutionPath path,
        long elapsedMs,
        Instant timestamp
) {}
