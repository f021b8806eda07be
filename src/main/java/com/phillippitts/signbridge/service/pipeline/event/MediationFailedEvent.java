package com.phillippitts.signbridge.service.pipeline.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when mediation failed or timed out and the cycle fell back to the raw input.
 *
 * @param cycleId   pipeline cycle
 * @param backend   mediation backend name
 * @param reason    error, timeout or invalid
 * @param message   failure description (no utterance text)
 * @param timestamp when the failure was handled
 */
public record MediationFailedEvent(
        UUID cycleId,
        String backend,
        String reason,
        String message,
        Instant timestamp
) {}
