package com.phillippitts.signbridge.service.pipeline.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the speech output reported an error for a cycle's utterance.
 */
public record SpeechFailedEvent(UUID cycleId, String message, Instant timestamp) {}
