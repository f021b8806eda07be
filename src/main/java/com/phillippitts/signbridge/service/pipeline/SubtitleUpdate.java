package com.phillippitts.signbridge.service.pipeline;

import com.phillippitts.signbridge.domain.MediationMode;

import java.time.Instant;
import java.util.UUID;

/**
 * Text delivered when a cycle reaches speaking, for on-screen captions.
 *
 * @param fallback true if mediation failed and the raw input is shown
 */
public record SubtitleUpdate(UUID cycleId, String text, MediationMode mode, boolean fallback, Instant at) {
}
