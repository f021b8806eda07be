package com.phillippitts.signbridge.service.pipeline;

import com.phillippitts.signbridge.domain.AvatarAnimation;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Result of one {@code processInput} call.
 *
 * @param cycleId    cycle identifier (also in status updates and logs)
 * @param path       how the cycle resolved
 * @param outputText delivered text, or null when nothing was delivered
 * @param elapsedMs  input to speaking in milliseconds (to completion for non-delivering paths)
 * @param animation  cached avatar rendering for hearing-to-deaf output, may be null
 */
public record PipelineOutcome(UUID cycleId, ResolutionPath path, String outputText, long elapsedMs,
                              AvatarAnimation animation) {

    public PipelineOutcome {
        Objects.requireNonNull(cycleId, "cycleId");
        Objects.requireNonNull(path, "path");
    }

    static PipelineOutcome superseded(UUID cycleId, long elapsedMs) {
        return new PipelineOutcome(cycleId, ResolutionPath.SUPERSEDED, null, elapsedMs, null);
    }

    static PipelineOutcome ignored(UUID cycleId, long elapsedMs) {
        return new PipelineOutcome(cycleId, ResolutionPath.IGNORED, null, elapsedMs, null);
    }

    public boolean delivered() {
        return outputText != null;
    }

    public Optional<AvatarAnimation> animationIfCached() {
        return Optional.ofNullable(animation);
    }
}
