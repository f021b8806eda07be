package com.phillippitts.signbridge.domain;

/**
 * Observable status of the mediation pipeline.
 *
 * <p>Within one input cycle the working statuses are emitted in declaration order
 * ({@code LISTENING → UNDERSTANDING → RESPONDING → SPEAKING}); {@code IDLE} is terminal.
 * A new input restarts the sequence at {@code LISTENING}.
 */
public enum PipelineStatus {
    LISTENING,
    UNDERSTANDING,
    RESPONDING,
    SPEAKING,
    IDLE;

    /**
     * Returns true if moving from this status to {@code next} keeps the cycle monotonic.
     */
    public boolean canAdvanceTo(PipelineStatus next) {
        return next.ordinal() > this.ordinal();
    }
}
