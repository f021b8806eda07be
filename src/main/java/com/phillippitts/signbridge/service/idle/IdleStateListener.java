package com.phillippitts.signbridge.service.idle;

/**
 * Callbacks for idle-state edges. Each fires once per edge actually crossed, on the
 * thread that caused the edge (caller of {@code signalActivity} or the timer thread).
 * Implementations must be quick and must not block.
 */
public interface IdleStateListener {

    /** Entered {@link IdleState#IDLE}. */
    default void onIdleStart() {
    }

    /** Left {@link IdleState#IDLE}. */
    default void onIdleEnd() {
    }

    /** Entered {@link IdleState#TRANSITIONING}. */
    default void onTransitionStart() {
    }

    /** Left {@link IdleState#TRANSITIONING}. */
    default void onTransitionEnd() {
    }
}
