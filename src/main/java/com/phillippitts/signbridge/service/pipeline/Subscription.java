package com.phillippitts.signbridge.service.pipeline;

/**
 * Handle returned by {@link EventChannel#subscribe}. Unsubscribing is idempotent and may
 * happen at any time, including from inside a delivery. After {@link #unsubscribe()}
 * the subscriber sees no new deliveries; one already running on another thread may finish.
 */
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }
}
