package com.phillippitts.signbridge.service.idle;

import com.phillippitts.signbridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Timer-driven idle/active state machine consulted by the avatar presentation layer.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → TRANSITIONING → ACTIVE   (signalActivity; transition timer)
 * ACTIVE → TRANSITIONING → IDLE   (no-activity timer expiry, or forceIdle)
 * ACTIVE + signalActivity         no-activity timer reset, no callbacks
 * TRANSITIONING + signalActivity  retarget to ACTIVE, transition timer restarted
 * </pre>
 *
 * <p>The no-activity timer is armed when ACTIVE is entered and re-armed by each
 * {@link #signalActivity()} while ACTIVE.
 *
 * <p><b>Thread Safety:</b> state changes happen under a {@link ReentrantLock}; listener
 * callbacks fire under the same lock so observers see edges in the order they occurred.
 * Timer tasks carry a generation number and are ignored once superseded.
 *
 * @since 1.0
 */
public class IdleStateManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(IdleStateManager.class);

    public static final long DEFAULT_IDLE_TIMEOUT_MS = 3000;
    public static final long DEFAULT_TRANSITION_DURATION_MS = 500;

    private final ScheduledExecutorService scheduler;
    private final long idleTimeoutMs;
    private final long transitionDurationMs;
    private final List<IdleStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Lock lock = new ReentrantLock();

    private IdleState state = IdleState.IDLE;
    private IdleState transitionTarget;
    private ScheduledFuture<?> idleTimer;
    private ScheduledFuture<?> transitionTimer;
    private long generation;
    private volatile long lastActivityNanos = System.nanoTime();
    private boolean closed;

    public IdleStateManager(ScheduledExecutorService scheduler, long idleTimeoutMs, long transitionDurationMs) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        if (idleTimeoutMs <= 0 || transitionDurationMs < 0) {
            throw new IllegalArgumentException("idleTimeoutMs must be > 0 and transitionDurationMs >= 0");
        }
        this.idleTimeoutMs = idleTimeoutMs;
        this.transitionDurationMs = transitionDurationMs;
    }

    public void addListener(IdleStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(IdleStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Records conversational activity. Ignored after {@link #close()}.
     */
    public void signalActivity() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            lastActivityNanos = System.nanoTime();
            switch (state) {
                case IDLE -> {
                    enter(IdleState.TRANSITIONING);
                    startTransition(IdleState.ACTIVE);
                }
                case ACTIVE -> armIdleTimer();
                case TRANSITIONING -> startTransition(IdleState.ACTIVE);
                default -> throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts the transition to IDLE immediately, without waiting for the no-activity timer.
     * No-op when already IDLE or closed.
     */
    public void forceIdle() {
        lock.lock();
        try {
            if (closed || state == IdleState.IDLE) {
                return;
            }
            cancel(idleTimer);
            idleTimer = null;
            if (state == IdleState.ACTIVE) {
                enter(IdleState.TRANSITIONING);
            }
            startTransition(IdleState.IDLE);
        } finally {
            lock.unlock();
        }
    }

    public IdleState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isIdle() {
        return getState() == IdleState.IDLE;
    }

    public boolean isActive() {
        return getState() == IdleState.ACTIVE;
    }

    public boolean isTransitioning() {
        return getState() == IdleState.TRANSITIONING;
    }

    /**
     * Milliseconds since the last {@link #signalActivity()} (or construction).
     */
    public long getTimeSinceLastActivity() {
        return TimeUtils.elapsedMillis(lastActivityNanos);
    }

    public long getIdleTimeoutMs() {
        return idleTimeoutMs;
    }

    public long getTransitionDurationMs() {
        return transitionDurationMs;
    }

    /**
     * Cancels pending timers and drops listeners. Later signals are ignored. The
     * scheduler is not shut down; it belongs to the caller.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            generation++;
            cancel(idleTimer);
            cancel(transitionTimer);
            idleTimer = null;
            transitionTimer = null;
            listeners.clear();
        } finally {
            lock.unlock();
        }
        LOG.debug("Idle state manager closed");
    }

    // Caller holds lock and state is TRANSITIONING.
    private void startTransition(IdleState target) {
        transitionTarget = target;
        cancel(transitionTimer);
        long gen = ++generation;
        transitionTimer = schedule(() -> completeTransition(gen), transitionDurationMs);
    }

    private void completeTransition(long gen) {
        lock.lock();
        try {
            if (closed || gen != generation || state != IdleState.TRANSITIONING) {
                return;
            }
            transitionTimer = null;
            enter(transitionTarget);
            if (state == IdleState.ACTIVE) {
                armIdleTimer();
            }
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock and state is ACTIVE.
    private void armIdleTimer() {
        cancel(idleTimer);
        long gen = ++generation;
        idleTimer = schedule(() -> onIdleTimeout(gen), idleTimeoutMs);
    }

    private void onIdleTimeout(long gen) {
        lock.lock();
        try {
            if (closed || gen != generation || state != IdleState.ACTIVE) {
                return;
            }
            idleTimer = null;
            LOG.debug("No activity for {} ms, returning to idle", idleTimeoutMs);
            enter(IdleState.TRANSITIONING);
            startTransition(IdleState.IDLE);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock. Fires the callbacks for the edge from the current state.
    private void enter(IdleState next) {
        IdleState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        LOG.debug("Idle state {} -> {}", previous, next);
        if (previous == IdleState.IDLE) {
            fire(IdleStateListener::onIdleEnd);
        }
        if (previous == IdleState.TRANSITIONING) {
            fire(IdleStateListener::onTransitionEnd);
        }
        if (next == IdleState.TRANSITIONING) {
            fire(IdleStateListener::onTransitionStart);
        }
        if (next == IdleState.IDLE) {
            fire(IdleStateListener::onIdleStart);
        }
    }

    private void fire(Consumer<IdleStateListener> callback) {
        for (IdleStateListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                LOG.warn("Idle state listener {} failed: {}", listener.getClass().getSimpleName(), e.toString());
            }
        }
    }

    private ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        try {
            return scheduler.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.warn("Idle scheduler rejected timer ({} ms): {}", delayMs, e.getMessage());
            return null;
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}
