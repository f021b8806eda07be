package com.phillippitts.signbridge.service.pipeline;

import com.phillippitts.signbridge.domain.PipelineContext;
import com.phillippitts.signbridge.domain.PipelineStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks the single current pipeline cycle and its status.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * (any) → LISTENING                         begin(): new cycle supersedes the current one
 * (any but IDLE) → IDLE                     cancel(): current cycle abandoned, none replaces it
 * LISTENING → UNDERSTANDING → RESPONDING → SPEAKING → IDLE   advance(), never backwards
 * </pre>
 *
 * <p>Every status publication and every cycle-scoped emission runs under one lock and
 * only while its cycle is current, so observers never see events from two cycles
 * interleaved and never see a superseded cycle's events after the newer LISTENING.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe; a {@link ReentrantLock} guards
 * the current cycle and status.
 *
 * @since 1.0
 */
final class CycleTracker {

    private static final Logger LOG = LogManager.getLogger(CycleTracker.class);

    private final Lock lock = new ReentrantLock();
    private final EventChannel<StatusUpdate> statusChannel;
    private final Clock clock;

    private Cycle current;
    private PipelineStatus status = PipelineStatus.IDLE;

    CycleTracker(EventChannel<StatusUpdate> statusChannel, Clock clock) {
        this.statusChannel = statusChannel;
        this.clock = clock;
    }

    /**
     * Starts a new cycle in LISTENING. A cycle still in flight is superseded: its
     * future completes as {@link ResolutionPath#SUPERSEDED} and none of its later
     * emissions are published.
     *
     * @return the new cycle
     */
    Cycle begin(PipelineContext context) {
        Cycle previous;
        Cycle next;
        lock.lock();
        try {
            previous = current;
            next = new Cycle(UUID.randomUUID(), context, clock.instant());
            current = next;
            status = PipelineStatus.LISTENING;
            statusChannel.publish(new StatusUpdate(next.id(), PipelineStatus.LISTENING, next.startedAt()));
        } finally {
            lock.unlock();
        }
        if (previous != null && !previous.outcome().isDone()) {
            long elapsed = Duration.between(previous.startedAt(), next.startedAt()).toMillis();
            if (previous.complete(PipelineOutcome.superseded(previous.id(), elapsed))) {
                LOG.debug("Cycle {} superseded by {}", previous.id(), next.id());
            }
        }
        return next;
    }

    /**
     * Abandons the cycle in flight. Observers get a terminal IDLE for it and its future
     * completes as {@link ResolutionPath#SUPERSEDED}.
     *
     * @return the id of the abandoned cycle, empty if nothing was in flight
     */
    Optional<UUID> cancel() {
        Cycle previous;
        lock.lock();
        try {
            if (current == null || status == PipelineStatus.IDLE) {
                return Optional.empty();
            }
            previous = current;
            current = null;
            status = PipelineStatus.IDLE;
            statusChannel.publish(new StatusUpdate(previous.id(), PipelineStatus.IDLE, clock.instant()));
        } finally {
            lock.unlock();
        }
        long elapsed = Duration.between(previous.startedAt(), clock.instant()).toMillis();
        previous.complete(PipelineOutcome.superseded(previous.id(), elapsed));
        return Optional.of(previous.id());
    }

    /**
     * Moves the cycle to {@code next} and publishes it, if the cycle is still current and
     * the move is forward.
     *
     * @return true if the status was published
     */
    boolean advance(Cycle cycle, PipelineStatus next) {
        lock.lock();
        try {
            if (cycle != current) {
                return false;
            }
            if (!status.canAdvanceTo(next)) {
                LOG.debug("Ignoring status {} after {} for cycle {}", next, status, cycle.id());
                return false;
            }
            status = next;
            statusChannel.publish(new StatusUpdate(cycle.id(), next, clock.instant()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code emission} under the cycle lock if the cycle is still current.
     *
     * @return true if it ran
     */
    boolean runIfCurrent(Cycle cycle, Runnable emission) {
        lock.lock();
        try {
            if (cycle != current) {
                return false;
            }
            emission.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isCurrent(Cycle cycle) {
        lock.lock();
        try {
            return cycle == current;
        } finally {
            lock.unlock();
        }
    }

    boolean isProcessing() {
        lock.lock();
        try {
            return current != null && status != PipelineStatus.IDLE;
        } finally {
            lock.unlock();
        }
    }

    PipelineStatus currentStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    Optional<UUID> currentCycleId() {
        lock.lock();
        try {
            return current == null ? Optional.empty() : Optional.of(current.id());
        } finally {
            lock.unlock();
        }
    }
}
