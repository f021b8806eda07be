package com.phillippitts.signbridge.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Synchronous publish/subscribe channel. Events are delivered on the publishing thread,
 * to subscribers in registration order. A failing subscriber is logged and skipped.
 *
 * <p>Ordering across publishers is the caller's responsibility; the pipeline publishes
 * under its cycle lock.
 *
 * @param <T> event type
 */
public final class EventChannel<T> {

    private static final Logger LOG = LogManager.getLogger(EventChannel.class);

    private final String name;
    private final List<Registration> subscribers = new CopyOnWriteArrayList<>();

    public EventChannel(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Subscription subscribe(Consumer<? super T> subscriber) {
        Registration registration = new Registration(Objects.requireNonNull(subscriber, "subscriber"));
        subscribers.add(registration);
        return registration;
    }

    public void publish(T event) {
        for (Registration registration : subscribers) {
            registration.deliver(event);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private final class Registration implements Subscription {

        private final Consumer<? super T> subscriber;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(Consumer<? super T> subscriber) {
            this.subscriber = subscriber;
        }

        private void deliver(T event) {
            if (!active.get()) {
                return;
            }
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                LOG.warn("Subscriber on '{}' channel failed: {}", name, e.toString());
            }
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                subscribers.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
