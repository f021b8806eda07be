package com.phillippitts.signbridge.service.pipeline;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventChannelTest {

    @Test
    void deliversInRegistrationOrder() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> seen = new ArrayList<>();
        channel.subscribe(e -> seen.add("a:" + e));
        channel.subscribe(e -> seen.add("b:" + e));

        channel.publish("x");

        assertThat(seen).containsExactly("a:x", "b:x");
    }

    @Test
    void failingSubscriberDoesNotStopOthers() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> seen = new ArrayList<>();
        channel.subscribe(e -> {
            throw new IllegalStateException("boom");
        });
        channel.subscribe(seen::add);

        channel.publish("x");

        assertThat(seen).containsExactly("x");
    }

    @Test
    void unsubscribeIsIdempotentAndStopsDelivery() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> seen = new ArrayList<>();
        Subscription sub = channel.subscribe(seen::add);
        channel.publish("1");

        sub.unsubscribe();
        sub.unsubscribe();
        channel.publish("2");

        assertThat(seen).containsExactly("1");
        assertThat(sub.isActive()).isFalse();
        assertThat(channel.subscriberCount()).isZero();
    }

    @Test
    void closeUnsubscribes() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> seen = new ArrayList<>();

        try (Subscription ignored = channel.subscribe(seen::add)) {
            channel.publish("inside");
        }
        channel.publish("outside");

        assertThat(seen).containsExactly("inside");
    }

    @Test
    void subscriberMayUnsubscribeItselfDuringDelivery() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> seen = new ArrayList<>();
        Subscription[] holder = new Subscription[1];
        holder[0] = channel.subscribe(e -> {
            seen.add(e);
            holder[0].unsubscribe();
        });

        channel.publish("1");
        channel.publish("2");

        assertThat(seen).containsExactly("1");
    }
}
