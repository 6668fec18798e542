package com.linlay.agentcoordinator.bus;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMessageBusTest {

    private final InMemoryMessageBus bus = new InMemoryMessageBus();

    @Test
    void lateSubscriberShouldReplayBacklogThenReceiveNewMessages() {
        bus.publish("jobs", "k1", "first");
        bus.publish("jobs", "k2", "second");
        List<String> received = new ArrayList<>();

        bus.subscribe("jobs", received::add);
        bus.publish("jobs", "k3", "third");
        bus.publish("other", "k4", "ignored");

        assertThat(received).containsExactly("first", "second", "third");
    }

    @Test
    void failingListenerShouldNotStopDelivery() {
        List<String> received = new ArrayList<>();
        bus.subscribe("jobs", payload -> {
            if (payload.equals("bad")) {
                throw new IllegalStateException("boom");
            }
            received.add(payload);
        });

        bus.publish("jobs", null, "bad");
        bus.publish("jobs", null, "good");

        assertThat(received).containsExactly("good");
        assertThat(bus.messages("jobs")).containsExactly("bad", "good");
    }

    @Test
    void closedSubscriptionShouldStopReceiving() {
        List<String> received = new ArrayList<>();
        BusSubscription subscription = bus.subscribe("jobs", received::add);

        subscription.close();
        bus.publish("jobs", null, "after-close");

        assertThat(subscription.isActive()).isFalse();
        assertThat(received).isEmpty();
        assertThat(bus.subscriberCount("jobs")).isZero();
    }

    @Test
    void publishWithoutTopicShouldFail() {
        assertThatThrownBy(() -> bus.publish(" ", null, "x"))
                .isInstanceOf(MessageBusException.class);
    }
}
