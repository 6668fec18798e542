package com.linlay.agentcoordinator.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Process-local bus for tests and single-node runs. Keeps an append-only log per topic;
 * a new subscriber first replays the backlog (earliest offset), then receives new messages
 * synchronously on the publishing thread.
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final Object lock = new Object();
    private final Map<String, List<String>> logs = new LinkedHashMap<>();
    private final Map<String, List<LocalSubscription>> subscriptions = new LinkedHashMap<>();

    @Override
    public void publish(String topic, String key, String payload) {
        if (topic == null || topic.isBlank()) {
            throw new MessageBusException("topic is required");
        }
        List<LocalSubscription> targets;
        synchronized (lock) {
            logs.computeIfAbsent(topic, ignored -> new ArrayList<>()).add(payload);
            targets = List.copyOf(subscriptions.getOrDefault(topic, List.of()));
        }
        log.debug("Published message to {} key={}", topic, key);
        for (LocalSubscription subscription : targets) {
            subscription.deliver(payload);
        }
    }

    @Override
    public BusSubscription subscribe(String topic, Consumer<String> listener) {
        LocalSubscription subscription = new LocalSubscription(topic, listener);
        List<String> backlog;
        synchronized (lock) {
            subscriptions.computeIfAbsent(topic, ignored -> new ArrayList<>()).add(subscription);
            backlog = List.copyOf(logs.getOrDefault(topic, List.of()));
        }
        for (String payload : backlog) {
            subscription.deliver(payload);
        }
        return subscription;
    }

    public List<String> messages(String topic) {
        synchronized (lock) {
            return List.copyOf(logs.getOrDefault(topic, List.of()));
        }
    }

    public int subscriberCount(String topic) {
        synchronized (lock) {
            return subscriptions.getOrDefault(topic, List.of()).size();
        }
    }

    private final class LocalSubscription implements BusSubscription {

        private final String topic;
        private final Consumer<String> listener;
        private volatile boolean active = true;

        private LocalSubscription(String topic, Consumer<String> listener) {
            this.topic = topic;
            this.listener = listener;
        }

        private void deliver(String payload) {
            if (!active) {
                return;
            }
            try {
                listener.accept(payload);
            } catch (RuntimeException ex) {
                log.warn("Listener failed on {}, continue consuming", topic, ex);
            }
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            active = false;
            synchronized (lock) {
                List<LocalSubscription> current = subscriptions.get(topic);
                if (current != null) {
                    current.remove(this);
                }
            }
        }
    }
}
