package com.linlay.agentcoordinator.bus;

import java.util.function.Consumer;

/**
 * Durable publish/subscribe transport. Topic names passed here are already prefixed,
 * see {@link BusTopics}.
 */
public interface MessageBus {

    /**
     * Publishes a UTF-8 JSON payload and waits for the transport to acknowledge it.
     *
     * @throws MessageBusException when the message could not be handed to the bus
     */
    void publish(String topic, String key, String payload);

    /**
     * Starts a long-lived consumer on {@code topic}. Listener failures are logged by the
     * implementation and never stop consumption.
     */
    BusSubscription subscribe(String topic, Consumer<String> listener);
}
