package com.linlay.agentcoordinator.dispatch;

import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.bus.MessageBusException;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RegistryNotification;
import com.linlay.agentcoordinator.registry.RegisteredAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Announces registry membership changes on the registry topic. Publishing is best-effort:
 * a bus failure is logged and the registry change stands.
 */
@Component
public class RegistryEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RegistryEventPublisher.class);

    private final MessageBus messageBus;
    private final BusTopics topics;
    private final EnvelopeCodec codec;

    public RegistryEventPublisher(MessageBus messageBus, BusTopics topics, EnvelopeCodec codec) {
        this.messageBus = messageBus;
        this.topics = topics;
        this.codec = codec;
    }

    public boolean agentRegistered(RegisteredAgent agent) {
        return publish(RegistryNotification.registered(agent.agentId(), codec.toMap(agent)));
    }

    public boolean agentUnregistered(String agentId) {
        return publish(RegistryNotification.unregistered(agentId));
    }

    private boolean publish(RegistryNotification notification) {
        try {
            messageBus.publish(topics.resolve(BusTopics.AGENT_REGISTRY), notification.agentId(), codec.encode(notification));
            return true;
        } catch (MessageBusException ex) {
            log.warn("Failed to publish {} for agent {}", notification.notificationType(), notification.agentId(), ex);
            return false;
        }
    }
}
