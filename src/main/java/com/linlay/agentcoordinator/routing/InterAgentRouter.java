package com.linlay.agentcoordinator.routing;

import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.bus.MessageBusException;
import com.linlay.agentcoordinator.connection.ConnectionManager;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.InterAgentMessage;
import com.linlay.agentcoordinator.registry.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Delivers peer traffic between agents.
 * <p>
 * A message addressed to an agent id goes straight to its live connection; when the agent is not
 * connected, or the send fails, the message is published on the inter-agent topic instead, which
 * gives at-least-once delivery once the agent drains the topic. A capability address is resolved
 * once through {@link AgentRegistry#findForTask(String)} and never queued when nobody owns it.
 */
@Component
public class InterAgentRouter {

    private static final Logger log = LoggerFactory.getLogger(InterAgentRouter.class);

    private final AgentRegistry agentRegistry;
    private final ConnectionManager connectionManager;
    private final MessageBus messageBus;
    private final BusTopics topics;
    private final EnvelopeCodec codec;

    public InterAgentRouter(
            AgentRegistry agentRegistry,
            ConnectionManager connectionManager,
            MessageBus messageBus,
            BusTopics topics,
            EnvelopeCodec codec
    ) {
        this.agentRegistry = agentRegistry;
        this.connectionManager = connectionManager;
        this.messageBus = messageBus;
        this.topics = topics;
        this.codec = codec;
    }

    public boolean route(InterAgentMessage message) {
        if (message == null) {
            return false;
        }
        Optional<InterAgentMessage> addressed = resolveTarget(message);
        if (addressed.isEmpty()) {
            return false;
        }
        InterAgentMessage resolved = addressed.get();
        String targetAgentId = resolved.targetAgentId();

        if (connectionManager.isAgentConnected(targetAgentId) && connectionManager.sendToAgent(targetAgentId, resolved)) {
            log.debug("Delivered {} from {} to {} directly", resolved.messageType(), resolved.sourceAgentId(), targetAgentId);
            return true;
        }

        try {
            messageBus.publish(topics.resolve(BusTopics.INTER_AGENT), targetAgentId, codec.encode(resolved));
            log.debug("Agent {} not reachable, queued {} from {} on bus", targetAgentId, resolved.messageType(), resolved.sourceAgentId());
            return true;
        } catch (MessageBusException ex) {
            log.warn("Failed to queue message from {} for agent {}", resolved.sourceAgentId(), targetAgentId, ex);
            return false;
        }
    }

    /**
     * Hands a message consumed from the inter-agent topic to its target if that agent is live.
     * Never re-publishes: an undeliverable message stays on the bus for the agent's own consumer.
     */
    public boolean deliverFromBus(InterAgentMessage message) {
        if (message == null || !message.hasTargetAgent()) {
            log.debug("Skip inter-agent bus message without target agent");
            return false;
        }
        String targetAgentId = message.targetAgentId();
        if (!connectionManager.isAgentConnected(targetAgentId)) {
            return false;
        }
        return connectionManager.sendToAgent(targetAgentId, message);
    }

    private Optional<InterAgentMessage> resolveTarget(InterAgentMessage message) {
        if (message.hasTargetAgent()) {
            return Optional.of(message);
        }
        if (!message.hasTargetCapability()) {
            log.warn("Inter-agent message from {} has no target agent or capability", message.sourceAgentId());
            return Optional.empty();
        }
        Optional<String> agentId = agentRegistry.findForTask(message.targetCapability());
        if (agentId.isEmpty()) {
            log.warn("No online agent found for capability {}", message.targetCapability());
            return Optional.empty();
        }
        return agentId.map(message::withTargetAgentId);
    }
}
