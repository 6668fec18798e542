package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.dispatch.ActionHandler;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.dispatch.RegistryEventPublisher;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.registry.AgentRegistrationRequest;
import com.linlay.agentcoordinator.registry.AgentRegistry;
import com.linlay.agentcoordinator.registry.RegisteredAgent;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class RegisterAgentHandler implements ActionHandler {

    private final AgentRegistry agentRegistry;
    private final RegistryEventPublisher eventPublisher;
    private final EnvelopeCodec codec;

    public RegisterAgentHandler(AgentRegistry agentRegistry, RegistryEventPublisher eventPublisher, EnvelopeCodec codec) {
        this.agentRegistry = agentRegistry;
        this.eventPublisher = eventPublisher;
        this.codec = codec;
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.REGISTER_AGENT;
    }

    @Override
    public ResponseEnvelope handle(RequestEnvelope request) {
        AgentRegistrationRequest registration = parse(request.data());
        String agentId = agentRegistry.register(
                registration.name(),
                registration.description(),
                registration.capabilities(),
                registration.metadata()
        );
        RegisteredAgent agent = agentRegistry.get(agentId)
                .orElseThrow(() -> new IllegalStateException("Agent " + agentId + " vanished during registration"));
        eventPublisher.agentRegistered(agent);
        return ResponseEnvelope.success(request.requestId(), "Agent registered successfully", Map.of("agent_id", agentId));
    }

    private AgentRegistrationRequest parse(Map<String, Object> data) {
        try {
            return codec.convertValue(data, AgentRegistrationRequest.class);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(rootMessage(ex), ex);
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable current = ex;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
