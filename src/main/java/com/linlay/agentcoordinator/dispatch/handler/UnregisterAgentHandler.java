package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.dispatch.ActionHandler;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.dispatch.Payloads;
import com.linlay.agentcoordinator.dispatch.RegistryEventPublisher;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.registry.AgentRegistry;
import org.springframework.stereotype.Component;

@Component
public class UnregisterAgentHandler implements ActionHandler {

    private final AgentRegistry agentRegistry;
    private final RegistryEventPublisher eventPublisher;

    public UnregisterAgentHandler(AgentRegistry agentRegistry, RegistryEventPublisher eventPublisher) {
        this.agentRegistry = agentRegistry;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.UNREGISTER_AGENT;
    }

    @Override
    public ResponseEnvelope handle(RequestEnvelope request) {
        String agentId = Payloads.requireText(request.data(), "agent_id");
        if (!agentRegistry.unregister(agentId)) {
            return ResponseEnvelope.failure(request.requestId(), "Agent not found: " + agentId);
        }
        eventPublisher.agentUnregistered(agentId);
        return ResponseEnvelope.success(request.requestId(), "Agent unregistered successfully");
    }
}
