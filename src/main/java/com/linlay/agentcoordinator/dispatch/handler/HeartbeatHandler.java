package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.dispatch.ActionHandler;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.dispatch.Payloads;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.registry.AgentRegistry;
import com.linlay.agentcoordinator.registry.AgentStatus;
import org.springframework.stereotype.Component;

/**
 * Refreshes an agent's heartbeat and sets its status, {@code online} unless the agent reports otherwise.
 */
@Component
public class HeartbeatHandler implements ActionHandler {

    private final AgentRegistry agentRegistry;

    public HeartbeatHandler(AgentRegistry agentRegistry) {
        this.agentRegistry = agentRegistry;
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.AGENT_HEARTBEAT;
    }

    @Override
    public ResponseEnvelope handle(RequestEnvelope request) {
        String agentId = Payloads.requireText(request.data(), "agent_id");
        String rawStatus = Payloads.optionalText(request.data(), "status");
        AgentStatus status = rawStatus == null ? AgentStatus.ONLINE : AgentStatus.fromWireName(rawStatus);
        if (!agentRegistry.updateStatus(agentId, status)) {
            return ResponseEnvelope.failure(request.requestId(), "Agent not found: " + agentId);
        }
        return ResponseEnvelope.success(request.requestId(), "Heartbeat received");
    }
}
