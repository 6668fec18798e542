package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.dispatch.ActionHandler;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.registry.AgentRegistry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class ListAgentsHandler implements ActionHandler {

    private final AgentRegistry agentRegistry;
    private final EnvelopeCodec codec;

    public ListAgentsHandler(AgentRegistry agentRegistry, EnvelopeCodec codec) {
        this.agentRegistry = agentRegistry;
        this.codec = codec;
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.GET_AGENTS;
    }

    @Override
    public ResponseEnvelope handle(RequestEnvelope request) {
        List<Map<String, Object>> agents = agentRegistry.listAll().stream()
                .map(codec::toMap)
                .toList();
        return ResponseEnvelope.success(request.requestId(), "Agents retrieved successfully", Map.of("agents", agents));
    }
}
