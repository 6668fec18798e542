package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.dispatch.ActionHandler;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.registry.AgentRegistry;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ListCapabilitiesHandler implements ActionHandler {

    private final AgentRegistry agentRegistry;
    private final EnvelopeCodec codec;

    public ListCapabilitiesHandler(AgentRegistry agentRegistry, EnvelopeCodec codec) {
        this.agentRegistry = agentRegistry;
        this.codec = codec;
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.GET_CAPABILITIES;
    }

    @Override
    public ResponseEnvelope handle(RequestEnvelope request) {
        Map<String, Object> details = new LinkedHashMap<>();
        agentRegistry.capabilityDetails().forEach((name, capability) -> details.put(name, codec.toMap(capability)));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("capabilities", agentRegistry.listCapabilities());
        data.put("capability_details", details);
        return ResponseEnvelope.success(request.requestId(), "Capabilities retrieved successfully", data);
    }
}
