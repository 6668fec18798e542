package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.dispatch.Payloads;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class AssetGenerationHandler extends AbstractJobSubmissionHandler {

    public AssetGenerationHandler(MessageBus messageBus, BusTopics topics, EnvelopeCodec codec) {
        super(messageBus, topics, codec);
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.ASSET_GENERATION;
    }

    @Override
    protected String jobTopic() {
        return BusTopics.ASSET_GENERATION;
    }

    @Override
    protected String jobLabel() {
        return "asset generation";
    }

    @Override
    protected Map<String, Object> jobFields(RequestEnvelope request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("scene_params", Payloads.requireMap(request.data(), "scene_params"));
        fields.put("options", Payloads.optionalMap(request.data(), "options"));
        return fields;
    }
}
