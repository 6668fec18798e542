package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.dispatch.Payloads;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ArRenderingHandler extends AbstractJobSubmissionHandler {

    public ArRenderingHandler(MessageBus messageBus, BusTopics topics, EnvelopeCodec codec) {
        super(messageBus, topics, codec);
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.AR_RENDERING;
    }

    @Override
    protected String jobTopic() {
        return BusTopics.AR_RENDERING;
    }

    @Override
    protected String jobLabel() {
        return "AR rendering";
    }

    @Override
    protected Map<String, Object> jobFields(RequestEnvelope request) {
        Map<String, Object> data = request.data();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("scene_config", Payloads.requireMap(data, "scene_config"));
        Object assets = Payloads.valueOrDefault(data, "assets", List.of());
        if (!(assets instanceof List<?>)) {
            throw new IllegalArgumentException("assets must be an array");
        }
        fields.put("assets", assets);
        fields.put("device_info", Payloads.optionalMap(data, "device_info"));
        return fields;
    }
}
