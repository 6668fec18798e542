package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.dispatch.Payloads;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.store.ContextManager;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Submits narrative text for scene extraction. The job carries a snapshot of the shared context
 * named by {@code context_id}, defaulting to the requesting user.
 */
@Component
public class TextToSceneHandler extends AbstractJobSubmissionHandler {

    private final ContextManager contextManager;

    public TextToSceneHandler(MessageBus messageBus, BusTopics topics, EnvelopeCodec codec, ContextManager contextManager) {
        super(messageBus, topics, codec);
        this.contextManager = contextManager;
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.TEXT_TO_SCENE;
    }

    @Override
    protected String jobTopic() {
        return BusTopics.TEXT_TO_SCENE;
    }

    @Override
    protected String jobLabel() {
        return "text to scene";
    }

    @Override
    protected Map<String, Object> jobFields(RequestEnvelope request) {
        Map<String, Object> data = request.data();
        String text = Payloads.requireText(data, "text");
        String contextId = Payloads.optionalText(data, "context_id");
        if (contextId == null) {
            contextId = request.userId();
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("text", text);
        fields.put("context_id", contextId);
        fields.put("context", contextManager.getContext(contextId).orElse(Map.of()));
        fields.put("options", Payloads.optionalMap(data, "options"));
        return fields;
    }
}
