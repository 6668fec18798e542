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
public class SentimentAnalysisHandler extends AbstractJobSubmissionHandler {

    public SentimentAnalysisHandler(MessageBus messageBus, BusTopics topics, EnvelopeCodec codec) {
        super(messageBus, topics, codec);
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.ANALYZE_SENTIMENT;
    }

    @Override
    protected String jobTopic() {
        return BusTopics.SENTIMENT_ANALYSIS;
    }

    @Override
    protected String jobLabel() {
        return "sentiment analysis";
    }

    @Override
    protected Map<String, Object> jobFields(RequestEnvelope request) {
        Map<String, Object> data = request.data();
        String contextId = Payloads.optionalText(data, "context_id");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("text", Payloads.requireText(data, "text"));
        fields.put("context_id", contextId == null ? request.userId() : contextId);
        return fields;
    }
}
