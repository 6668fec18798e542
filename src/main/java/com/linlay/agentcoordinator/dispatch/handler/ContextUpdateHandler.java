package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.bus.MessageBusException;
import com.linlay.agentcoordinator.dispatch.ActionHandler;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.dispatch.Payloads;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.store.ContextManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges fields into a shared context and mirrors the change on the context-update topic.
 * The response reflects the store write; a failed notification publish is only logged.
 */
@Component
public class ContextUpdateHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ContextUpdateHandler.class);

    private final ContextManager contextManager;
    private final MessageBus messageBus;
    private final BusTopics topics;
    private final EnvelopeCodec codec;

    public ContextUpdateHandler(ContextManager contextManager, MessageBus messageBus, BusTopics topics, EnvelopeCodec codec) {
        this.contextManager = contextManager;
        this.messageBus = messageBus;
        this.topics = topics;
        this.codec = codec;
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.UPDATE_CONTEXT;
    }

    @Override
    public ResponseEnvelope handle(RequestEnvelope request) {
        Map<String, Object> data = request.data();
        Map<String, Object> context = Payloads.requireMap(data, "context");
        String contextId = Payloads.optionalText(data, "context_id");
        if (contextId == null) {
            contextId = request.userId();
        }
        Long expiry = Payloads.optionalLong(data, "expiry");
        Duration ttl = expiry == null ? null : Duration.ofSeconds(expiry);

        boolean stored = contextManager.updateContext(contextId, context, ttl);
        publishNotification(request, contextId, context);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("context_id", contextId);
        if (stored) {
            return ResponseEnvelope.success(request.requestId(), "Context updated successfully", result);
        }
        return ResponseEnvelope.failure(request.requestId(), "Failed to update context", result);
    }

    private void publishNotification(RequestEnvelope request, String contextId, Map<String, Object> context) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("request_id", request.requestId());
        notification.put("user_id", request.userId());
        notification.put("context_id", contextId);
        notification.put("context_data", context);
        notification.put("timestamp", Instant.now().toString());
        try {
            messageBus.publish(topics.resolve(BusTopics.CONTEXT_UPDATE), contextId, codec.encode(notification));
        } catch (MessageBusException ex) {
            log.warn("Failed to publish context update for {}", contextId, ex);
        }
    }
}
