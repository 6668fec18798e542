package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.bus.MessageBusException;
import com.linlay.agentcoordinator.dispatch.ActionHandler;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validates a job request, publishes it on its topic keyed by request id and acknowledges
 * with a {@code processing} response. The domain result arrives later through the result topic.
 */
public abstract class AbstractJobSubmissionHandler implements ActionHandler {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final MessageBus messageBus;
    private final BusTopics topics;
    private final EnvelopeCodec codec;

    protected AbstractJobSubmissionHandler(MessageBus messageBus, BusTopics topics, EnvelopeCodec codec) {
        this.messageBus = messageBus;
        this.topics = topics;
        this.codec = codec;
    }

    @Override
    public ResponseEnvelope handle(RequestEnvelope request) {
        Map<String, Object> job = new LinkedHashMap<>();
        job.put("request_id", request.requestId());
        job.put("user_id", request.userId());
        job.putAll(jobFields(request));
        job.put("timestamp", Instant.now().toString());

        String topic = topics.resolve(jobTopic());
        try {
            messageBus.publish(topic, request.requestId(), codec.encode(job));
        } catch (MessageBusException ex) {
            log.warn("Failed to submit {} request {}", request.action(), request.requestId(), ex);
            return ResponseEnvelope.failure(request.requestId(), "Error processing " + jobLabel() + " request: " + ex.getMessage());
        }
        log.debug("Submitted {} request {} to {}", request.action(), request.requestId(), topic);
        return ResponseEnvelope.processing(request.requestId(), capitalize(jobLabel()) + " request submitted");
    }

    /**
     * Unprefixed job topic, one of the {@link BusTopics} constants.
     */
    protected abstract String jobTopic();

    protected abstract String jobLabel();

    /**
     * Job-specific fields; throws {@link IllegalArgumentException} when a required field is missing.
     */
    protected abstract Map<String, Object> jobFields(RequestEnvelope request);

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
