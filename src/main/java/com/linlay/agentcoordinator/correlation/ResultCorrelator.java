package com.linlay.agentcoordinator.correlation;

import com.linlay.agentcoordinator.bus.BusSubscription;
import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.connection.ConnectionManager;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RegistryNotification;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.routing.InterAgentRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Consumes result and notification topics and pushes what arrives to the connection it is
 * addressed to. Delivery to clients is at-most-once: a result for a user with no live
 * connection is dropped. A malformed message is logged and skipped.
 */
@Component
public class ResultCorrelator implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ResultCorrelator.class);

    private final MessageBus messageBus;
    private final BusTopics topics;
    private final EnvelopeCodec codec;
    private final ConnectionManager connectionManager;
    private final InterAgentRouter router;

    private final Object lock = new Object();
    private final List<BusSubscription> subscriptions = new ArrayList<>();
    private volatile boolean running;

    public ResultCorrelator(
            MessageBus messageBus,
            BusTopics topics,
            EnvelopeCodec codec,
            ConnectionManager connectionManager,
            InterAgentRouter router
    ) {
        this.messageBus = messageBus;
        this.topics = topics;
        this.codec = codec;
        this.connectionManager = connectionManager;
        this.router = router;
    }

    @Override
    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            subscribe(topics.resultsOf(BusTopics.TEXT_TO_SCENE), this::onTextToSceneResult);
            subscribe(topics.resultsOf(BusTopics.ASSET_GENERATION), this::onAssetGenerationResult);
            subscribe(topics.resultsOf(BusTopics.AR_RENDERING), this::onArRenderingResult);
            subscribe(topics.resultsOf(BusTopics.SENTIMENT_ANALYSIS), this::onSentimentAnalysisResult);
            subscribe(topics.resolve(BusTopics.CONTEXT_UPDATE), this::onContextUpdate);
            subscribe(topics.resolve(BusTopics.INTER_AGENT), this::onInterAgentMessage);
            subscribe(topics.resolve(BusTopics.AGENT_REGISTRY), this::onRegistryEvent);
            running = true;
            log.info("Result correlator subscribed to {} topics", subscriptions.size());
        }
    }

    @Override
    public void stop() {
        synchronized (lock) {
            for (BusSubscription subscription : subscriptions) {
                try {
                    subscription.close();
                } catch (Exception ex) {
                    log.warn("Failed to close subscription on {}", subscription.topic(), ex);
                }
            }
            subscriptions.clear();
            running = false;
        }
        log.info("Result correlator stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void onTextToSceneResult(Map<String, Object> message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scene_params", valueOrDefault(message, "scene_params", Map.of()));
        data.put("recommendations", valueOrDefault(message, "recommendations", List.of()));
        deliverResult(message, "Text to scene conversion", data);
    }

    void onAssetGenerationResult(Map<String, Object> message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("assets", valueOrDefault(message, "assets", List.of()));
        data.put("metadata", valueOrDefault(message, "metadata", Map.of()));
        deliverResult(message, "Asset generation", data);
    }

    void onArRenderingResult(Map<String, Object> message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scene_url", valueOrDefault(message, "scene_url", ""));
        data.put("render_options", valueOrDefault(message, "render_options", Map.of()));
        data.put("preview_image", valueOrDefault(message, "preview_image", ""));
        deliverResult(message, "AR rendering", data);
    }

    void onSentimentAnalysisResult(Map<String, Object> message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sentiment", valueOrDefault(message, "sentiment", Map.of()));
        data.put("engagement_metrics", valueOrDefault(message, "engagement_metrics", Map.of()));
        deliverResult(message, "Sentiment analysis", data);
    }

    void onContextUpdate(Map<String, Object> message) {
        log.debug("Context updated for user {}, context_id {}", message.get("user_id"), message.get("context_id"));
    }

    void onInterAgentMessage(Map<String, Object> message) {
        router.deliverFromBus(codec.toInterAgentMessage(message));
    }

    void onRegistryEvent(Map<String, Object> message) {
        RegistryNotification notification = codec.convertValue(message, RegistryNotification.class);
        if (!StringUtils.hasText(notification.notificationType()) || !StringUtils.hasText(notification.agentId())) {
            log.warn("Skip registry event without type or agent id");
            return;
        }
        int delivered = connectionManager.broadcastToAgents(notification);
        log.debug("Broadcast {} for agent {} to {} agents", notification.notificationType(), notification.agentId(), delivered);
    }

    private void deliverResult(Map<String, Object> message, String label, Map<String, Object> data) {
        String requestId = text(message, "request_id");
        String userId = text(message, "user_id");
        if (requestId == null || userId == null) {
            log.warn("Skip {} result without request_id or user_id", label);
            return;
        }
        ResponseEnvelope response;
        if (isFailure(message)) {
            Object error = message.get("error");
            String reason = error == null ? "" : ": " + error;
            response = ResponseEnvelope.failure(requestId, label + " failed" + reason, data);
        } else {
            response = ResponseEnvelope.success(requestId, label + " completed", data);
        }
        int delivered = connectionManager.sendToUser(userId, response);
        if (delivered == 0) {
            log.debug("No live connection for user {}, dropped {} result {}", userId, label, requestId);
        }
    }

    private void subscribe(String topic, Consumer<Map<String, Object>> callback) {
        subscriptions.add(messageBus.subscribe(topic, payload -> handle(topic, payload, callback)));
    }

    private void handle(String topic, String payload, Consumer<Map<String, Object>> callback) {
        Map<String, Object> message;
        try {
            message = codec.readMap(payload);
        } catch (IllegalArgumentException ex) {
            log.warn("Skip undecodable message on {}: {}", topic, ex.getMessage());
            return;
        }
        try {
            callback.accept(message);
        } catch (RuntimeException ex) {
            log.warn("Failed to process message on {}", topic, ex);
        }
    }

    private static boolean isFailure(Map<String, Object> message) {
        return Boolean.FALSE.equals(message.get("success")) || message.get("error") != null;
    }

    private static Object valueOrDefault(Map<String, Object> message, String key, Object fallback) {
        Object value = message.get(key);
        return value == null ? fallback : value;
    }

    private static String text(Map<String, Object> message, String key) {
        Object value = message.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return StringUtils.hasText(text) ? text : null;
    }
}
