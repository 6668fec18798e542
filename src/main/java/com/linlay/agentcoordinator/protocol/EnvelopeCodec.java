package com.linlay.agentcoordinator.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * JSON encoding of every envelope that crosses a connection or the bus. Payload maps stay opaque.
 */
@Component
public class EnvelopeCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode readTree(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("empty frame");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("malformed JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("frame must be a JSON object");
        }
        return root;
    }

    /**
     * Raw peer traffic carries {@code message_type} and no {@code action}.
     */
    public boolean isInterAgentMessage(JsonNode root) {
        return root.hasNonNull("message_type") && !root.has("action");
    }

    public RequestEnvelope toRequest(JsonNode root) {
        RequestEnvelope request = convert(root, RequestEnvelope.class);
        if (request.action() == null || request.action().isBlank()) {
            throw new IllegalArgumentException("missing action");
        }
        return request;
    }

    public InterAgentMessage toInterAgentMessage(JsonNode root) {
        return convert(root, InterAgentMessage.class);
    }

    public InterAgentMessage toInterAgentMessage(Map<String, Object> raw) {
        return convert(objectMapper.valueToTree(raw), InterAgentMessage.class);
    }

    public Optional<String> peekRequestId(JsonNode root) {
        JsonNode id = root == null ? null : root.get("request_id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(id.asText());
    }

    public Map<String, Object> readMap(String text) {
        return objectMapper.convertValue(readTree(text), MAP_TYPE);
    }

    public Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }

    public <T> T convertValue(Object raw, Class<T> type) {
        return objectMapper.convertValue(raw, type);
    }

    public String encode(Object envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot encode " + envelope.getClass().getSimpleName(), ex);
        }
    }

    private <T> T convert(JsonNode root, Class<T> type) {
        try {
            return objectMapper.treeToValue(root, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid " + type.getSimpleName() + ": " + ex.getOriginalMessage(), ex);
        }
    }
}
