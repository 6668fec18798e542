package com.linlay.agentcoordinator.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reply to a {@link RequestEnvelope}. Bus-mediated jobs answer twice under the same request id:
 * first with a {@code processing} acknowledgement, later with the domain result.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResponseEnvelope(
        String requestId,
        boolean success,
        String message,
        Map<String, Object> data,
        Instant timestamp
) {
    public static final String STATUS_PROCESSING = "processing";

    public ResponseEnvelope {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static ResponseEnvelope success(String requestId, String message, Map<String, Object> data) {
        return new ResponseEnvelope(requestId, true, message, data, null);
    }

    public static ResponseEnvelope success(String requestId, String message) {
        return success(requestId, message, Map.of());
    }

    public static ResponseEnvelope processing(String requestId, String message) {
        return success(requestId, message, Map.of("status", STATUS_PROCESSING));
    }

    public static ResponseEnvelope failure(String requestId, String message) {
        return new ResponseEnvelope(requestId, false, message, Map.of(), null);
    }

    public static ResponseEnvelope failure(String requestId, String message, Map<String, Object> data) {
        return new ResponseEnvelope(requestId, false, message, data, null);
    }
}
