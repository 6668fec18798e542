package com.linlay.agentcoordinator.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Inbound request from a client or an agent. One {@code requestId} identifies one logical unit
 * of work end-to-end, including the job message published on the bus and the result that comes back.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RequestEnvelope(
        String requestId,
        String userId,
        String action,
        Map<String, Object> data,
        Instant timestamp
) {
    public RequestEnvelope {
        if (!StringUtils.hasText(requestId)) {
            requestId = UUID.randomUUID().toString();
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static RequestEnvelope of(String action, Map<String, Object> data) {
        return new RequestEnvelope(null, null, action, data, null);
    }

    public RequestEnvelope withUserId(String newUserId) {
        return new RequestEnvelope(requestId, newUserId, action, data, timestamp);
    }
}
