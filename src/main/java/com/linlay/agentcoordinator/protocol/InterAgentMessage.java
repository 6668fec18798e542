package com.linlay.agentcoordinator.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Peer traffic between agents. Addressed either to a concrete agent id or to a capability;
 * a capability is resolved to an agent id once, when the message is routed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InterAgentMessage(
        String sourceAgentId,
        String targetAgentId,
        String targetCapability,
        String messageType,
        Map<String, Object> content,
        Instant timestamp
) {
    public static final String DEFAULT_MESSAGE_TYPE = "request";

    public InterAgentMessage {
        if (!StringUtils.hasText(messageType)) {
            messageType = DEFAULT_MESSAGE_TYPE;
        }
        content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean hasTargetAgent() {
        return StringUtils.hasText(targetAgentId);
    }

    public boolean hasTargetCapability() {
        return StringUtils.hasText(targetCapability);
    }

    public InterAgentMessage withTargetAgentId(String agentId) {
        return new InterAgentMessage(sourceAgentId, agentId, targetCapability, messageType, content, timestamp);
    }
}
