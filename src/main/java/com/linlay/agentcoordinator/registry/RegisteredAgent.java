package com.linlay.agentcoordinator.registry;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a registry entry. Instances are immutable; the registry replaces the stored
 * snapshot on every status or heartbeat update.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegisteredAgent(
        String agentId,
        String name,
        String description,
        List<AgentCapability> capabilities,
        AgentStatus status,
        Instant lastHeartbeat,
        Map<String, Object> metadata
) {
    public RegisteredAgent {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    RegisteredAgent withStatus(AgentStatus newStatus, Instant heartbeat) {
        return new RegisteredAgent(agentId, name, description, capabilities, newStatus, heartbeat, metadata);
    }

    RegisteredAgent withHeartbeat(Instant heartbeat) {
        return new RegisteredAgent(agentId, name, description, capabilities, status, heartbeat, metadata);
    }
}
