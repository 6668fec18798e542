package com.linlay.agentcoordinator.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of the {@code register_agent} action.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentRegistrationRequest(
        String name,
        String description,
        List<AgentCapability> capabilities,
        Map<String, Object> metadata
) {
    public AgentRegistrationRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Missing name in registration request");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("Missing capabilities in registration request");
        }
        description = description == null ? "" : description;
        capabilities = List.copyOf(capabilities);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
