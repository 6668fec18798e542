package com.linlay.agentcoordinator.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named unit of work an agent advertises. Immutable once advertised.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentCapability(
        String name,
        String description,
        Map<String, Object> parameters,
        Map<String, Object> example
) {
    public AgentCapability {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("capability name is required");
        }
        name = name.trim();
        description = description == null ? "" : description;
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        if (example != null) {
            example = Collections.unmodifiableMap(new LinkedHashMap<>(example));
        }
    }

    public static AgentCapability of(String name, String description) {
        return new AgentCapability(name, description, Map.of(), null);
    }
}
