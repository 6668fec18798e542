package com.linlay.agentcoordinator.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegistryNotification(
        String notificationType,
        String agentId,
        Map<String, Object> agentInfo
) {
    public static final String AGENT_REGISTERED = "agent_registered";
    public static final String AGENT_UNREGISTERED = "agent_unregistered";

    public static RegistryNotification registered(String agentId, Map<String, Object> agentInfo) {
        return new RegistryNotification(AGENT_REGISTERED, agentId, agentInfo == null ? Map.of() : agentInfo);
    }

    public static RegistryNotification unregistered(String agentId) {
        return new RegistryNotification(AGENT_UNREGISTERED, agentId, null);
    }
}
