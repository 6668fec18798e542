package com.linlay.agentcoordinator.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentStatus {
    ONLINE("online"),
    OFFLINE("offline"),
    BUSY("busy");

    private final String wireName;

    AgentStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AgentStatus fromWireName(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("status is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AgentStatus status : values()) {
            if (status.wireName.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown agent status: " + raw);
    }
}
