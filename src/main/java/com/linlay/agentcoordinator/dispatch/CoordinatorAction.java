package com.linlay.agentcoordinator.dispatch;

import java.util.List;
import java.util.Optional;

/**
 * Every action the dispatcher understands, by its wire name.
 */
public enum CoordinatorAction {
    TEXT_TO_SCENE("text_to_scene"),
    ASSET_GENERATION("asset_generation"),
    AR_RENDERING("ar_rendering"),
    UPDATE_CONTEXT("update_context"),
    ANALYZE_SENTIMENT("analyze_sentiment"),
    REGISTER_AGENT("register_agent"),
    UNREGISTER_AGENT("unregister_agent"),
    AGENT_HEARTBEAT("agent_heartbeat", "heartbeat"),
    GET_AGENTS("get_agents"),
    GET_CAPABILITIES("get_capabilities"),
    INTER_AGENT_MESSAGE("inter_agent_message");

    private final String wireName;
    private final List<String> aliases;

    CoordinatorAction(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = List.of(aliases);
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<CoordinatorAction> fromWireName(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        for (CoordinatorAction action : values()) {
            if (action.wireName.equals(trimmed) || action.aliases.contains(trimmed)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
