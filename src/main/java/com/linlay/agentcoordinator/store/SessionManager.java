package com.linlay.agentcoordinator.store;

import com.linlay.agentcoordinator.config.StoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers which client connection an authenticated user is attached to.
 */
@Component
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
    private static final String KEY_PREFIX = "session:";

    private final TtlJsonStore store;
    private final StoreProperties properties;

    public SessionManager(TtlJsonStore store, StoreProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public boolean saveSession(String userId, String clientId) {
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(clientId)) {
            return false;
        }
        Map<String, Object> session = new LinkedHashMap<>();
        session.put("client_id", clientId);
        session.put("connected_at", Instant.now().toString());
        try {
            store.put(KEY_PREFIX + userId, session, Duration.ofSeconds(Math.max(1L, properties.getSessionTtlSeconds())));
            return true;
        } catch (StoreException ex) {
            log.warn("Failed to save session for user {}", userId, ex);
            return false;
        }
    }

    public Optional<Map<String, Object>> getSession(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        try {
            return store.get(KEY_PREFIX + userId);
        } catch (StoreException ex) {
            log.warn("Failed to read session for user {}", userId, ex);
            return Optional.empty();
        }
    }

    /**
     * Removes the session only while it still points to {@code clientId}; a newer connection of the
     * same user keeps its session.
     */
    public void endSession(String userId, String clientId) {
        if (!StringUtils.hasText(userId)) {
            return;
        }
        try {
            Optional<Map<String, Object>> current = store.get(KEY_PREFIX + userId);
            if (current.isPresent() && clientId.equals(current.get().get("client_id"))) {
                store.delete(KEY_PREFIX + userId);
            }
        } catch (StoreException ex) {
            log.warn("Failed to end session for user {}", userId, ex);
        }
    }
}
