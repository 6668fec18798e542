package com.linlay.agentcoordinator.store;

import com.linlay.agentcoordinator.config.StoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared, expiring context documents that several agents read and extend.
 * Store failures are logged and reported as a {@code false}/empty result, never thrown.
 */
@Component
public class ContextManager {

    private static final Logger log = LoggerFactory.getLogger(ContextManager.class);
    private static final String KEY_PREFIX = "context:";

    private final TtlJsonStore store;
    private final StoreProperties properties;

    public ContextManager(TtlJsonStore store, StoreProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public Optional<Map<String, Object>> getContext(String contextId) {
        if (!StringUtils.hasText(contextId)) {
            return Optional.empty();
        }
        try {
            return store.get(KEY_PREFIX + contextId);
        } catch (StoreException ex) {
            log.warn("Failed to read context {}", contextId, ex);
            return Optional.empty();
        }
    }

    /**
     * Merges {@code fields} into the stored context and resets its expiry.
     *
     * @param ttl expiry; {@code null} or non-positive falls back to {@code coordinator.store.context-ttl-seconds}
     */
    public boolean updateContext(String contextId, Map<String, Object> fields, Duration ttl) {
        if (!StringUtils.hasText(contextId)) {
            return false;
        }
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl() : ttl;
        try {
            Map<String, Object> merged = new LinkedHashMap<>(store.get(KEY_PREFIX + contextId).orElse(Map.of()));
            if (fields != null) {
                merged.putAll(fields);
            }
            store.put(KEY_PREFIX + contextId, merged, effectiveTtl);
            return true;
        } catch (StoreException ex) {
            log.warn("Failed to update context {}", contextId, ex);
            return false;
        }
    }

    public boolean deleteContext(String contextId) {
        if (!StringUtils.hasText(contextId)) {
            return false;
        }
        try {
            store.delete(KEY_PREFIX + contextId);
            return true;
        } catch (StoreException ex) {
            log.warn("Failed to delete context {}", contextId, ex);
            return false;
        }
    }

    public Duration defaultTtl() {
        return Duration.ofSeconds(Math.max(1L, properties.getContextTtlSeconds()));
    }
}
