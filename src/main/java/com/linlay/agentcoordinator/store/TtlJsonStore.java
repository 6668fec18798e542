package com.linlay.agentcoordinator.store;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed JSON documents with a time-to-live. Keys are given without the configured prefix.
 */
public interface TtlJsonStore {

    void put(String key, Map<String, Object> value, Duration ttl);

    Optional<Map<String, Object>> get(String key);

    boolean delete(String key);
}
