package com.linlay.agentcoordinator.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expiry is evaluated lazily on read.
 */
public class InMemoryTtlJsonStore implements TtlJsonStore {

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemoryTtlJsonStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTtlJsonStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(String key, Map<String, Object> value, Duration ttl) {
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(value));
        entries.put(key, new Entry(copy, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<Map<String, Object>> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    private record Entry(Map<String, Object> value, Instant expiresAt) {
    }
}
