package com.linlay.agentcoordinator.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Coordinator-wide directory of agents and the capabilities they advertise.
 * <p>
 * Single owner of agent state: callers only ever see immutable {@link RegisteredAgent} snapshots.
 * The primary map and the capability index are guarded by one lock; critical sections never do I/O.
 * Both keep insertion order, so {@link #findForTask(String)} is deterministic.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, RegisteredAgent> agents = new LinkedHashMap<>();
    private final Map<String, Set<String>> capabilityIndex = new LinkedHashMap<>();

    @Autowired
    public AgentRegistry() {
        this(Clock.systemUTC());
    }

    // visible for testing
    public AgentRegistry(Clock clock) {
        this.clock = clock;
    }

    public String register(
            String name,
            String description,
            List<AgentCapability> capabilities,
            Map<String, Object> metadata
    ) {
        String agentId = UUID.randomUUID().toString();
        RegisteredAgent agent = new RegisteredAgent(
                agentId,
                name,
                description,
                capabilities,
                AgentStatus.ONLINE,
                clock.instant(),
                metadata
        );
        synchronized (lock) {
            agents.put(agentId, agent);
            for (AgentCapability capability : agent.capabilities()) {
                capabilityIndex.computeIfAbsent(capability.name(), key -> new LinkedHashSet<>()).add(agentId);
            }
        }
        log.info("Agent registered: name={}, agentId={}, capabilities={}",
                name, agentId, agent.capabilities().stream().map(AgentCapability::name).toList());
        return agentId;
    }

    public boolean unregister(String agentId) {
        if (!StringUtils.hasText(agentId)) {
            return false;
        }
        RegisteredAgent removed;
        synchronized (lock) {
            removed = agents.remove(agentId);
            if (removed == null) {
                return false;
            }
            for (AgentCapability capability : removed.capabilities()) {
                Set<String> owners = capabilityIndex.get(capability.name());
                if (owners == null) {
                    continue;
                }
                owners.remove(agentId);
                if (owners.isEmpty()) {
                    capabilityIndex.remove(capability.name());
                }
            }
        }
        log.info("Agent unregistered: name={}, agentId={}", removed.name(), agentId);
        return true;
    }

    /**
     * Sets the status and refreshes the heartbeat.
     */
    public boolean updateStatus(String agentId, AgentStatus status) {
        if (!StringUtils.hasText(agentId) || status == null) {
            return false;
        }
        Instant now = clock.instant();
        synchronized (lock) {
            RegisteredAgent current = agents.get(agentId);
            if (current == null) {
                return false;
            }
            agents.put(agentId, current.withStatus(status, now));
        }
        return true;
    }

    public boolean updateHeartbeat(String agentId) {
        if (!StringUtils.hasText(agentId)) {
            return false;
        }
        Instant now = clock.instant();
        synchronized (lock) {
            RegisteredAgent current = agents.get(agentId);
            if (current == null) {
                return false;
            }
            agents.put(agentId, current.withHeartbeat(now));
        }
        return true;
    }

    public Optional<RegisteredAgent> get(String agentId) {
        if (!StringUtils.hasText(agentId)) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(agents.get(agentId));
        }
    }

    public List<RegisteredAgent> listAll() {
        synchronized (lock) {
            return List.copyOf(agents.values());
        }
    }

    public List<String> listCapabilities() {
        synchronized (lock) {
            return List.copyOf(capabilityIndex.keySet());
        }
    }

    public List<RegisteredAgent> listByCapability(String capabilityName) {
        if (!StringUtils.hasText(capabilityName)) {
            return List.of();
        }
        synchronized (lock) {
            Set<String> owners = capabilityIndex.get(capabilityName);
            if (owners == null) {
                return List.of();
            }
            List<RegisteredAgent> result = new ArrayList<>(owners.size());
            for (String agentId : owners) {
                RegisteredAgent agent = agents.get(agentId);
                if (agent != null) {
                    result.add(agent);
                }
            }
            return List.copyOf(result);
        }
    }

    /**
     * Capability name to its advertised description, taken from the first agent that advertises it.
     */
    public Map<String, AgentCapability> capabilityDetails() {
        Map<String, AgentCapability> details = new LinkedHashMap<>();
        synchronized (lock) {
            for (Map.Entry<String, Set<String>> entry : capabilityIndex.entrySet()) {
                String capabilityName = entry.getKey();
                entry.getValue().stream()
                        .map(agents::get)
                        .filter(agent -> agent != null)
                        .findFirst()
                        .flatMap(agent -> agent.capabilities().stream()
                                .filter(capability -> capability.name().equals(capabilityName))
                                .findFirst())
                        .ifPresent(capability -> details.put(capabilityName, capability));
            }
        }
        return details;
    }

    /**
     * First online agent advertising the capability, in registration order.
     */
    public Optional<String> findForTask(String capabilityName) {
        if (!StringUtils.hasText(capabilityName)) {
            return Optional.empty();
        }
        synchronized (lock) {
            Set<String> owners = capabilityIndex.get(capabilityName);
            if (owners == null) {
                return Optional.empty();
            }
            for (String agentId : owners) {
                RegisteredAgent agent = agents.get(agentId);
                if (agent != null && agent.status() == AgentStatus.ONLINE) {
                    return Optional.of(agentId);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Demotes every non-offline agent whose last heartbeat is older than {@code timeout} to offline.
     * The heartbeat timestamp is left untouched.
     *
     * @return ids of the demoted agents
     */
    public List<String> demoteStale(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        List<String> demoted = new ArrayList<>();
        synchronized (lock) {
            for (Map.Entry<String, RegisteredAgent> entry : agents.entrySet()) {
                RegisteredAgent agent = entry.getValue();
                if (agent.status() != AgentStatus.OFFLINE && agent.lastHeartbeat().isBefore(cutoff)) {
                    entry.setValue(agent.withStatus(AgentStatus.OFFLINE, agent.lastHeartbeat()));
                    demoted.add(entry.getKey());
                }
            }
        }
        return demoted;
    }

    public int size() {
        synchronized (lock) {
            return agents.size();
        }
    }
}
