package com.linlay.agentcoordinator.registry;

import com.linlay.agentcoordinator.config.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Periodically marks agents whose heartbeat went stale as offline. Entries stay registered;
 * a fresh heartbeat or a reconnect brings them back online.
 */
@Component
public class AgentLivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(AgentLivenessMonitor.class);

    private final AgentRegistry agentRegistry;
    private final RegistryProperties properties;

    public AgentLivenessMonitor(AgentRegistry agentRegistry, RegistryProperties properties) {
        this.agentRegistry = agentRegistry;
        this.properties = properties;
    }

    @Scheduled(
            initialDelayString = "${coordinator.registry.sweep-interval-ms:30000}",
            fixedDelayString = "${coordinator.registry.sweep-interval-ms:30000}"
    )
    public void sweep() {
        long timeoutMs = properties.getHeartbeatTimeoutMs();
        if (timeoutMs <= 0) {
            return;
        }
        List<String> demoted = agentRegistry.demoteStale(Duration.ofMillis(timeoutMs));
        if (!demoted.isEmpty()) {
            log.info("Marked {} agent(s) offline after {}ms without heartbeat: {}", demoted.size(), timeoutMs, demoted);
        }
    }
}
