package com.linlay.agentcoordinator.registry;

import com.linlay.agentcoordinator.MutableClock;
import com.linlay.agentcoordinator.config.RegistryProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AgentLivenessMonitorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final AgentRegistry registry = new AgentRegistry(clock);
    private final RegistryProperties properties = new RegistryProperties();

    @Test
    void sweepShouldMarkSilentAgentsOffline() {
        properties.setHeartbeatTimeoutMs(1_000);
        String agentId = registry.register("A", "", List.of(AgentCapability.of("render", "")), Map.of());
        clock.advance(Duration.ofMillis(1_500));

        new AgentLivenessMonitor(registry, properties).sweep();

        assertThat(registry.get(agentId).orElseThrow().status()).isEqualTo(AgentStatus.OFFLINE);
        assertThat(registry.findForTask("render")).isEmpty();
    }

    @Test
    void heartbeatAfterSweepShouldBringAgentBack() {
        properties.setHeartbeatTimeoutMs(1_000);
        String agentId = registry.register("A", "", List.of(AgentCapability.of("render", "")), Map.of());
        clock.advance(Duration.ofMillis(1_500));
        new AgentLivenessMonitor(registry, properties).sweep();

        registry.updateStatus(agentId, AgentStatus.ONLINE);

        assertThat(registry.findForTask("render")).contains(agentId);
    }

    @Test
    void zeroTimeoutShouldDisableSweep() {
        properties.setHeartbeatTimeoutMs(0);
        String agentId = registry.register("A", "", List.of(), Map.of());
        clock.advance(Duration.ofDays(1));

        new AgentLivenessMonitor(registry, properties).sweep();

        assertThat(registry.get(agentId).orElseThrow().status()).isEqualTo(AgentStatus.ONLINE);
    }
}
