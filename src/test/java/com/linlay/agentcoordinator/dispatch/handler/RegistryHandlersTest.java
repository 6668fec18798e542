package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.CoordinatorFixture;
import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.bus.MessageBusException;
import com.linlay.agentcoordinator.connection.ConnectionOrigin;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.registry.AgentStatus;
import com.linlay.agentcoordinator.registry.RegisteredAgent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class RegistryHandlersTest {

    private final CoordinatorFixture fixture = new CoordinatorFixture();
    private final ConnectionOrigin origin = ConnectionOrigin.agent("bootstrap");

    @Test
    void registerShouldStoreAgentAndPublishEvent() {
        ResponseEnvelope response = fixture.dispatcher.dispatch(RequestEnvelope.of("register_agent", Map.of(
                "name", "scene-builder",
                "description", "Builds scenes from text",
                "capabilities", List.of(Map.of(
                        "name", "text_to_scene",
                        "description", "Extract a scene",
                        "parameters", Map.of("text", "string"))),
                "metadata", Map.of("version", "1.2")
        )), origin);

        assertThat(response.success()).isTrue();
        String agentId = (String) response.data().get("agent_id");
        RegisteredAgent agent = fixture.registry.get(agentId).orElseThrow();
        assertThat(agent.name()).isEqualTo("scene-builder");
        assertThat(agent.capabilities()).singleElement().satisfies(capability -> {
            assertThat(capability.name()).isEqualTo("text_to_scene");
            assertThat(capability.parameters()).containsEntry("text", "string");
        });
        assertThat(agent.metadata()).containsEntry("version", "1.2");

        List<String> events = fixture.bus.messages(fixture.topic(BusTopics.AGENT_REGISTRY));
        assertThat(events).hasSize(1);
        Map<String, Object> event = fixture.codec.readMap(events.get(0));
        assertThat(event).containsEntry("notification_type", "agent_registered").containsEntry("agent_id", agentId);
        assertThat(event.get("agent_info")).isInstanceOf(Map.class);
    }

    @Test
    void registerWithoutNameShouldFail() {
        ResponseEnvelope response = fixture.dispatcher.dispatch(
                RequestEnvelope.of("register_agent", Map.of("capabilities", List.of())), origin);

        assertThat(response.success()).isFalse();
        assertThat(response.message()).contains("name");
        assertThat(fixture.registry.size()).isZero();
    }

    @Test
    void registerShouldSucceedWhenEventPublishFails() {
        MessageBus failingBus = mock(MessageBus.class);
        doThrow(new MessageBusException("broker unavailable")).when(failingBus).publish(anyString(), anyString(), anyString());
        CoordinatorFixture failing = new CoordinatorFixture(failingBus);

        ResponseEnvelope response = failing.dispatcher.dispatch(RequestEnvelope.of("register_agent",
                Map.of("name", "renderer", "capabilities", List.of(Map.of("name", "render")))), origin);

        assertThat(response.success()).isTrue();
        assertThat(failing.registry.listCapabilities()).containsExactly("render");
    }

    @Test
    void unregisterShouldPublishEventOnlyForKnownAgent() {
        String agentId = fixture.registry.register("renderer", "", List.of(), Map.of());

        ResponseEnvelope removed = fixture.dispatcher.dispatch(RequestEnvelope.of("unregister_agent", Map.of("agent_id", agentId)), origin);
        ResponseEnvelope unknown = fixture.dispatcher.dispatch(RequestEnvelope.of("unregister_agent", Map.of("agent_id", agentId)), origin);

        assertThat(removed.success()).isTrue();
        assertThat(unknown.success()).isFalse();
        List<String> events = fixture.bus.messages(fixture.topic(BusTopics.AGENT_REGISTRY));
        assertThat(events).hasSize(1);
        assertThat(fixture.codec.readMap(events.get(0)))
                .containsEntry("notification_type", "agent_unregistered")
                .doesNotContainKey("agent_info");
    }

    @Test
    void heartbeatShouldApplyReportedStatus() {
        String agentId = fixture.registry.register("renderer", "", List.of(), Map.of());

        ResponseEnvelope busy = fixture.dispatcher.dispatch(
                RequestEnvelope.of("agent_heartbeat", Map.of("agent_id", agentId, "status", "busy")), origin);
        ResponseEnvelope invalid = fixture.dispatcher.dispatch(
                RequestEnvelope.of("agent_heartbeat", Map.of("agent_id", agentId, "status", "sleeping")), origin);
        ResponseEnvelope unknown = fixture.dispatcher.dispatch(
                RequestEnvelope.of("agent_heartbeat", Map.of("agent_id", "missing")), origin);

        assertThat(busy.success()).isTrue();
        assertThat(fixture.registry.get(agentId).orElseThrow().status()).isEqualTo(AgentStatus.BUSY);
        assertThat(invalid.success()).isFalse();
        assertThat(unknown.success()).isFalse();
        assertThat(unknown.message()).contains("missing");
    }

    @Test
    void listingsShouldReflectRegistry() {
        fixture.dispatcher.dispatch(RequestEnvelope.of("register_agent", Map.of("name", "renderer",
                "capabilities", List.of(Map.of("name", "render", "description", "Render AR scene")))), origin);

        ResponseEnvelope agents = fixture.dispatcher.dispatch(RequestEnvelope.of("get_agents", Map.of()), origin);
        ResponseEnvelope capabilities = fixture.dispatcher.dispatch(RequestEnvelope.of("get_capabilities", Map.of()), origin);

        assertThat(agents.success()).isTrue();
        assertThat((List<?>) agents.data().get("agents")).hasSize(1);
        assertThat(capabilities.data()).containsEntry("capabilities", List.of("render"));
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> details = (Map<String, Map<String, Object>>) capabilities.data().get("capability_details");
        assertThat(details.get("render")).containsEntry("description", "Render AR scene");
    }
}
