package com.linlay.agentcoordinator.routing;

import com.linlay.agentcoordinator.CoordinatorFixture;
import com.linlay.agentcoordinator.RecordingConnection;
import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.bus.MessageBusException;
import com.linlay.agentcoordinator.connection.ConnectionOrigin;
import com.linlay.agentcoordinator.protocol.InterAgentMessage;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.registry.AgentCapability;
import com.linlay.agentcoordinator.registry.AgentStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class InterAgentRouterTest {

    private final CoordinatorFixture fixture = new CoordinatorFixture();
    private final String interAgentTopic = fixture.topic(BusTopics.INTER_AGENT);

    @Test
    void unownedCapabilityShouldFailWithoutQueueing() {
        InterAgentMessage message = new InterAgentMessage("scene-agent", null, "render", null, Map.of(), null);

        assertThat(fixture.router.route(message)).isFalse();
        assertThat(fixture.bus.messages(interAgentTopic)).isEmpty();
    }

    @Test
    void missingTargetShouldFail() {
        assertThat(fixture.router.route(new InterAgentMessage("scene-agent", null, null, null, Map.of(), null))).isFalse();
        assertThat(fixture.router.route(null)).isFalse();
    }

    @Test
    void connectedTargetShouldReceiveDirectly() {
        RecordingConnection target = new RecordingConnection("render-agent");
        fixture.connections.connectAgent(target);

        boolean routed = fixture.router.route(new InterAgentMessage(
                "scene-agent", "render-agent", null, "notify", Map.of("scene_id", "s1"), null));

        assertThat(routed).isTrue();
        assertThat(target.frames()).hasSize(1);
        Map<String, Object> frame = fixture.codec.readMap(target.frames().get(0));
        assertThat(frame)
                .containsEntry("source_agent_id", "scene-agent")
                .containsEntry("message_type", "notify")
                .containsEntry("content", Map.of("scene_id", "s1"));
        assertThat(fixture.bus.messages(interAgentTopic)).isEmpty();
    }

    @Test
    void disconnectedTargetShouldFallBackToBus() {
        boolean routed = fixture.router.route(new InterAgentMessage(
                "scene-agent", "render-agent", null, null, Map.of("scene_id", "s1"), null));

        assertThat(routed).isTrue();
        List<String> queued = fixture.bus.messages(interAgentTopic);
        assertThat(queued).hasSize(1);
        assertThat(fixture.codec.readMap(queued.get(0)))
                .containsEntry("target_agent_id", "render-agent")
                .containsEntry("message_type", "request");
    }

    @Test
    void failedDirectSendShouldFallBackToBus() {
        RecordingConnection target = new RecordingConnection("render-agent");
        target.failSends();
        fixture.connections.connectAgent(target);

        boolean routed = fixture.router.route(new InterAgentMessage("scene-agent", "render-agent", null, null, Map.of(), null));

        assertThat(routed).isTrue();
        assertThat(fixture.connections.isAgentConnected("render-agent")).isFalse();
        assertThat(fixture.bus.messages(interAgentTopic)).hasSize(1);
    }

    @Test
    void capabilityShouldResolveToOnlineAgentOnce() {
        String offline = fixture.registry.register("old-renderer", "", List.of(AgentCapability.of("render", "")), Map.of());
        String online = fixture.registry.register("renderer", "", List.of(AgentCapability.of("render", "")), Map.of());
        fixture.registry.updateStatus(offline, AgentStatus.OFFLINE);
        RecordingConnection target = new RecordingConnection(online);
        fixture.connections.connectAgent(target);

        boolean routed = fixture.router.route(new InterAgentMessage("scene-agent", null, "render", null, Map.of(), null));

        assertThat(routed).isTrue();
        assertThat(fixture.codec.readMap(target.frames().get(0)))
                .containsEntry("target_agent_id", online)
                .containsEntry("target_capability", "render");
    }

    @Test
    void busFailureShouldReportFalse() {
        MessageBus failingBus = mock(MessageBus.class);
        doThrow(new MessageBusException("broker unavailable")).when(failingBus).publish(anyString(), anyString(), anyString());
        CoordinatorFixture failing = new CoordinatorFixture(failingBus);

        assertThat(failing.router.route(new InterAgentMessage("a", "b", null, null, Map.of(), null))).isFalse();
    }

    @Test
    void deliverFromBusShouldNeverRepublish() {
        RecordingConnection target = new RecordingConnection("render-agent");
        InterAgentMessage message = new InterAgentMessage("scene-agent", "render-agent", null, null, Map.of(), null);

        assertThat(fixture.router.deliverFromBus(message)).isFalse();
        fixture.connections.connectAgent(target);
        assertThat(fixture.router.deliverFromBus(message)).isTrue();

        assertThat(target.frames()).hasSize(1);
        assertThat(fixture.bus.messages(interAgentTopic)).isEmpty();
    }

    @Test
    void dispatchedInterAgentMessageShouldRequireTarget() {
        ConnectionOrigin origin = ConnectionOrigin.agent("scene-agent");

        ResponseEnvelope noTarget = fixture.dispatcher.dispatch(RequestEnvelope.of("inter_agent_message",
                Map.of("source_agent_id", "scene-agent", "content", Map.of())), origin);
        ResponseEnvelope noOwner = fixture.dispatcher.dispatch(RequestEnvelope.of("inter_agent_message",
                Map.of("source_agent_id", "scene-agent", "target_capability", "render")), origin);
        ResponseEnvelope queued = fixture.dispatcher.dispatch(RequestEnvelope.of("inter_agent_message",
                Map.of("source_agent_id", "scene-agent", "target_agent_id", "render-agent")), origin);

        assertThat(noTarget.success()).isFalse();
        assertThat(noTarget.message()).contains("target_agent_id");
        assertThat(noOwner.success()).isFalse();
        assertThat(queued.success()).isTrue();
    }
}
