package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.CoordinatorFixture;
import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.bus.MessageBusException;
import com.linlay.agentcoordinator.connection.ConnectionOrigin;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class JobSubmissionHandlerTest {

    private final CoordinatorFixture fixture = new CoordinatorFixture();
    private final ConnectionOrigin origin = ConnectionOrigin.client("client-1", "user-1");

    @Test
    void textToSceneJobShouldCarrySharedContext() {
        fixture.contextManager.updateContext("lesson-1", Map.of("topic", "volcanoes"), null);

        ResponseEnvelope response = fixture.dispatcher.dispatch(new RequestEnvelope("req-1", null, "text_to_scene",
                Map.of("text", "Lava flows down the mountain", "context_id", "lesson-1", "options", Map.of("style", "cartoon")),
                null), origin);

        assertThat(response.success()).isTrue();
        assertThat(response.message()).isEqualTo("Text to scene request submitted");
        List<String> jobs = fixture.bus.messages(fixture.topic(BusTopics.TEXT_TO_SCENE));
        assertThat(jobs).hasSize(1);
        Map<String, Object> job = fixture.codec.readMap(jobs.get(0));
        assertThat(job)
                .containsEntry("request_id", "req-1")
                .containsEntry("user_id", "user-1")
                .containsEntry("text", "Lava flows down the mountain")
                .containsEntry("context_id", "lesson-1")
                .containsEntry("context", Map.of("topic", "volcanoes"))
                .containsEntry("options", Map.of("style", "cartoon"))
                .containsKey("timestamp");
    }

    @Test
    void textToSceneShouldDefaultContextToUser() {
        fixture.contextManager.updateContext("user-1", Map.of("grade", 4), null);

        fixture.dispatcher.dispatch(RequestEnvelope.of("text_to_scene", Map.of("text", "A quiet forest")), origin);

        Map<String, Object> job = fixture.codec.readMap(fixture.bus.messages(fixture.topic(BusTopics.TEXT_TO_SCENE)).get(0));
        assertThat(job).containsEntry("context_id", "user-1").containsEntry("context", Map.of("grade", 4));
    }

    @Test
    void assetGenerationShouldRequireSceneParams() {
        ResponseEnvelope missing = fixture.dispatcher.dispatch(RequestEnvelope.of("asset_generation", Map.of()), origin);
        ResponseEnvelope present = fixture.dispatcher.dispatch(
                RequestEnvelope.of("asset_generation", Map.of("scene_params", Map.of("objects", List.of("tree")))), origin);

        assertThat(missing.success()).isFalse();
        assertThat(missing.message()).contains("scene_params");
        assertThat(present.success()).isTrue();
        assertThat(present.data()).containsEntry("status", "processing");
        assertThat(fixture.bus.messages(fixture.topic(BusTopics.ASSET_GENERATION))).hasSize(1);
    }

    @Test
    void arRenderingShouldValidateAssetsShape() {
        ResponseEnvelope badAssets = fixture.dispatcher.dispatch(RequestEnvelope.of("ar_rendering",
                Map.of("scene_config", Map.of("lighting", "day"), "assets", "tree.glb")), origin);
        ResponseEnvelope ok = fixture.dispatcher.dispatch(RequestEnvelope.of("ar_rendering",
                Map.of("scene_config", Map.of("lighting", "day"), "assets", List.of("tree.glb"))), origin);

        assertThat(badAssets.success()).isFalse();
        assertThat(ok.success()).isTrue();
        Map<String, Object> job = fixture.codec.readMap(fixture.bus.messages(fixture.topic(BusTopics.AR_RENDERING)).get(0));
        assertThat(job).containsEntry("assets", List.of("tree.glb")).containsEntry("device_info", Map.of());
    }

    @Test
    void sentimentAnalysisShouldRequireText() {
        ResponseEnvelope response = fixture.dispatcher.dispatch(RequestEnvelope.of("analyze_sentiment", Map.of("text", "  ")), origin);

        assertThat(response.success()).isFalse();
        assertThat(fixture.bus.messages(fixture.topic(BusTopics.SENTIMENT_ANALYSIS))).isEmpty();
    }

    @Test
    void publishFailureShouldYieldFailureEnvelope() {
        MessageBus failingBus = mock(MessageBus.class);
        doThrow(new MessageBusException("broker unavailable"))
                .when(failingBus).publish(eq(CoordinatorFixture.TOPIC_PREFIX + BusTopics.ASSET_GENERATION), anyString(), anyString());
        CoordinatorFixture failing = new CoordinatorFixture(failingBus);

        ResponseEnvelope response = failing.dispatcher.dispatch(new RequestEnvelope("req-1", null, "asset_generation",
                Map.of("scene_params", Map.of()), null), origin);

        assertThat(response.success()).isFalse();
        assertThat(response.requestId()).isEqualTo("req-1");
        assertThat(response.message()).contains("broker unavailable");
    }

    @Test
    void invalidPayloadShouldNotReachBus() {
        MessageBus bus = mock(MessageBus.class);
        CoordinatorFixture guarded = new CoordinatorFixture(bus);

        guarded.dispatcher.dispatch(RequestEnvelope.of("ar_rendering", Map.of()), origin);

        verify(bus, never()).publish(anyString(), anyString(), anyString());
    }
}
