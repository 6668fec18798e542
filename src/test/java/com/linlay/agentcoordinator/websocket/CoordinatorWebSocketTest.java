package com.linlay.agentcoordinator.websocket;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentcoordinator.bus.BusTopics;
import com.linlay.agentcoordinator.bus.InMemoryMessageBus;
import com.linlay.agentcoordinator.bus.MessageBus;
import com.linlay.agentcoordinator.connection.ConnectionManager;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "coordinator.bus.type=memory",
                "coordinator.store.type=memory",
                "coordinator.auth.client-token-secret=" + CoordinatorWebSocketTest.SECRET,
                "coordinator.auth.agent-api-key=" + CoordinatorWebSocketTest.AGENT_KEY
        }
)
class CoordinatorWebSocketTest {

    static final String SECRET = "websocket-test-token-secret-0123456789abcdef";
    static final String AGENT_KEY = "websocket-test-agent-key";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    @LocalServerPort
    private int port;
    @Autowired
    private MessageBus messageBus;
    @Autowired
    private BusTopics topics;
    @Autowired
    private ConnectionManager connectionManager;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReactorNettyWebSocketClient client = new ReactorNettyWebSocketClient();

    @Test
    void jobResultShouldArriveOnSubmittingConnection() throws Exception {
        URI uri = URI.create("ws://localhost:" + port + "/ws/ws-client-1?token=" + token("user-42"));
        String request = "{\"request_id\":\"ws-req-1\",\"action\":\"analyze_sentiment\",\"data\":{\"text\":\"This lesson is great\"}}";
        List<Map<String, Object>> frames = Collections.synchronizedList(new ArrayList<>());

        client.execute(uri, session -> session.send(Mono.just(session.textMessage(request)))
                .thenMany(session.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .map(this::readMap)
                        .doOnNext(frame -> {
                            frames.add(frame);
                            if (frames.size() == 1) {
                                publishSentimentResult();
                            }
                        })
                        .take(2))
                .then()).block(TIMEOUT);

        assertThat(frames).hasSize(2);
        assertThat(frames.get(0))
                .containsEntry("request_id", "ws-req-1")
                .containsEntry("success", true)
                .containsEntry("data", Map.of("status", "processing"));
        assertThat(frames.get(1))
                .containsEntry("request_id", "ws-req-1")
                .containsEntry("message", "Sentiment analysis completed");

        List<String> jobs = ((InMemoryMessageBus) messageBus).messages(topics.resolve(BusTopics.SENTIMENT_ANALYSIS));
        assertThat(jobs).anySatisfy(job -> assertThat(readMap(job))
                .containsEntry("request_id", "ws-req-1")
                .containsEntry("user_id", "user-42"));
    }

    @Test
    void malformedFrameShouldBeAnsweredAndConnectionKeptOpen() {
        URI uri = URI.create("ws://localhost:" + port + "/ws/ws-client-2");
        List<Map<String, Object>> frames = Collections.synchronizedList(new ArrayList<>());

        client.execute(uri, session -> session.send(Mono.just(session.textMessage("{broken")))
                .then(session.send(Mono.just(session.textMessage("{\"request_id\":\"ws-req-2\",\"action\":\"get_capabilities\"}"))))
                .thenMany(session.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .map(this::readMap)
                        .doOnNext(frames::add)
                        .take(2))
                .then()).block(TIMEOUT);

        assertThat(frames).hasSize(2);
        assertThat(frames.get(0)).containsEntry("success", false);
        assertThat((String) frames.get(0).get("message")).startsWith("Invalid message");
        assertThat(frames.get(1)).containsEntry("request_id", "ws-req-2").containsEntry("success", true);
    }

    @Test
    void agentWithWrongKeyShouldBeRefused() {
        URI uri = URI.create("ws://localhost:" + port + "/agent-ws/ws-agent-1?api_key=wrong");
        AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();

        client.execute(uri, session -> session.receive().then(session.closeStatus().doOnNext(closeStatus::set)).then())
                .block(TIMEOUT);

        assertThat(closeStatus.get()).isNotNull();
        assertThat(closeStatus.get().getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
        assertThat(connectionManager.isAgentConnected("ws-agent-1")).isFalse();
    }

    private void publishSentimentResult() {
        String result = "{\"request_id\":\"ws-req-1\",\"user_id\":\"user-42\",\"sentiment\":{\"label\":\"positive\"}}";
        messageBus.publish(topics.resultsOf(BusTopics.SENTIMENT_ANALYSIS), "ws-req-1", result);
    }

    private Map<String, Object> readMap(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (Exception ex) {
            throw new IllegalStateException(ex);
        }
    }

    private static String token(String userId) throws Exception {
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject("ws-user")
                .claim("user_id", userId)
                .issueTime(new Date())
                .expirationTime(Date.from(Instant.now().plusSeconds(600)))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        jwt.sign(new MACSigner(SECRET.getBytes(StandardCharsets.UTF_8)));
        return jwt.serialize();
    }
}
