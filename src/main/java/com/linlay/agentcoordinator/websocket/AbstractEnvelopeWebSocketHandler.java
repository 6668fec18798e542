package com.linlay.agentcoordinator.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentcoordinator.connection.ConnectionManager;
import com.linlay.agentcoordinator.connection.ConnectionOrigin;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.UUID;

/**
 * Shared reader pipeline for client and agent sockets. The connection id is the last path segment.
 * Frames are handled one at a time in arrival order, off the event loop; a bad frame is answered
 * with a failure envelope and the socket stays open.
 */
public abstract class AbstractEnvelopeWebSocketHandler implements WebSocketHandler {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final ConnectionManager connectionManager;
    protected final EnvelopeCodec codec;

    protected AbstractEnvelopeWebSocketHandler(ConnectionManager connectionManager, EnvelopeCodec codec) {
        this.connectionManager = connectionManager;
        this.codec = codec;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        UriComponents uri = UriComponentsBuilder.fromUri(session.getHandshakeInfo().getUri()).build();
        List<String> segments = uri.getPathSegments();
        String connectionId = segments.isEmpty() ? null : segments.get(segments.size() - 1);
        if (!StringUtils.hasText(connectionId)) {
            log.warn("Rejected connection without id: {}", uri.getPath());
            return session.close(CloseStatus.POLICY_VIOLATION.withReason("missing connection id"));
        }

        ConnectionOrigin origin = authenticate(connectionId, uri.getQueryParams());
        if (origin == null) {
            log.warn("Rejected {} connection {}: authentication failed", poolName(), connectionId);
            return session.close(CloseStatus.POLICY_VIOLATION.withReason("authentication failed"));
        }

        WebSocketConnection connection = new WebSocketConnection(connectionId, session);
        register(connection, origin);

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(frame -> Mono.fromRunnable(() -> process(connection, origin, frame))
                        .subscribeOn(Schedulers.boundedElastic()))
                .then()
                .doFinally(signal -> {
                    unregister(connection);
                    connection.close();
                });
        Mono<Void> output = session.send(connection.outbound().map(session::textMessage));
        return Mono.when(input, output);
    }

    /**
     * @return the origin to tag inbound frames with, or {@code null} to refuse the handshake
     */
    protected abstract ConnectionOrigin authenticate(String connectionId, MultiValueMap<String, String> queryParams);

    protected abstract void register(WebSocketConnection connection, ConnectionOrigin origin);

    protected abstract void unregister(WebSocketConnection connection);

    protected abstract void handleFrame(WebSocketConnection connection, ConnectionOrigin origin, JsonNode root);

    protected abstract String poolName();

    protected void replyFailure(WebSocketConnection connection, ConnectionOrigin origin, JsonNode root, String message) {
        String requestId = codec.peekRequestId(root).orElseGet(() -> UUID.randomUUID().toString());
        connectionManager.reply(origin.pool(), connection, ResponseEnvelope.failure(requestId, message));
    }

    private void process(WebSocketConnection connection, ConnectionOrigin origin, String frame) {
        JsonNode root;
        try {
            root = codec.readTree(frame);
        } catch (IllegalArgumentException ex) {
            log.debug("Invalid frame from {} {}: {}", poolName(), connection.id(), ex.getMessage());
            replyFailure(connection, origin, null, "Invalid message: " + ex.getMessage());
            return;
        }
        try {
            handleFrame(connection, origin, root);
        } catch (RuntimeException ex) {
            log.warn("Failed to handle frame from {} {}", poolName(), connection.id(), ex);
            replyFailure(connection, origin, root, "Error processing message: " + ex.getMessage());
        }
    }
}
