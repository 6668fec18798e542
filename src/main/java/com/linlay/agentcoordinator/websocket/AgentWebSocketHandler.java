package com.linlay.agentcoordinator.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentcoordinator.connection.ConnectionManager;
import com.linlay.agentcoordinator.connection.ConnectionOrigin;
import com.linlay.agentcoordinator.dispatch.RequestDispatcher;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.InterAgentMessage;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.routing.InterAgentRouter;
import com.linlay.agentcoordinator.security.ConnectionAuthenticator;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;

/**
 * Agent sockets carry request envelopes like client sockets, plus raw {@link InterAgentMessage}
 * frames which go straight to the router. Peer messages without a source are stamped with the
 * sending agent's id.
 */
@Component
public class AgentWebSocketHandler extends AbstractEnvelopeWebSocketHandler {

    private final RequestDispatcher dispatcher;
    private final InterAgentRouter router;
    private final ConnectionAuthenticator authenticator;

    public AgentWebSocketHandler(
            ConnectionManager connectionManager,
            EnvelopeCodec codec,
            RequestDispatcher dispatcher,
            InterAgentRouter router,
            ConnectionAuthenticator authenticator
    ) {
        super(connectionManager, codec);
        this.dispatcher = dispatcher;
        this.router = router;
        this.authenticator = authenticator;
    }

    @Override
    protected ConnectionOrigin authenticate(String connectionId, MultiValueMap<String, String> queryParams) {
        return authenticator.authenticateAgent(queryParams.getFirst("api_key")) ? ConnectionOrigin.agent(connectionId) : null;
    }

    @Override
    protected void register(WebSocketConnection connection, ConnectionOrigin origin) {
        connectionManager.connectAgent(connection);
    }

    @Override
    protected void unregister(WebSocketConnection connection) {
        connectionManager.disconnectAgent(connection);
    }

    @Override
    protected void handleFrame(WebSocketConnection connection, ConnectionOrigin origin, JsonNode root) {
        if (codec.isInterAgentMessage(root)) {
            routePeerMessage(connection, root);
            return;
        }
        RequestEnvelope request;
        try {
            request = codec.toRequest(root);
        } catch (IllegalArgumentException ex) {
            replyFailure(connection, origin, root, "Invalid request: " + ex.getMessage());
            return;
        }
        ResponseEnvelope response = dispatcher.dispatch(request, origin);
        connectionManager.reply(origin.pool(), connection, response);
    }

    @Override
    protected String poolName() {
        return "agent";
    }

    private void routePeerMessage(WebSocketConnection connection, JsonNode root) {
        InterAgentMessage message;
        try {
            message = codec.toInterAgentMessage(root);
        } catch (IllegalArgumentException ex) {
            log.warn("Invalid inter-agent message from agent {}: {}", connection.id(), ex.getMessage());
            return;
        }
        if (message.sourceAgentId() == null || message.sourceAgentId().isBlank()) {
            message = new InterAgentMessage(
                    connection.id(),
                    message.targetAgentId(),
                    message.targetCapability(),
                    message.messageType(),
                    message.content(),
                    message.timestamp()
            );
        }
        if (!router.route(message)) {
            log.warn("Failed to route {} from agent {}", message.messageType(), connection.id());
        }
    }
}
