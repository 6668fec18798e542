package com.linlay.agentcoordinator.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentcoordinator.connection.ConnectionManager;
import com.linlay.agentcoordinator.connection.ConnectionOrigin;
import com.linlay.agentcoordinator.dispatch.RequestDispatcher;
import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.security.ConnectionAuthenticator;
import com.linlay.agentcoordinator.security.ConnectionAuthenticator.ClientIdentity;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;

@Component
public class ClientWebSocketHandler extends AbstractEnvelopeWebSocketHandler {

    private final RequestDispatcher dispatcher;
    private final ConnectionAuthenticator authenticator;

    public ClientWebSocketHandler(
            ConnectionManager connectionManager,
            EnvelopeCodec codec,
            RequestDispatcher dispatcher,
            ConnectionAuthenticator authenticator
    ) {
        super(connectionManager, codec);
        this.dispatcher = dispatcher;
        this.authenticator = authenticator;
    }

    @Override
    protected ConnectionOrigin authenticate(String connectionId, MultiValueMap<String, String> queryParams) {
        ClientIdentity identity = authenticator.authenticateClient(queryParams.getFirst("token"));
        return identity.accepted() ? ConnectionOrigin.client(connectionId, identity.userId()) : null;
    }

    @Override
    protected void register(WebSocketConnection connection, ConnectionOrigin origin) {
        connectionManager.connect(connection, origin.userId());
    }

    @Override
    protected void unregister(WebSocketConnection connection) {
        connectionManager.disconnect(connection);
    }

    @Override
    protected void handleFrame(WebSocketConnection connection, ConnectionOrigin origin, JsonNode root) {
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
        return "client";
    }
}
