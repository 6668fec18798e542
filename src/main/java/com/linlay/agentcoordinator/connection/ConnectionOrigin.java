package com.linlay.agentcoordinator.connection;

import org.springframework.util.StringUtils;

/**
 * Where an inbound envelope came from: pool, connection id and, for clients, the
 * authenticated user id if one was presented at handshake.
 */
public record ConnectionOrigin(
        ConnectionPool pool,
        String connectionId,
        String userId
) {
    public static ConnectionOrigin client(String clientId, String userId) {
        return new ConnectionOrigin(ConnectionPool.CLIENT, clientId, userId);
    }

    public static ConnectionOrigin agent(String agentId) {
        return new ConnectionOrigin(ConnectionPool.AGENT, agentId, null);
    }

    /**
     * Identity stamped on requests that carry no user id: the authenticated user if known,
     * otherwise the raw connection id.
     */
    public String effectiveUserId() {
        return StringUtils.hasText(userId) ? userId : connectionId;
    }
}
