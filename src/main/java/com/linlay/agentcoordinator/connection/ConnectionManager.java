package com.linlay.agentcoordinator.connection;

import com.linlay.agentcoordinator.protocol.EnvelopeCodec;
import com.linlay.agentcoordinator.registry.AgentRegistry;
import com.linlay.agentcoordinator.registry.AgentStatus;
import com.linlay.agentcoordinator.store.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Two independent pools of live connections, clients and agents, keyed by connection id.
 * <p>
 * Sends are best-effort: a transport failure is treated as a disconnect and the connection is
 * removed from its pool. Map updates are atomic per key; sends happen outside any lock.
 */
@Component
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final AgentRegistry agentRegistry;
    private final SessionManager sessionManager;
    private final EnvelopeCodec codec;

    private final Map<String, DuplexConnection> clients = new ConcurrentHashMap<>();
    private final Map<String, DuplexConnection> agents = new ConcurrentHashMap<>();
    private final Map<String, String> clientUsers = new ConcurrentHashMap<>();

    public ConnectionManager(AgentRegistry agentRegistry, SessionManager sessionManager, EnvelopeCodec codec) {
        this.agentRegistry = agentRegistry;
        this.sessionManager = sessionManager;
        this.codec = codec;
    }

    public void connect(DuplexConnection connection, String userId) {
        String clientId = connection.id();
        DuplexConnection previous = clients.put(clientId, connection);
        if (previous != null && previous != connection) {
            log.info("Client {} reconnected, closing previous connection", clientId);
            previous.close();
        }
        if (StringUtils.hasText(userId)) {
            clientUsers.put(clientId, userId);
            sessionManager.saveSession(userId, clientId);
            log.info("Authenticated user {} connected as client {}", userId, clientId);
        } else {
            clientUsers.remove(clientId);
            log.info("Anonymous client {} connected", clientId);
        }
    }

    public void connectAgent(DuplexConnection connection) {
        String agentId = connection.id();
        DuplexConnection previous = agents.put(agentId, connection);
        if (previous != null && previous != connection) {
            log.info("Agent {} reconnected, closing previous connection", agentId);
            previous.close();
        }
        if (!agentRegistry.updateStatus(agentId, AgentStatus.ONLINE)) {
            log.debug("Agent {} connected before registering", agentId);
        }
        log.info("Agent {} connected", agentId);
    }

    public boolean disconnect(String clientId) {
        DuplexConnection removed = clientId == null ? null : clients.remove(clientId);
        if (removed == null) {
            return false;
        }
        afterClientRemoved(clientId);
        return true;
    }

    /**
     * Removes the connection only while it is still the one registered under its id.
     */
    public boolean disconnect(DuplexConnection connection) {
        if (!clients.remove(connection.id(), connection)) {
            return false;
        }
        afterClientRemoved(connection.id());
        return true;
    }

    public boolean disconnectAgent(String agentId) {
        DuplexConnection removed = agentId == null ? null : agents.remove(agentId);
        if (removed == null) {
            return false;
        }
        afterAgentRemoved(agentId);
        return true;
    }

    public boolean disconnectAgent(DuplexConnection connection) {
        if (!agents.remove(connection.id(), connection)) {
            return false;
        }
        afterAgentRemoved(connection.id());
        return true;
    }

    public boolean sendToClient(String clientId, Object envelope) {
        DuplexConnection connection = clientId == null ? null : clients.get(clientId);
        if (connection == null) {
            return false;
        }
        return deliver(ConnectionPool.CLIENT, connection, codec.encode(envelope));
    }

    public boolean sendToAgent(String agentId, Object envelope) {
        DuplexConnection connection = agentId == null ? null : agents.get(agentId);
        if (connection == null) {
            return false;
        }
        return deliver(ConnectionPool.AGENT, connection, codec.encode(envelope));
    }

    /**
     * Sends to the client whose connection id is {@code userId} and to every client tagged with
     * that authenticated user id.
     *
     * @return number of connections that accepted the frame
     */
    public int sendToUser(String userId, Object envelope) {
        if (!StringUtils.hasText(userId)) {
            return 0;
        }
        List<DuplexConnection> targets = new ArrayList<>();
        DuplexConnection direct = clients.get(userId);
        if (direct != null) {
            targets.add(direct);
        }
        for (Map.Entry<String, String> entry : clientUsers.entrySet()) {
            if (!userId.equals(entry.getValue()) || entry.getKey().equals(userId)) {
                continue;
            }
            DuplexConnection tagged = clients.get(entry.getKey());
            if (tagged != null) {
                targets.add(tagged);
            }
        }
        if (targets.isEmpty()) {
            return 0;
        }
        String frame = codec.encode(envelope);
        int delivered = 0;
        for (DuplexConnection connection : targets) {
            if (deliver(ConnectionPool.CLIENT, connection, frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Replies on the exact connection a request arrived on.
     */
    public boolean reply(ConnectionPool pool, DuplexConnection connection, Object envelope) {
        return deliver(pool, connection, codec.encode(envelope));
    }

    public int broadcast(Object envelope) {
        return broadcastTo(ConnectionPool.CLIENT, clients, envelope);
    }

    public int broadcastToAgents(Object notification) {
        return broadcastTo(ConnectionPool.AGENT, agents, notification);
    }

    public boolean isClientConnected(String clientId) {
        return clientId != null && clients.containsKey(clientId);
    }

    public boolean isAgentConnected(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }

    public String userIdOf(String clientId) {
        return clientId == null ? null : clientUsers.get(clientId);
    }

    public ConnectionStats stats() {
        List<String> clientIds = clients.keySet().stream().sorted().toList();
        List<String> agentIds = agents.keySet().stream().sorted().toList();
        return new ConnectionStats(clientIds.size(), agentIds.size(), clientIds, agentIds);
    }

    private int broadcastTo(ConnectionPool pool, Map<String, DuplexConnection> connections, Object envelope) {
        List<DuplexConnection> snapshot = List.copyOf(connections.values());
        if (snapshot.isEmpty()) {
            return 0;
        }
        String frame = codec.encode(envelope);
        int delivered = 0;
        for (DuplexConnection connection : snapshot) {
            if (deliver(pool, connection, frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(ConnectionPool pool, DuplexConnection connection, String frame) {
        boolean sent;
        try {
            sent = connection.isOpen() && connection.send(frame);
        } catch (RuntimeException ex) {
            log.warn("Error sending to {} {}", pool.name().toLowerCase(Locale.ROOT), connection.id(), ex);
            sent = false;
        }
        if (!sent) {
            log.warn("Dropping {} connection {} after failed send", pool.name().toLowerCase(Locale.ROOT), connection.id());
            if (pool == ConnectionPool.AGENT) {
                disconnectAgent(connection);
            } else {
                disconnect(connection);
            }
            connection.close();
        }
        return sent;
    }

    private void afterClientRemoved(String clientId) {
        String userId = clientUsers.remove(clientId);
        if (userId != null) {
            sessionManager.endSession(userId, clientId);
        }
        log.info("Client {} disconnected", clientId);
    }

    private void afterAgentRemoved(String agentId) {
        agentRegistry.updateStatus(agentId, AgentStatus.OFFLINE);
        log.info("Agent {} disconnected", agentId);
    }
}
