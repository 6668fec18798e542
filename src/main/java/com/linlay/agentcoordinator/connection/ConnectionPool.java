package com.linlay.agentcoordinator.connection;

public enum ConnectionPool {
    CLIENT,
    AGENT
}
