package com.linlay.agentcoordinator.connection;

/**
 * An addressable, live, bidirectional link to a client or an agent. Implementations only move
 * encoded frames; they never look inside them.
 */
public interface DuplexConnection {

    String id();

    /**
     * Best-effort send of one text frame.
     *
     * @return {@code false} when the transport refused the frame
     */
    boolean send(String frame);

    boolean isOpen();

    void close();
}
