package com.linlay.agentcoordinator.websocket;

import com.linlay.agentcoordinator.connection.DuplexConnection;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * {@link DuplexConnection} over a WebFlux WebSocket session. Outbound frames are queued on a
 * unicast sink that the session drains; emission is serialized because results, replies and
 * broadcasts may be sent from different threads.
 */
public class WebSocketConnection implements DuplexConnection {

    private final String id;
    private final WebSocketSession session;
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
    private volatile boolean open = true;

    public WebSocketConnection(String id, WebSocketSession session) {
        this.id = id;
        this.session = session;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized boolean send(String frame) {
        if (!open) {
            return false;
        }
        return outbound.tryEmitNext(frame).isSuccess();
    }

    @Override
    public boolean isOpen() {
        return open && session.isOpen();
    }

    @Override
    public void close() {
        synchronized (this) {
            if (!open) {
                return;
            }
            open = false;
            outbound.tryEmitComplete();
        }
        session.close().subscribe();
    }

    Flux<String> outbound() {
        return outbound.asFlux();
    }
}
