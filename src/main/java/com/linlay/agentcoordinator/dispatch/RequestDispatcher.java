package com.linlay.agentcoordinator.dispatch;

import com.linlay.agentcoordinator.connection.ConnectionOrigin;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a request's action to its handler and always produces a response envelope:
 * unknown actions and handler exceptions both become {@code success=false}.
 */
@Component
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private final Map<CoordinatorAction, ActionHandler> handlers;

    public RequestDispatcher(List<ActionHandler> handlers) {
        Map<CoordinatorAction, ActionHandler> table = new EnumMap<>(CoordinatorAction.class);
        for (ActionHandler handler : handlers) {
            ActionHandler existing = table.putIfAbsent(handler.action(), handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate handler for action " + handler.action().wireName()
                        + ": " + existing.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        this.handlers = Collections.unmodifiableMap(table);
        log.debug("Dispatcher ready with actions {}", table.keySet());
    }

    public ResponseEnvelope dispatch(RequestEnvelope request, ConnectionOrigin origin) {
        RequestEnvelope stamped = StringUtils.hasText(request.userId())
                ? request
                : request.withUserId(origin.effectiveUserId());
        log.info("Received request: action={}, requestId={} from {} {}",
                stamped.action(), stamped.requestId(), origin.pool(), origin.connectionId());

        Optional<ActionHandler> handler = CoordinatorAction.fromWireName(stamped.action()).map(handlers::get);
        if (handler.isEmpty()) {
            return ResponseEnvelope.failure(stamped.requestId(), "unknown action: " + stamped.action());
        }

        try {
            ResponseEnvelope response = handler.get().handle(stamped);
            if (response == null) {
                return ResponseEnvelope.failure(stamped.requestId(), "no response produced for " + stamped.action());
            }
            return response;
        } catch (IllegalArgumentException ex) {
            log.debug("Rejected {} request {}: {}", stamped.action(), stamped.requestId(), ex.getMessage());
            return ResponseEnvelope.failure(stamped.requestId(), ex.getMessage());
        } catch (Exception ex) {
            log.warn("Handler for {} failed on request {}", stamped.action(), stamped.requestId(), ex);
            return ResponseEnvelope.failure(stamped.requestId(), "Error processing request: " + ex.getMessage());
        }
    }

    public boolean supports(String action) {
        return CoordinatorAction.fromWireName(action).map(handlers::containsKey).orElse(false);
    }
}
