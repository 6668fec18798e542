package com.linlay.agentcoordinator.dispatch;

import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;

/**
 * One dispatcher action. Handlers signal invalid input by throwing
 * {@link IllegalArgumentException}; the dispatcher turns any exception into a failure envelope.
 */
public interface ActionHandler {

    CoordinatorAction action();

    ResponseEnvelope handle(RequestEnvelope request);
}
