package com.linlay.agentcoordinator.dispatch.handler;

import com.linlay.agentcoordinator.dispatch.ActionHandler;
import com.linlay.agentcoordinator.dispatch.CoordinatorAction;
import com.linlay.agentcoordinator.dispatch.Payloads;
import com.linlay.agentcoordinator.protocol.InterAgentMessage;
import com.linlay.agentcoordinator.protocol.RequestEnvelope;
import com.linlay.agentcoordinator.protocol.ResponseEnvelope;
import com.linlay.agentcoordinator.routing.InterAgentRouter;
import org.springframework.stereotype.Component;

@Component
public class InterAgentMessageHandler implements ActionHandler {

    private final InterAgentRouter router;

    public InterAgentMessageHandler(InterAgentRouter router) {
        this.router = router;
    }

    @Override
    public CoordinatorAction action() {
        return CoordinatorAction.INTER_AGENT_MESSAGE;
    }

    @Override
    public ResponseEnvelope handle(RequestEnvelope request) {
        String source = Payloads.requireText(request.data(), "source_agent_id");
        String targetAgentId = Payloads.optionalText(request.data(), "target_agent_id");
        String targetCapability = Payloads.optionalText(request.data(), "target_capability");
        if (targetAgentId == null && targetCapability == null) {
            throw new IllegalArgumentException("Either target_agent_id or target_capability must be specified");
        }
        InterAgentMessage message = new InterAgentMessage(
                source,
                targetAgentId,
                targetAgentId == null ? targetCapability : null,
                Payloads.optionalText(request.data(), "message_type"),
                Payloads.optionalMap(request.data(), "content"),
                null
        );
        if (!router.route(message)) {
            return ResponseEnvelope.failure(request.requestId(), "Failed to route message");
        }
        return ResponseEnvelope.success(request.requestId(), "Message routed successfully");
    }
}
