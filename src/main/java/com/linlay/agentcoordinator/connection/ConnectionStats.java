package com.linlay.agentcoordinator.connection;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConnectionStats(
        int clientCount,
        int agentCount,
        List<String> clientIds,
        List<String> agentIds
) {
}
