package com.linlay.agentcoordinator.controller;

import com.linlay.agentcoordinator.connection.ConnectionManager;
import com.linlay.agentcoordinator.connection.ConnectionStats;
import com.linlay.agentcoordinator.model.api.ApiResponse;
import com.linlay.agentcoordinator.registry.AgentCapability;
import com.linlay.agentcoordinator.registry.AgentRegistry;
import com.linlay.agentcoordinator.registry.RegisteredAgent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the registry and the live connection pools.
 */
@RestController
@RequestMapping("/api/coordinator")
public class CoordinatorController {

    private final AgentRegistry agentRegistry;
    private final ConnectionManager connectionManager;

    public CoordinatorController(AgentRegistry agentRegistry, ConnectionManager connectionManager) {
        this.agentRegistry = agentRegistry;
        this.connectionManager = connectionManager;
    }

    @GetMapping("/agents")
    public ApiResponse<List<RegisteredAgent>> agents(@RequestParam(required = false) String capability) {
        if (capability == null || capability.isBlank()) {
            return ApiResponse.success(agentRegistry.listAll());
        }
        return ApiResponse.success(agentRegistry.listByCapability(capability.trim()));
    }

    @GetMapping("/agents/{agentId}")
    public ApiResponse<RegisteredAgent> agent(@PathVariable String agentId) {
        return agentRegistry.get(agentId)
                .map(ApiResponse::success)
                .orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    @GetMapping("/capabilities")
    public ApiResponse<Map<String, Object>> capabilities() {
        Map<String, AgentCapability> details = agentRegistry.capabilityDetails();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("capabilities", agentRegistry.listCapabilities());
        data.put("capability_details", details);
        return ApiResponse.success(data);
    }

    @GetMapping("/connections")
    public ApiResponse<ConnectionStats> connections() {
        return ApiResponse.success(connectionManager.stats());
    }
}
