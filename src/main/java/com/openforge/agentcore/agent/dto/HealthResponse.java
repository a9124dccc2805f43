package com.openforge.agentcore.agent.dto;

import java.util.List;

public record HealthResponse(
        String       status,
        List<String> availableAgentTypes
) {}
