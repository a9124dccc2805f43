package com.openforge.agentcore.agent.dto;

import java.util.List;

public record AgentInfoResponse(
        List<String> availableAgentTypes,
        String       historyStore,
        long         cachedAgents,
        List<String> endpoints
) {}
