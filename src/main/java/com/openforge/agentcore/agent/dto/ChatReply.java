package com.openforge.agentcore.agent.dto;

import java.time.Instant;

/**
 * Response body for POST /api/agents/chat/non-streaming.
 */
public record ChatReply(
        String  response,
        String  chatId,
        String  userId,
        String  agentType,
        Instant timestamp
) {}
