package com.openforge.agentcore.history;

public record ConversationStats(
        String conversationId,
        long   messageCount,
        long   toolResultCount
) {}
