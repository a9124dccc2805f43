package com.openforge.agentcore.agent.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/agents/chat and /chat/non-streaming.
 *
 * @param agentType     type tag; defaults to customer_service
 * @param persona       optional system prompt replacing the agent's own for this turn
 * @param extraMetadata optional caller metadata, kept in the conversation state
 */
public record ChatMessageRequest(

        @NotBlank(message = "message must not be blank")
        @Size(max = 8000, message = "message must not exceed 8000 characters")
        String message,

        @NotBlank(message = "chat_id must not be blank")
        String chatId,

        @NotBlank(message = "user_id must not be blank")
        String userId,

        String agentType,

        String persona,

        JsonNode extraMetadata
) {

    public static final String DEFAULT_AGENT_TYPE = "customer_service";

    public String agentTypeOrDefault() {
        return agentType == null || agentType.isBlank() ? DEFAULT_AGENT_TYPE : agentType;
    }

    public boolean hasExtraMetadata() {
        return extraMetadata != null && !extraMetadata.isNull() && !extraMetadata.isEmpty();
    }

    /** Agents are cached per user and chat. */
    public String agentId() {
        return userId + "_" + chatId;
    }
}
