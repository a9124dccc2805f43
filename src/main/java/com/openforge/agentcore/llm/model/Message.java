package com.openforge.agentcore.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * One entry of a conversation log, in the shape sent to the model.
 *
 * role variants:
 *   SYSTEM    - persona; prepended per call, never stored
 *   USER      - caller turn
 *   ASSISTANT - model reply; carries content, tool_calls, or both
 *   TOOL      - result of one tool call; always carries tool_call_id
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        Role role,

        /** Text content. Null for assistant messages that only contain tool_calls. */
        String content,

        /** Present only on assistant messages that request tool invocations. */
        List<ToolCall> toolCalls,

        /** Present only on tool messages; matches the id of the answered ToolCall. */
        String toolCallId
) {

    public Message {
        if (role == null) {
            throw new IllegalArgumentException("Message role must not be null");
        }
        if (role == Role.TOOL && (toolCallId == null || toolCallId.isBlank())) {
            throw new IllegalArgumentException("Tool message must reference a tool_call_id");
        }
        toolCalls = (toolCalls == null || toolCalls.isEmpty()) ? null : List.copyOf(toolCalls);
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message system(String content) {
        return Message.builder().role(Role.SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.USER).content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role(Role.ASSISTANT).content(content).build();
    }

    /** Assistant message of a tool branch; content is whatever text preceded the calls, or null. */
    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder().role(Role.ASSISTANT).content(content).toolCalls(toolCalls).build();
    }

    public static Message toolResult(String toolCallId, String result) {
        return Message.builder().role(Role.TOOL).toolCallId(toolCallId).content(result).build();
    }

    public boolean requestsTools() {
        return role == Role.ASSISTANT && toolCalls != null;
    }
}
