package com.openforge.agentcore.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Request body for an OpenAI-compatible /chat/completions endpoint.
 *
 * toolChoice is "auto" whenever tools are offered and omitted otherwise.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens,
        Boolean stream
) {

    public static ChatRequest of(List<Message> messages, List<Tool> tools, boolean stream) {
        boolean hasTools = tools != null && !tools.isEmpty();
        return ChatRequest.builder()
                .messages(messages)
                .tools(hasTools ? tools : null)
                .toolChoice(hasTools ? "auto" : null)
                .temperature(0.7)
                .maxTokens(4096)
                .stream(stream ? Boolean.TRUE : null)
                .build();
    }

    public ChatRequest withModel(String modelName) {
        return toBuilder().model(modelName).build();
    }
}
