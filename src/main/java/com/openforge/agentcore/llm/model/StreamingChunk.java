package com.openforge.agentcore.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One SSE data frame of a streaming /chat/completions response.
 *
 * Wire format:
 *   data: {"id":"chatcmpl-xxx","choices":[{"index":0,"delta":{"content":"Hi"},"finish_reason":null}]}
 *   ...
 *   data: [DONE]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingChunk(
        String id,
        String object,
        Long created,
        String model,
        List<ChunkChoice> choices
) {

    public record ChunkChoice(
            int index,
            DeltaMessage delta,
            String finishReason
    ) {}

    /**
     * Sparse delta: only the fields that changed in this frame are non-null.
     */
    public record DeltaMessage(
            String role,
            String content,
            List<ToolCallDelta> toolCalls
    ) {}

    /**
     * Tool-call fragment. The name usually arrives in the first fragment of an
     * index and the arguments JSON is spread across the following ones.
     */
    public record ToolCallDelta(
            Integer index,
            String id,
            String type,
            FunctionDelta function
    ) {}

    public record FunctionDelta(
            String name,
            String arguments
    ) {}
}
