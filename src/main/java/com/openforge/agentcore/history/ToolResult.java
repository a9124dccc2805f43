package com.openforge.agentcore.history;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Audit record of one tool dispatch. Exactly one of {@code output} and
 * {@code error} is set.
 *
 * @param arguments parsed arguments, or null when they could not be parsed
 * @param error     human-readable failure description, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        String   toolCallId,
        String   toolName,
        JsonNode arguments,
        JsonNode output,
        String   error,
        long     durationMs,
        Instant  timestamp
) {

    public static ToolResult success(String toolCallId, String toolName, JsonNode arguments,
                                     JsonNode output, long durationMs) {
        return new ToolResult(toolCallId, toolName, arguments, output, null, durationMs, Instant.now());
    }

    public static ToolResult failure(String toolCallId, String toolName, JsonNode arguments,
                                     String error, long durationMs) {
        return new ToolResult(toolCallId, toolName, arguments, null, error, durationMs, Instant.now());
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }

    /** Text the model sees in the corresponding tool message. */
    public String modelContent() {
        if (isSuccess()) {
            if (output == null || output.isNull()) return "";
            return output.isTextual() ? output.asText() : output.toString();
        }
        return "Error executing tool '%s': %s".formatted(toolName, error);
    }
}
