package com.openforge.agentcore.llm.model;

/**
 * A single tool invocation requested by the model.
 *
 * Created by the completion client, consumed exactly once by the turn
 * engine, and persisted inside the assistant message that requested it.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {

    public static ToolCall function(String id, String name, String argumentsJson) {
        return new ToolCall(id, "function", new FunctionCallResult(name, argumentsJson));
    }

    public String name() {
        return function == null ? null : function.name();
    }

    public String arguments() {
        return function == null ? null : function.arguments();
    }

    public ToolCall withId(String newId) {
        return new ToolCall(newId, type, function);
    }
}
