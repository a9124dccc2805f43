package com.openforge.agentcore.llm.model;

/**
 * One entry in the "tools" array sent to the model.
 */
public record Tool(
        String type,
        ToolFunction function
) {

    public static Tool ofFunction(ToolFunction function) {
        return new Tool("function", function);
    }
}
