package com.openforge.agentcore.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.agentcore.llm.model.Tool;
import com.openforge.agentcore.llm.model.ToolFunction;

/**
 * Immutable description of a callable tool.
 *
 * @param parameters JSON schema of the argument object
 */
public record ToolSpec(
        String   name,
        String   description,
        JsonNode parameters
) {

    public ToolSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        parameters = parameters == null ? null : parameters.deepCopy();
    }

    /** A copy; the registry's schema cannot be changed through it. */
    @Override
    public JsonNode parameters() {
        return parameters == null ? null : parameters.deepCopy();
    }

    public Tool toTool() {
        return Tool.ofFunction(new ToolFunction(name, description, parameters()));
    }
}
