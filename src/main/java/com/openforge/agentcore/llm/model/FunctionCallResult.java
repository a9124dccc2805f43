package com.openforge.agentcore.llm.model;

/**
 * The "function" sub-object of a {@link ToolCall}.
 *
 * "arguments" stays a raw JSON string on the wire; the tool registry parses
 * it into an object node on dispatch.
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
