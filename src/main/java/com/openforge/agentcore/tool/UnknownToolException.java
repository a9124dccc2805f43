package com.openforge.agentcore.tool;

/**
 * Raised on lookup of a name that was never registered. Dispatch absorbs it
 * into an error result.
 */
public class UnknownToolException extends RuntimeException {

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
    }
}
