package com.openforge.agentcore.tool;

public class DuplicateToolNameException extends RuntimeException {

    public DuplicateToolNameException(String toolName) {
        super("Tool already registered: " + toolName);
    }
}
