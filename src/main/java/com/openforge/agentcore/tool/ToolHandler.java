package com.openforge.agentcore.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Business logic behind a tool. Receives the parsed argument object and
 * returns a JSON result. Any exception becomes an error result the model
 * can read; it never aborts the turn.
 */
@FunctionalInterface
public interface ToolHandler {

    JsonNode handle(ObjectNode arguments) throws Exception;
}
