package com.openforge.agentcore.agent;

import com.openforge.agentcore.tool.ToolSpec;

import java.util.List;

/**
 * A configured conversational agent: persona and tools bound to a turn engine.
 */
public interface Agent {

    AgentType type();

    String agentId();

    String persona();

    List<ToolSpec> tools();

    /**
     * Starts a turn and returns immediately. The turn runs in the background
     * and reports through the returned channel, which always ends with
     * exactly one DONE or ERROR event.
     *
     * @param personaOverride replaces the kind's persona for this turn when non-blank
     * @param stream          false asks the model for one complete reply instead of deltas
     * @throws ConversationBusyException if a turn for the conversation is already running
     */
    OutputChannel processMessage(String userText,
                                 String conversationId,
                                 String personaOverride,
                                 boolean stream);

    default OutputChannel processMessage(String userText, String conversationId) {
        return processMessage(userText, conversationId, null, true);
    }
}
