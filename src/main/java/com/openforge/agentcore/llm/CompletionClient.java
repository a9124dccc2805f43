package com.openforge.agentcore.llm;

import com.openforge.agentcore.llm.model.Message;
import com.openforge.agentcore.llm.model.Tool;

import java.util.List;

/**
 * Language-model completion interface used by the turn engine.
 *
 * Implementations must not throw for provider problems: transport errors,
 * HTTP errors and malformed replies surface as a terminal
 * {@link CompletionEvent.Failed} event.
 */
public interface CompletionClient {

    /**
     * @param messages persona followed by the conversation context, oldest first
     * @param tools    tools the model may request; empty for none
     * @param stream   true to receive content incrementally, false for a single reply
     */
    CompletionStream complete(List<Message> messages, List<Tool> tools, boolean stream);
}
