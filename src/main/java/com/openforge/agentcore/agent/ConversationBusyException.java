package com.openforge.agentcore.agent;

public class ConversationBusyException extends RuntimeException {

    public ConversationBusyException(String conversationId) {
        super("A turn is already running for conversation " + conversationId);
    }
}
