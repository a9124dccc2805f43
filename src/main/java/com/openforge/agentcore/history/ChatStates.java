package com.openforge.agentcore.history;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Shape and merge rules of the per-conversation state document, shared by
 * every backend.
 *
 * A fresh state carries chat_id, created_at, updated_at and empty
 * user_preferences / conversation_context objects. Merging replaces
 * top-level fields only and always restamps updated_at.
 */
final class ChatStates {

    static final String CHAT_ID    = "chat_id";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    private ChatStates() {}

    static ObjectNode initial(String conversationId, Instant now) {
        ObjectNode state = JsonNodeFactory.instance.objectNode();
        state.put(CHAT_ID, conversationId);
        state.put(CREATED_AT, now.toString());
        state.put(UPDATED_AT, now.toString());
        state.putObject("user_preferences");
        state.putObject("conversation_context");
        return state;
    }

    /** Returns a new document; {@code current} is left untouched. */
    static ObjectNode merge(ObjectNode current, ObjectNode update, Instant now) {
        ObjectNode merged = current.deepCopy();
        if (update != null) {
            merged.setAll(update.deepCopy());
        }
        merged.put(UPDATED_AT, now.toString());
        return merged;
    }
}
