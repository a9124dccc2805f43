package com.openforge.agentcore.agent.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The envelope streamed to the caller of a turn, one per SSE frame.
 *
 * Fields:
 *   type            - discriminator
 *   content         - text fragment for CONTENT, message for ERROR, null for DONE
 *   conversationId  - the conversation the turn belongs to
 *   timestamp       - epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutputEvent(
        EventType type,
        String    content,
        String    conversationId,
        long      timestamp
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static OutputEvent content(String conversationId, String chunk) {
        return new OutputEvent(EventType.CONTENT, chunk, conversationId, now());
    }

    public static OutputEvent done(String conversationId) {
        return new OutputEvent(EventType.DONE, null, conversationId, now());
    }

    public static OutputEvent error(String conversationId, String message) {
        return new OutputEvent(EventType.ERROR, message, conversationId, now());
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type.isTerminal();
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
