package com.openforge.agentcore.agent.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classifies every event a turn emits to its caller.
 *
 * Flow: CONTENT* → (DONE | ERROR). Exactly one terminal event per turn.
 */
public enum EventType {

    /** A fragment of assistant text, forwarded as soon as it is produced. */
    CONTENT,

    /** The turn finished; its final assistant message is persisted. */
    DONE,

    /** The turn was aborted. content = message. */
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != CONTENT;
    }
}
