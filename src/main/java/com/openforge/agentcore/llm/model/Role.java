package com.openforge.agentcore.llm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Author of a {@link Message}. Serialized in lower case, matching the
 * OpenAI wire format ("user", "assistant", "tool", "system").
 */
public enum Role {

    SYSTEM,
    USER,
    ASSISTANT,
    TOOL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Message role must not be null");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
