package com.openforge.agentcore.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Type tags of the agent kinds this service can build. Each tag is backed
 * by exactly one {@link AgentKind} bean.
 */
public enum AgentType {

    CUSTOMER_SERVICE;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AgentType> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(type -> type.tag().equals(normalized))
                .findFirst();
    }
}
