package com.openforge.agentcore.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup table from type tag to {@link AgentKind}, built once at start-up.
 *
 * Each kind's tool registration is exercised here, so a duplicate tool name
 * stops the application from starting instead of failing the first request.
 */
@Slf4j
@Component
public class AgentRegistry {

    private final Map<AgentType, AgentKind> kinds;

    public AgentRegistry(List<AgentKind> agentKinds, AgentFactory agentFactory) {
        Map<AgentType, AgentKind> table = new EnumMap<>(AgentType.class);
        for (AgentKind kind : agentKinds) {
            AgentKind previous = table.putIfAbsent(kind.type(), kind);
            if (previous != null) {
                throw new IllegalStateException("Two agent kinds registered for type " + kind.type().tag()
                        + ": " + previous.getClass().getSimpleName() + ", " + kind.getClass().getSimpleName());
            }
            agentFactory.newToolRegistry(kind);
        }
        this.kinds = Collections.unmodifiableMap(table);
        log.info("[AgentRegistry] Agent kinds available: {}", kinds.keySet());
    }

    public Optional<AgentKind> find(AgentType type) {
        return Optional.ofNullable(kinds.get(type));
    }

    public Set<AgentType> availableTypes() {
        return kinds.keySet();
    }
}
