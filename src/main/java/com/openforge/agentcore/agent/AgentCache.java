package com.openforge.agentcore.agent;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.openforge.agentcore.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Live agent instances keyed by {@code type:agentId}.
 *
 * Bounded by size (least recently used go first) and by idle time. An
 * evicted agent is simply rebuilt on next use; its history lives in the
 * history store, not in the agent.
 */
@Slf4j
@Component
public class AgentCache {

    private final AgentRegistry             agentRegistry;
    private final AgentFactory              agentFactory;
    private final Cache<String, Agent>      agents;

    public AgentCache(AgentRegistry agentRegistry, AgentFactory agentFactory, AgentProperties properties) {
        this.agentRegistry = agentRegistry;
        this.agentFactory  = agentFactory;
        this.agents = Caffeine.newBuilder()
                .maximumSize(properties.cache().maxAgents())
                .expireAfterAccess(properties.cache().idleTtl())
                .removalListener((String key, Agent agent, RemovalCause cause) ->
                        log.info("[AgentCache] Evicted agent {} ({})", key, cause))
                .build();
    }

    /**
     * @throws IllegalArgumentException if no kind is registered for the type
     */
    public Agent getOrCreate(AgentType type, String agentId) {
        AgentKind kind = agentRegistry.find(type)
                .orElseThrow(() -> new IllegalArgumentException("No agent kind registered for " + type.tag()));
        return agents.get(key(type, agentId), k -> agentFactory.create(kind, agentId));
    }

    public boolean evict(AgentType type, String agentId) {
        String key = key(type, agentId);
        boolean present = agents.getIfPresent(key) != null;
        agents.invalidate(key);
        return present;
    }

    public long size() {
        agents.cleanUp();
        return agents.estimatedSize();
    }

    public List<String> keys() {
        return List.copyOf(agents.asMap().keySet());
    }

    private static String key(AgentType type, String agentId) {
        return type.tag() + ":" + agentId;
    }
}
