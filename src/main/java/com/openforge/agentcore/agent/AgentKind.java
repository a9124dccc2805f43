package com.openforge.agentcore.agent;

import com.openforge.agentcore.tool.ToolRegistry;

/**
 * One kind of agent: its type tag, its persona and the tools it offers.
 *
 * Implementations are Spring beans picked up by {@link AgentRegistry}.
 * Adding a kind means adding an {@link AgentType} constant and one bean;
 * the turn engine is never touched.
 */
public interface AgentKind {

    AgentType type();

    /** System prompt prepended to every model call. */
    String persona();

    /**
     * Registers this kind's tools. Called once per agent instance, before
     * the registry is sealed.
     */
    void registerTools(ToolRegistry registry);
}
