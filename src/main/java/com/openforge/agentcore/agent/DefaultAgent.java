package com.openforge.agentcore.agent;

import com.openforge.agentcore.agent.event.OutputEvent;
import com.openforge.agentcore.tool.ToolRegistry;
import com.openforge.agentcore.tool.ToolSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * The one {@link Agent} implementation: an {@link AgentKind}'s persona and
 * sealed tool registry bound to a {@link TurnEngine}. Kinds differ only in
 * what they register, never in how a turn runs.
 */
@Slf4j
public class DefaultAgent implements Agent {

    private final AgentType         type;
    private final String            agentId;
    private final String            persona;
    private final ToolRegistry      toolRegistry;
    private final TurnEngine        turnEngine;
    private final ExecutorService   turnExecutor;
    private final ConversationLocks conversationLocks;
    private final int               channelCapacity;

    public DefaultAgent(AgentType type,
                        String agentId,
                        String persona,
                        ToolRegistry toolRegistry,
                        TurnEngine turnEngine,
                        ExecutorService turnExecutor,
                        ConversationLocks conversationLocks,
                        int channelCapacity) {
        this.type              = type;
        this.agentId           = agentId;
        this.persona           = persona;
        this.toolRegistry      = toolRegistry;
        this.turnEngine        = turnEngine;
        this.turnExecutor      = turnExecutor;
        this.conversationLocks = conversationLocks;
        this.channelCapacity   = channelCapacity;
    }

    @Override
    public AgentType type() {
        return type;
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public String persona() {
        return persona;
    }

    @Override
    public List<ToolSpec> tools() {
        return toolRegistry.describeAll();
    }

    @Override
    public OutputChannel processMessage(String userText,
                                        String conversationId,
                                        String personaOverride,
                                        boolean stream) {
        Semaphore permit = conversationLocks.tryAcquire(conversationId)
                .orElseThrow(() -> new ConversationBusyException(conversationId));

        String effectivePersona = personaOverride != null && !personaOverride.isBlank()
                ? personaOverride
                : persona;
        OutputChannel channel = new OutputChannel(conversationId, channelCapacity);

        try {
            turnExecutor.execute(() -> {
                try {
                    turnEngine.runTurn(conversationId, userText, effectivePersona, stream, channel);
                } catch (RuntimeException e) {
                    log.error("[Agent:{}] Uncaught exception in turn for conversation {}",
                            agentId, conversationId, e);
                    channel.emit(OutputEvent.error(conversationId, "Turn failed: " + e.getMessage()));
                } finally {
                    permit.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permit.release();
            throw e;
        }
        log.info("[Agent:{}] Turn started for conversation {} (stream={})", agentId, conversationId, stream);
        return channel;
    }
}
