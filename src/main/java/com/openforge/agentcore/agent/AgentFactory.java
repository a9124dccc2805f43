package com.openforge.agentcore.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentcore.config.AgentProperties;
import com.openforge.agentcore.history.HistoryStore;
import com.openforge.agentcore.llm.CompletionClient;
import com.openforge.agentcore.tool.ToolRegistry;
import com.openforge.agentcore.tool.ToolSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * Assembles {@link DefaultAgent}s: a fresh tool registry filled by the kind,
 * a turn engine over the shared completion client and history store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentFactory {

    private final CompletionClient  completionClient;
    private final HistoryStore      historyStore;
    private final ObjectMapper      objectMapper;
    private final AgentProperties   properties;
    private final ConversationLocks conversationLocks;
    private final ExecutorService   agentTurnExecutor;
    private final ExecutorService   completionReaderExecutor;
    private final ExecutorService   toolExecutor;

    public Agent create(AgentKind kind, String agentId) {
        ToolRegistry registry = newToolRegistry(kind);
        TurnSettings turnSettings = new TurnSettings(
                properties.turn().maxToolIterations(),
                properties.turn().contextTurns(),
                properties.turn().completionTimeout());
        TurnEngine engine = new TurnEngine(completionClient, historyStore, registry,
                turnSettings, completionReaderExecutor);

        log.info("[AgentFactory] Created {} agent {} with tools {}", kind.type().tag(), agentId,
                registry.describeAll().stream().map(ToolSpec::name).toList());
        return new DefaultAgent(kind.type(), agentId, kind.persona(), registry, engine,
                agentTurnExecutor, conversationLocks, properties.stream().channelCapacity());
    }

    /** Builds and seals a registry for the kind; registration errors propagate. */
    ToolRegistry newToolRegistry(AgentKind kind) {
        ToolRegistry registry = new ToolRegistry(objectMapper, toolExecutor,
                properties.tools().timeout(),
                properties.tools().maxAttempts(),
                properties.tools().retryWait());
        kind.registerTools(registry);
        return registry.seal();
    }
}
