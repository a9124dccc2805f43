package com.openforge.agentcore.config;

import com.openforge.agentcore.agent.AgentRegistry;
import com.openforge.agentcore.agent.AgentType;
import com.openforge.agentcore.history.HistoryStore;
import com.openforge.agentcore.history.StorageUnavailableException;
import com.openforge.agentcore.llm.LlmProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary once the context is ready:
 * history backend (with a live ping), LLM providers with masked keys,
 * turn limits and the registered agent kinds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final HistoryStore    historyStore;
    private final AgentRegistry   agentRegistry;
    private final AgentProperties agentProperties;
    private final LlmProperties   llmProperties;
    private final Environment     env;

    @Override
    public void run(ApplicationArguments args) {
        LlmProperties.ProviderConfig primary  = llmProperties.primary();
        LlmProperties.ProviderConfig fallback = llmProperties.hasFallback() ? llmProperties.fallback() : null;

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              AgentCore  -  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  History Store                                           ║
                ║    Backend        : {}
                ║    Status         : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Turns                                                   ║
                ║    Tool iterations: {}   context turns: {}
                ║    Tool timeout   : {}   attempts: {}
                ║    Agent kinds    : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                historyStore.backendName(),
                probeHistoryStore(),

                primary == null ? "(not configured)" : primary.name(),
                primary == null ? "-" : primary.model(),
                primary == null ? "-" : maskKey(primary.apiKey()),
                fallback == null ? "(none)"
                        : "%s  [%s]  key=%s".formatted(fallback.name(), fallback.model(), maskKey(fallback.apiKey())),

                agentProperties.turn().maxToolIterations(),
                agentProperties.turn().contextTurns(),
                agentProperties.tools().timeout(),
                agentProperties.tools().maxAttempts(),
                agentRegistry.availableTypes().stream().map(AgentType::tag).toList()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String probeHistoryStore() {
        try {
            historyStore.ping();
            return "✔ reachable";
        } catch (StorageUnavailableException e) {
            return "✘ FAILED - " + e.getMessage();
        }
    }

    /**
     * Masks an API key: first 6 chars + "..." + last 4 chars.
     */
    private static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
