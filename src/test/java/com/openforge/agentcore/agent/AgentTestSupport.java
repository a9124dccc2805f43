package com.openforge.agentcore.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openforge.agentcore.config.AgentProperties;
import com.openforge.agentcore.history.HistoryStore;
import com.openforge.agentcore.llm.CompletionClient;
import com.openforge.agentcore.tool.ToolRegistry;
import com.openforge.agentcore.tool.ToolSpec;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/** Builders shared by the agent package tests. */
final class AgentTestSupport {

    private AgentTestSupport() {}

    static AgentProperties properties() {
        return properties(Duration.ofSeconds(5));
    }

    static AgentProperties properties(Duration streamTimeout) {
        return new AgentProperties(
                new AgentProperties.Turn(4, 5, Duration.ofSeconds(5)),
                new AgentProperties.Tools(Duration.ofSeconds(2), 1, Duration.ofMillis(10)),
                new AgentProperties.History(AgentProperties.StoreType.MEMORY, Duration.ofHours(1), 500, 100),
                new AgentProperties.Cache(10, Duration.ofMinutes(5)),
                new AgentProperties.Stream(16, streamTimeout, 2));
    }

    static AgentFactory factory(CompletionClient client, HistoryStore history, ExecutorService executor) {
        return new AgentFactory(client, history, new ObjectMapper(), properties(),
                new ConversationLocks(), executor, executor, executor);
    }

    static AgentKind kind(String persona, String... toolNames) {
        return new AgentKind() {
            @Override
            public AgentType type() {
                return AgentType.CUSTOMER_SERVICE;
            }

            @Override
            public String persona() {
                return persona;
            }

            @Override
            public void registerTools(ToolRegistry registry) {
                for (String name : toolNames) {
                    registry.register(new ToolSpec(name, "test tool", null), args -> new TextNode(name));
                }
            }
        };
    }
}
