package com.openforge.agentcore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentcore.history.HistoryStore;
import com.openforge.agentcore.history.InMemoryHistoryStore;
import com.openforge.agentcore.history.JpaHistoryStore;
import com.openforge.agentcore.history.RedisHistoryStore;
import com.openforge.agentcore.repository.ConversationMessageRepository;
import com.openforge.agentcore.repository.ConversationStateRepository;
import com.openforge.agentcore.repository.ToolInvocationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the {@link HistoryStore} backend from {@code agent.history.store}.
 * Exactly one of the beans below is created.
 */
@Slf4j
@Configuration
public class HistoryStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "agent.history", name = "store", havingValue = "memory", matchIfMissing = true)
    public HistoryStore inMemoryHistoryStore(AgentProperties properties) {
        AgentProperties.History history = properties.history();
        log.info("[HistoryStore] Using in-memory backend (ttl={})", history.ttl());
        return new InMemoryHistoryStore(history.ttl(), history.maxStoredMessages(), history.toolHistoryLimit());
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.history", name = "store", havingValue = "redis")
    public HistoryStore redisHistoryStore(StringRedisTemplate redisTemplate,
                                          ObjectMapper objectMapper,
                                          AgentProperties properties) {
        AgentProperties.History history = properties.history();
        log.info("[HistoryStore] Using Redis backend (ttl={})", history.ttl());
        return new RedisHistoryStore(redisTemplate, objectMapper, history.ttl(),
                history.maxStoredMessages(), history.toolHistoryLimit());
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.history", name = "store", havingValue = "jpa")
    public HistoryStore jpaHistoryStore(ConversationMessageRepository messageRepository,
                                        ToolInvocationRepository toolInvocationRepository,
                                        ConversationStateRepository stateRepository,
                                        ObjectMapper objectMapper) {
        log.info("[HistoryStore] Using JPA backend");
        return new JpaHistoryStore(messageRepository, toolInvocationRepository, stateRepository, objectMapper);
    }
}
