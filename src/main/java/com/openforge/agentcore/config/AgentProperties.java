package com.openforge.agentcore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Engine configuration under the "agent" prefix.
 *
 * agent:
 *   turn:
 *     max-tool-iterations: 4
 *     context-turns: 5
 *     completion-timeout: 120s
 *   tools:
 *     timeout: 30s
 *     max-attempts: 1
 *     retry-wait: 200ms
 *   history:
 *     store: memory          # memory | redis | jpa
 *     ttl: 30d
 *     max-stored-messages: 500
 *     tool-history-limit: 100
 *   cache:
 *     max-agents: 1000
 *     idle-ttl: 1h
 *   stream:
 *     channel-capacity: 64
 *     sse-timeout: 10m
 *     turn-threads: 32
 */
@ConfigurationProperties(prefix = "agent")
public record AgentProperties(
        @DefaultValue Turn    turn,
        @DefaultValue Tools   tools,
        @DefaultValue History history,
        @DefaultValue Cache   cache,
        @DefaultValue Stream  stream
) {

    public record Turn(
            @DefaultValue("4")    int      maxToolIterations,
            @DefaultValue("5")    int      contextTurns,
            @DefaultValue("120s") Duration completionTimeout
    ) {}

    public record Tools(
            @DefaultValue("30s")   Duration timeout,
            @DefaultValue("1")     int      maxAttempts,
            @DefaultValue("200ms") Duration retryWait
    ) {}

    public record History(
            @DefaultValue("memory") StoreType store,
            @DefaultValue("30d")    Duration  ttl,
            @DefaultValue("500")    int       maxStoredMessages,
            @DefaultValue("100")    int       toolHistoryLimit
    ) {}

    public record Cache(
            @DefaultValue("1000") long     maxAgents,
            @DefaultValue("1h")   Duration idleTtl
    ) {}

    public record Stream(
            @DefaultValue("64")  int      channelCapacity,
            @DefaultValue("10m") Duration sseTimeout,
            @DefaultValue("32")  int      turnThreads
    ) {}

    public enum StoreType {
        MEMORY,
        REDIS,
        JPA
    }
}
