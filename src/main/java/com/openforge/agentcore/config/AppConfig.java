package com.openforge.agentcore.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - executors       → turn runners, completion readers, tool handlers, SSE pumps
 *  - Java HttpClient → the only HTTP engine for model providers
 *  - ObjectMapper    → snake_case, Java time, tolerant deserialization
 *
 * Turns run on a fixed pool so the number of concurrent conversations is
 * bounded. The other pools are cached: their threads only ever wait on work
 * a turn thread already owns.
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AppConfig {

    @Bean
    public ExecutorService agentTurnExecutor(AgentProperties properties) {
        return Executors.newFixedThreadPool(properties.stream().turnThreads(),
                new CustomizableThreadFactory("agent-turn-"));
    }

    /** Waits for the next completion event under a deadline. */
    @Bean
    public ExecutorService completionReaderExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("completion-reader-"));
    }

    @Bean
    public ExecutorService toolExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("tool-"));
    }

    /** Copies turn output onto SSE connections. */
    @Bean
    public ExecutorService streamPumpExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("sse-pump-"));
    }

    /**
     * Single, shared HttpClient. Per-request read timeouts are set by
     * LlmClient from the provider configuration.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper for provider JSON, stored history and HTTP replies:
     *  - snake_case property names (tool_calls, finish_reason …)
     *  - ISO-8601 dates, not timestamps
     *  - unknown properties ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
