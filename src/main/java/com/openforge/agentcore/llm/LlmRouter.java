package com.openforge.agentcore.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentcore.llm.model.ChatRequest;
import com.openforge.agentcore.llm.model.ChatResponse;
import com.openforge.agentcore.llm.model.Message;
import com.openforge.agentcore.llm.model.Tool;
import com.openforge.agentcore.llm.model.ToolCall;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link CompletionClient} backed by a primary and an optional fallback
 * OpenAI-compatible provider.
 *
 * Call graph:
 *
 *   complete(messages, tools, stream)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryClient.{openStream|chat}
 *                 ↓ (any exception, including an open circuit)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackClient.{openStream|chat}
 *                 ↓
 *     └─ single Failed event
 *
 * For streaming calls resilience covers the connection phase only. Once a
 * stream is open, content may already have reached the caller, so a break
 * mid-stream ends as Failed rather than silently switching providers.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter implements CompletionClient {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    @Autowired
    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, properties.primary()),
                properties.hasFallback() ? new LlmClient(httpClient, objectMapper, properties.fallback()) : null,
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    // ── CompletionClient ─────────────────────────────────────────────────────

    @Override
    public CompletionStream complete(List<Message> messages, List<Tool> tools, boolean stream) {
        ChatRequest request = ChatRequest.of(messages, tools, stream);
        try {
            if (stream) {
                return route(client -> client.openStream(request));
            }
            return replay(route(client -> client.chat(request)));
        } catch (LlmClient.LlmException e) {
            log.error("[LlmRouter] All providers failed: {}", e.getMessage());
            return CompletionStream.failed(e.getMessage());
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private <T> T route(Function<LlmClient, T> call) {
        try {
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> call.apply(primaryClient), "primary");
        } catch (LlmClient.LlmException primaryException) {
            if (fallbackClient == null) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary provider failed, engaging fallback [{}]. Cause: {}",
                    fallbackClient.providerName(), primaryException.getMessage());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> call.apply(fallbackClient), "fallback");
        }
    }

    /**
     * Decorates the call with circuit-breaker + retry, then executes it.
     */
    private <T> T executeWithResilience(CircuitBreaker cb,
                                        Retry retry,
                                        Supplier<T> call,
                                        String label) {
        Supplier<T> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (Exception e) {
            throw new LlmClient.LlmException(
                    "%s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }

    /** Turns a blocking reply into the same event sequence a stream would produce. */
    private CompletionStream replay(ChatResponse response) {
        Message message = response.firstMessage();
        if (message == null) {
            return CompletionStream.failed("Provider returned no choices in response " + response.id());
        }
        List<CompletionEvent> events = new ArrayList<>();
        if (message.content() != null && !message.content().isEmpty()) {
            events.add(new CompletionEvent.ContentDelta(message.content()));
        }
        if (message.toolCalls() != null) {
            for (ToolCall toolCall : message.toolCalls()) {
                events.add(new CompletionEvent.ToolCallRequested(toolCall));
            }
        }
        events.add(new CompletionEvent.Completed());
        return CompletionStream.of(events);
    }
}
