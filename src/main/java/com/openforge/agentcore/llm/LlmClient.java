package com.openforge.agentcore.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentcore.llm.model.ChatRequest;
import com.openforge.agentcore.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stateless HTTP client for one OpenAI-compatible provider.
 *
 *  chat()        - blocking, returns the whole reply.
 *  openStream()  - SSE; returns once response headers arrive and hands back
 *                  a lazy {@link CompletionStream} over the body.
 *
 * Both throw {@link LlmException} for failures that happen before any
 * output exists, so the router can still fall back to another provider.
 * Failures while reading an open stream surface as a Failed event instead.
 */
@Slf4j
public class LlmClient {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ChatResponse chat(ChatRequest request) {
        String requestBody = serialize(request.withModel(config.model()).toBuilder().stream(null).build());
        log.debug("[LlmClient:{}] → chat POST body-length={}", config.name(), requestBody.length());

        HttpResponse<String> response;
        try {
            response = httpClient.send(buildHttpRequest(requestBody, false),
                    HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmTransportException("Interrupted calling provider [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmTransportException("Network error calling provider [%s]".formatted(config.name()), e);
        }
        return parseFullResponse(response);
    }

    public CompletionStream openStream(ChatRequest request) {
        String requestBody = serialize(request.withModel(config.model()).toBuilder().stream(Boolean.TRUE).build());
        log.debug("[LlmClient:{}] → stream POST body-length={}", config.name(), requestBody.length());

        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(buildHttpRequest(requestBody, true),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmTransportException("Interrupted opening stream to provider [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmTransportException("Network error (streaming) calling provider [%s]".formatted(config.name()), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String snippet;
            try (Stream<String> body = response.body()) {
                snippet = body.limit(20).collect(Collectors.joining("\n"));
            }
            throw statusError(status, snippet);
        }
        return new SseCompletionStream(response.body(), objectMapper, config.name());
    }

    public String providerName() {
        return config.name();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body, boolean streaming) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Accept", streaming ? "text/event-stream" : "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status < 200 || status >= 300) throw statusError(status, body);
        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), body), e);
        }
    }

    private LlmException statusError(int status, String body) {
        if (status == 429) {
            return new LlmRateLimitException("Rate-limited by provider [%s].".formatted(config.name()));
        }
        String snippet = body == null ? "" : body.substring(0, Math.min(2048, body.length()));
        if (status >= 500) {
            return new LlmTransportException(
                    "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, snippet), null);
        }
        return new LlmException("Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, snippet));
    }

    private String serialize(ChatRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request for provider [%s]".formatted(config.name()), e);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    /** Network failure or 5xx; worth retrying. */
    public static class LlmTransportException extends LlmException {
        public LlmTransportException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
