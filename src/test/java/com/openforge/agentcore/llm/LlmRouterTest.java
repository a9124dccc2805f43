package com.openforge.agentcore.llm;

import com.openforge.agentcore.llm.model.ChatResponse;
import com.openforge.agentcore.llm.model.Message;
import com.openforge.agentcore.llm.model.ToolCall;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmRouterTest {

    private static final List<Message> PROMPT = List.of(Message.user("Where is my order?"));

    private LlmClient primary;
    private LlmClient fallback;

    @BeforeEach
    void setUp() {
        primary  = mock(LlmClient.class);
        fallback = mock(LlmClient.class);
        when(fallback.providerName()).thenReturn("fallback");
    }

    @Test
    void shouldStreamFromPrimaryWhenHealthy() {
        CompletionStream stream = CompletionStream.of(List.of(new CompletionEvent.Completed()));
        when(primary.openStream(any())).thenReturn(stream);

        assertSame(stream, router(fallback).complete(PROMPT, List.of(), true));
        verifyNoInteractions(fallback);
    }

    @Test
    void shouldFallBackAfterPrimaryRetriesAreExhausted() {
        when(primary.openStream(any())).thenThrow(new LlmClient.LlmTransportException("connection refused", null));
        when(fallback.openStream(any()))
                .thenReturn(CompletionStream.of(List.of(new CompletionEvent.ContentDelta("hi"), new CompletionEvent.Completed())));

        List<CompletionEvent> events = drain(router(fallback).complete(PROMPT, List.of(), true));

        assertEquals(new CompletionEvent.ContentDelta("hi"), events.get(0));
        verify(primary, times(2)).openStream(any());
        verify(fallback).openStream(any());
    }

    @Test
    void shouldReturnFailedWhenEveryProviderFails() {
        when(primary.openStream(any())).thenThrow(new LlmClient.LlmRateLimitException("429"));
        when(fallback.openStream(any())).thenThrow(new LlmClient.LlmException("401 unauthorized"));

        List<CompletionEvent> events = drain(router(fallback).complete(PROMPT, List.of(), true));

        assertEquals(1, events.size());
        CompletionEvent.Failed failed = assertInstanceOf(CompletionEvent.Failed.class, events.get(0));
        assertTrue(failed.reason().contains("fallback provider ultimately failed"));
    }

    @Test
    void shouldFailWithoutFallbackConfigured() {
        when(primary.openStream(any())).thenThrow(new LlmClient.LlmException("bad request"));

        List<CompletionEvent> events = drain(router(null).complete(PROMPT, List.of(), true));

        assertInstanceOf(CompletionEvent.Failed.class, events.get(0));
    }

    @Test
    void shouldReplayBlockingReplyAsEvents() {
        ToolCall call = ToolCall.function("call_1", "search_faq", "{\"query\":\"shipping\"}");
        Message reply = Message.assistantToolCalls("Let me look.", List.of(call));
        when(primary.chat(any())).thenReturn(new ChatResponse("resp-1", "chat.completion", 0L, "m",
                List.of(new ChatResponse.Choice(0, reply, "tool_calls")), null));

        List<CompletionEvent> events = drain(router(fallback).complete(PROMPT, List.of(), false));

        assertEquals(List.of(
                new CompletionEvent.ContentDelta("Let me look."),
                new CompletionEvent.ToolCallRequested(call),
                new CompletionEvent.Completed()), events);
    }

    @Test
    void shouldFailOnReplyWithoutChoices() {
        when(primary.chat(any())).thenReturn(new ChatResponse("resp-2", "chat.completion", 0L, "m", List.of(), null));

        List<CompletionEvent> events = drain(router(fallback).complete(PROMPT, List.of(), false));

        assertInstanceOf(CompletionEvent.Failed.class, events.get(0));
    }

    private LlmRouter router(LlmClient fallbackClient) {
        return new LlmRouter(primary, fallbackClient,
                CircuitBreaker.ofDefaults("primary"), CircuitBreaker.ofDefaults("fallback"),
                quickRetry("primary"), quickRetry("fallback"));
    }

    private static Retry quickRetry(String name) {
        return Retry.of(name, RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .build());
    }

    private static List<CompletionEvent> drain(CompletionStream stream) {
        List<CompletionEvent> events = new ArrayList<>();
        try (stream) {
            while (stream.hasNext()) {
                events.add(stream.next());
            }
        }
        return events;
    }
}
