package com.openforge.agentcore.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentcore.llm.model.StreamingChunk;
import com.openforge.agentcore.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Translates the SSE line stream of a /chat/completions response into
 * {@link CompletionEvent}s, one line at a time as the caller pulls.
 *
 * Content deltas are surfaced as soon as their frame is read. Tool-call
 * fragments are accumulated per index and emitted, in index order, right
 * before {@link CompletionEvent.Completed}, since their arguments are only
 * whole once the stream ends.
 */
@Slf4j
final class SseCompletionStream implements CompletionStream {

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE        = "[DONE]";

    private final Stream<String>   lines;
    private final Iterator<String> lineIterator;
    private final ObjectMapper     objectMapper;
    private final String           providerName;

    private final Deque<CompletionEvent>            pending   = new ArrayDeque<>();
    private final Map<Integer, ToolCallAccumulator> toolCalls = new TreeMap<>();

    private boolean finished;
    private boolean closed;

    SseCompletionStream(Stream<String> lines, ObjectMapper objectMapper, String providerName) {
        this.lines        = lines;
        this.lineIterator = lines.iterator();
        this.objectMapper = objectMapper;
        this.providerName = providerName;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && !finished) {
            readLine();
        }
        return !pending.isEmpty();
    }

    @Override
    public CompletionEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Completion stream exhausted");
        }
        return pending.poll();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            lines.close();
        } catch (RuntimeException e) {
            log.debug("[LlmClient:{}] Error while closing stream: {}", providerName, e.getMessage());
        }
    }

    // ── Line handling ────────────────────────────────────────────────────────

    private void readLine() {
        String line;
        try {
            if (!lineIterator.hasNext()) {
                finish();
                return;
            }
            line = lineIterator.next();
        } catch (RuntimeException e) {
            log.warn("[LlmClient:{}] Stream broke while reading: {}", providerName, e.getMessage());
            fail("Stream from provider [%s] broke: %s".formatted(providerName, e.getMessage()));
            return;
        }

        if (line.isEmpty() || !line.startsWith(SSE_DATA_PREFIX)) return;
        String payload = line.substring(SSE_DATA_PREFIX.length()).trim();
        if (SSE_DONE.equals(payload)) {
            finish();
            return;
        }

        StreamingChunk chunk;
        try {
            chunk = objectMapper.readValue(payload, StreamingChunk.class);
        } catch (JsonProcessingException e) {
            log.warn("[LlmClient:{}] Failed to parse SSE chunk: {}", providerName, payload);
            return;
        }
        if (chunk.choices() == null || chunk.choices().isEmpty()) return;

        StreamingChunk.DeltaMessage delta = chunk.choices().get(0).delta();
        if (delta == null) return;

        if (delta.content() != null && !delta.content().isEmpty()) {
            pending.add(new CompletionEvent.ContentDelta(delta.content()));
        }
        if (delta.toolCalls() != null) {
            for (StreamingChunk.ToolCallDelta fragment : delta.toolCalls()) {
                int idx = fragment.index() != null ? fragment.index() : 0;
                toolCalls.computeIfAbsent(idx, i -> new ToolCallAccumulator()).merge(fragment);
            }
        }
    }

    private void finish() {
        toolCalls.values().forEach(acc ->
                pending.add(new CompletionEvent.ToolCallRequested(acc.toToolCall())));
        pending.add(new CompletionEvent.Completed());
        finished = true;
        close();
    }

    private void fail(String reason) {
        pending.add(new CompletionEvent.Failed(reason));
        finished = true;
        close();
    }

    // ── Accumulator for streamed tool-call fragments ─────────────────────────

    private static final class ToolCallAccumulator {
        private String              id   = "";
        private String              name = "";
        private final StringBuilder args = new StringBuilder();

        void merge(StreamingChunk.ToolCallDelta fragment) {
            if (fragment.id() != null) id = fragment.id();
            if (fragment.function() != null) {
                if (fragment.function().name()      != null) name = fragment.function().name();
                if (fragment.function().arguments() != null) args.append(fragment.function().arguments());
            }
        }

        ToolCall toToolCall() {
            return ToolCall.function(id, name, args.toString());
        }
    }
}
