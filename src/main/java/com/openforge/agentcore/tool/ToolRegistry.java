package com.openforge.agentcore.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.agentcore.history.ToolResult;
import com.openforge.agentcore.llm.model.Tool;
import com.openforge.agentcore.llm.model.ToolCall;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Name → handler table for one agent.
 *
 * Filled during agent construction, then {@link #seal() sealed}; after that
 * it is read-only and safe to share across threads without locking.
 *
 * {@link #dispatch(ToolCall)} never throws for tool problems. Unknown names,
 * unparseable arguments, handler exceptions and timeouts all come back as an
 * error {@link ToolResult} so the model can see what went wrong.
 */
@Slf4j
public class ToolRegistry {

    private final ObjectMapper    objectMapper;
    private final ExecutorService toolExecutor;
    private final Duration        timeout;
    private final Retry           retry;

    private final Map<String, RegisteredTool> building = new LinkedHashMap<>();
    private volatile Map<String, RegisteredTool> sealed;

    /**
     * @param maxAttempts total attempts per dispatch; 1 disables retrying
     */
    public ToolRegistry(ObjectMapper objectMapper,
                        ExecutorService toolExecutor,
                        Duration timeout,
                        int maxAttempts,
                        Duration retryWait) {
        this.objectMapper = objectMapper;
        this.toolExecutor = toolExecutor;
        this.timeout      = timeout;
        this.retry        = maxAttempts > 1
                ? Retry.of("tool-dispatch", RetryConfig.custom()
                        .maxAttempts(maxAttempts)
                        .waitDuration(retryWait)
                        .ignoreExceptions(InterruptedException.class)
                        .build())
                : null;
    }

    // ── Registration ─────────────────────────────────────────────────────────

    public synchronized void register(ToolSpec spec, ToolHandler handler) {
        if (sealed != null) {
            throw new IllegalStateException("Tool registry is sealed; cannot register " + spec.name());
        }
        if (building.containsKey(spec.name())) {
            throw new DuplicateToolNameException(spec.name());
        }
        building.put(spec.name(), new RegisteredTool(spec, handler));
    }

    /** Freezes the registry. Idempotent. */
    public synchronized ToolRegistry seal() {
        if (sealed == null) {
            sealed = Collections.unmodifiableMap(new LinkedHashMap<>(building));
        }
        return this;
    }

    // ── Lookup ───────────────────────────────────────────────────────────────

    /** Registered specs in registration order. */
    public List<ToolSpec> describeAll() {
        return tools().values().stream().map(RegisteredTool::spec).toList();
    }

    public List<Tool> toTools() {
        return describeAll().stream().map(ToolSpec::toTool).toList();
    }

    public ToolHandler lookup(String name) {
        RegisteredTool tool = name == null ? null : tools().get(name);
        if (tool == null) {
            throw new UnknownToolException(name);
        }
        return tool.handler();
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    public ToolResult dispatch(ToolCall call) {
        long   start = System.nanoTime();
        String name  = call.name();

        ToolHandler handler;
        try {
            handler = lookup(name);
        } catch (UnknownToolException e) {
            log.warn("[ToolRegistry] {}", e.getMessage());
            return ToolResult.failure(call.id(), name, null, e.getMessage(), elapsedMs(start));
        }

        ObjectNode arguments;
        try {
            arguments = parseArguments(call.arguments());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[ToolRegistry] Bad arguments for '{}': {}", name, call.arguments());
            return ToolResult.failure(call.id(), name, null,
                    "invalid arguments: " + e.getMessage(), elapsedMs(start));
        }

        try {
            JsonNode output = invoke(handler, arguments);
            long durationMs = elapsedMs(start);
            log.info("[ToolRegistry] '{}' completed in {}ms", name, durationMs);
            return ToolResult.success(call.id(), name, arguments,
                    output == null ? NullNode.getInstance() : output, durationMs);
        } catch (TimeoutException e) {
            log.warn("[ToolRegistry] '{}' timed out after {}ms", name, timeout.toMillis());
            return ToolResult.failure(call.id(), name, arguments,
                    "timed out after %dms".formatted(timeout.toMillis()), elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(call.id(), name, arguments, "interrupted", elapsedMs(start));
        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("[ToolRegistry] '{}' failed: {}", name, reason);
            return ToolResult.failure(call.id(), name, arguments, reason, elapsedMs(start));
        }
    }

    /**
     * Dispatches the calls of one model response concurrently on the tool
     * executor. Results come back in call order, whatever order the handlers
     * finish in.
     */
    public List<ToolResult> dispatchAll(List<ToolCall> calls) {
        if (calls.size() <= 1) {
            return calls.stream().map(this::dispatch).toList();
        }
        List<Future<ToolResult>> pending = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            pending.add(toolExecutor.submit(() -> dispatch(call)));
        }
        List<ToolResult> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            results.add(await(calls.get(i), pending.get(i)));
        }
        return results;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Map<String, RegisteredTool> tools() {
        Map<String, RegisteredTool> snapshot = sealed;
        if (snapshot != null) return snapshot;
        synchronized (this) {
            return new LinkedHashMap<>(building);
        }
    }

    private ObjectNode parseArguments(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode node = objectMapper.readTree(raw);
        if (!(node instanceof ObjectNode objectNode)) {
            throw new IllegalArgumentException("expected a JSON object but got " + node.getNodeType());
        }
        return objectNode;
    }

    private JsonNode invoke(ToolHandler handler, ObjectNode arguments) throws Exception {
        Callable<JsonNode> attempt = () -> runWithTimeout(handler, arguments);
        if (retry != null) {
            attempt = Retry.decorateCallable(retry, attempt);
        }
        return attempt.call();
    }

    private JsonNode runWithTimeout(ToolHandler handler, ObjectNode arguments) throws Exception {
        Future<JsonNode> future = toolExecutor.submit(() -> handler.handle(arguments.deepCopy()));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) throw exception;
            if (cause instanceof Error error) throw error;
            throw e;
        }
    }

    private ToolResult await(ToolCall call, Future<ToolResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure(call.id(), call.name(), null, "interrupted", 0);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            String reason = cause != null && cause.getMessage() != null
                    ? cause.getMessage()
                    : "dispatch failed";
            log.error("[ToolRegistry] '{}' dispatch crashed", call.name(), cause);
            return ToolResult.failure(call.id(), call.name(), null, reason, 0);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record RegisteredTool(ToolSpec spec, ToolHandler handler) {}
}
