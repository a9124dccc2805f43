package com.openforge.agentcore.agent;

import com.openforge.agentcore.agent.event.OutputEvent;
import com.openforge.agentcore.history.HistoryStore;
import com.openforge.agentcore.history.StorageUnavailableException;
import com.openforge.agentcore.history.ToolResult;
import com.openforge.agentcore.llm.CompletionClient;
import com.openforge.agentcore.llm.CompletionEvent;
import com.openforge.agentcore.llm.CompletionStream;
import com.openforge.agentcore.llm.model.Message;
import com.openforge.agentcore.llm.model.Tool;
import com.openforge.agentcore.llm.model.ToolCall;
import com.openforge.agentcore.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one conversation turn: context → model → (tools → model)* → reply.
 *
 * <pre>
 * 1. append user message
 * 2. BUILD_CONTEXT   persona + last N turns (current one included)
 * 3. AWAIT_MODEL     forward content deltas, collect tool calls
 *      Failed      -> FAILED: one error event, nothing appended
 *      no tools    -> append final reply, EMIT_FINAL
 *      tool calls  -> DISPATCH_TOOLS
 * 4. DISPATCH_TOOLS  append assistant(tool_calls), dispatch all concurrently,
 *                    append tool result + tool message in call order
 *      budget hit  -> append fallback reply, EMIT_FINAL
 *      otherwise   -> back to 2 (re-reads what was just written)
 * 5. EMIT_FINAL      done event
 * </pre>
 *
 * The only blocking wait is for the next completion event. It runs on the
 * completion-reader executor under a per-call deadline so a stalled
 * provider fails the turn instead of hanging it.
 *
 * Not thread-safe per conversation: callers serialize turns of the same
 * conversation (see {@link ConversationLocks}).
 */
@Slf4j
public class TurnEngine {

    static final String BUDGET_FALLBACK =
            "I've reached the maximum number of tool iterations for this request. "
                    + "Please try rephrasing your request.";
    static final String INTERRUPTED_REPLY =
            "This response was interrupted before it could be completed.";

    private static final String MDC_CONVERSATION = "conversationId";

    private final CompletionClient completionClient;
    private final HistoryStore     historyStore;
    private final ToolRegistry     toolRegistry;
    private final TurnSettings     settings;
    private final ExecutorService  completionReader;

    public TurnEngine(CompletionClient completionClient,
                      HistoryStore historyStore,
                      ToolRegistry toolRegistry,
                      TurnSettings settings,
                      ExecutorService completionReader) {
        this.completionClient = completionClient;
        this.historyStore     = historyStore;
        this.toolRegistry     = toolRegistry;
        this.settings         = settings;
        this.completionReader = completionReader;
    }

    // ── Turn ─────────────────────────────────────────────────────────────────

    public TurnOutcome runTurn(String conversationId,
                               String userText,
                               String persona,
                               boolean stream,
                               OutputChannel output) {
        MDC.put(MDC_CONVERSATION, conversationId);
        TurnState state = TurnState.BUILD_CONTEXT;
        int modelCalls = 0;
        int iterations = 0;
        try {
            historyStore.appendMessage(conversationId, Message.user(userText));
            List<Tool> tools = toolRegistry.toTools();
            Set<String> usedCallIds = new HashSet<>();

            while (true) {
                state = TurnState.BUILD_CONTEXT;
                List<Message> prompt = buildPrompt(conversationId, persona);

                state = TurnState.AWAIT_MODEL;
                modelCalls++;
                log.debug("[TurnEngine:{}] Model call {} with {} context messages",
                        conversationId, modelCalls, prompt.size());
                ModelReply reply = awaitModel(conversationId, prompt, tools, stream, output);

                if (reply.failure() != null) {
                    log.warn("[TurnEngine:{}] Model call {} failed: {}",
                            conversationId, modelCalls, reply.failure());
                    return fail(conversationId, output, "Model call failed: " + reply.failure(),
                            modelCalls, iterations);
                }

                if (reply.toolCalls().isEmpty()) {
                    historyStore.appendMessage(conversationId, Message.assistantText(reply.content()));
                    return finish(conversationId, output, reply.content(), modelCalls, iterations, false);
                }

                state = TurnState.DISPATCH_TOOLS;
                resolveTools(conversationId, reply, usedCallIds);
                iterations++;

                if (iterations >= settings.maxToolIterations()) {
                    log.warn("[TurnEngine:{}] Tool iteration limit ({}) reached, replying with fallback",
                            conversationId, settings.maxToolIterations());
                    output.emit(OutputEvent.content(conversationId, BUDGET_FALLBACK));
                    historyStore.appendMessage(conversationId, Message.assistantText(BUDGET_FALLBACK));
                    return finish(conversationId, output, BUDGET_FALLBACK, modelCalls, iterations, true);
                }
                if (output.isCancelled()) {
                    log.info("[TurnEngine:{}] Caller went away after {} tool iteration(s); closing turn",
                            conversationId, iterations);
                    historyStore.appendMessage(conversationId, Message.assistantText(INTERRUPTED_REPLY));
                    return finish(conversationId, output, INTERRUPTED_REPLY, modelCalls, iterations, false);
                }
            }
        } catch (StorageUnavailableException e) {
            log.error("[TurnEngine:{}] History store unavailable in state {}: {}",
                    conversationId, state, e.getMessage(), e);
            return fail(conversationId, output, "Storage unavailable: " + e.getMessage(), modelCalls, iterations);
        } catch (RuntimeException e) {
            log.error("[TurnEngine:{}] Unexpected failure in state {}", conversationId, state, e);
            return fail(conversationId, output, "Turn failed: " + e.getMessage(), modelCalls, iterations);
        } finally {
            MDC.remove(MDC_CONVERSATION);
        }
    }

    // ── Steps ────────────────────────────────────────────────────────────────

    private List<Message> buildPrompt(String conversationId, String persona) {
        List<Message> context = historyStore.getContext(conversationId, settings.contextTurns());
        List<Message> prompt = new ArrayList<>(context.size() + 1);
        if (persona != null && !persona.isBlank()) {
            prompt.add(Message.system(persona));
        }
        prompt.addAll(context);
        return prompt;
    }

    private ModelReply awaitModel(String conversationId,
                                  List<Message> prompt,
                                  List<Tool> tools,
                                  boolean stream,
                                  OutputChannel output) {
        long deadline = System.nanoTime() + settings.completionTimeout().toNanos();
        StringBuilder  content   = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();

        try (CompletionStream completion = openCompletion(prompt, tools, stream, deadline)) {
            while (true) {
                CompletionEvent event;
                try {
                    event = within(deadline, () -> completion.hasNext() ? completion.next() : null);
                } catch (TimeoutException e) {
                    return ModelReply.failed("completion timed out after "
                            + settings.completionTimeout().toSeconds() + "s");
                } catch (ExecutionException e) {
                    return ModelReply.failed(describe(e.getCause()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ModelReply.failed("interrupted");
                }

                if (event == null) {
                    return ModelReply.failed("completion stream ended without a terminal event");
                }
                if (event instanceof CompletionEvent.ContentDelta delta) {
                    content.append(delta.text());
                    if (!output.isCancelled()) {
                        output.emit(OutputEvent.content(conversationId, delta.text()));
                    }
                } else if (event instanceof CompletionEvent.ToolCallRequested requested) {
                    toolCalls.add(requested.toolCall());
                } else if (event instanceof CompletionEvent.Failed failed) {
                    return ModelReply.failed(failed.reason());
                } else if (event instanceof CompletionEvent.Completed) {
                    return new ModelReply(content.toString(), toolCalls, null);
                }
            }
        }
    }

    private CompletionStream openCompletion(List<Message> prompt, List<Tool> tools,
                                            boolean stream, long deadline) {
        try {
            return within(deadline, () -> completionClient.complete(prompt, tools, stream));
        } catch (TimeoutException e) {
            return CompletionStream.failed("completion timed out after "
                    + settings.completionTimeout().toSeconds() + "s");
        } catch (ExecutionException e) {
            return CompletionStream.failed(describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletionStream.failed("interrupted");
        }
    }

    private void resolveTools(String conversationId, ModelReply reply, Set<String> usedCallIds) {
        List<ToolCall> calls = new ArrayList<>(reply.toolCalls().size());
        for (ToolCall call : reply.toolCalls()) {
            String id = call.id();
            if (id == null || id.isBlank() || !usedCallIds.add(id)) {
                id = "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
                usedCallIds.add(id);
                calls.add(call.withId(id));
            } else {
                calls.add(call);
            }
        }

        String text = reply.content().isEmpty() ? null : reply.content();
        historyStore.appendMessage(conversationId, Message.assistantToolCalls(text, calls));

        log.info("[TurnEngine:{}] Dispatching {} tool call(s): {}", conversationId, calls.size(),
                calls.stream().map(ToolCall::name).toList());
        List<ToolResult> results = toolRegistry.dispatchAll(calls);
        for (int i = 0; i < calls.size(); i++) {
            ToolResult result = results.get(i);
            historyStore.appendToolResult(conversationId, result);
            historyStore.appendMessage(conversationId,
                    Message.toolResult(calls.get(i).id(), result.modelContent()));
        }
    }

    private TurnOutcome finish(String conversationId, OutputChannel output, String finalContent,
                               int modelCalls, int iterations, boolean budgetExhausted) {
        output.emit(OutputEvent.done(conversationId));
        log.info("[TurnEngine:{}] Turn done: {} model call(s), {} tool iteration(s)",
                conversationId, modelCalls, iterations);
        return new TurnOutcome(TurnState.DONE, modelCalls, iterations, finalContent, budgetExhausted);
    }

    private TurnOutcome fail(String conversationId, OutputChannel output, String message,
                             int modelCalls, int iterations) {
        output.emit(OutputEvent.error(conversationId, message));
        return new TurnOutcome(TurnState.FAILED, modelCalls, iterations, null, false);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private <T> T within(long deadlineNanos, Callable<T> call)
            throws TimeoutException, ExecutionException, InterruptedException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new TimeoutException();
        }
        Future<T> future = completionReader.submit(call);
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private record ModelReply(String content, List<ToolCall> toolCalls, String failure) {

        static ModelReply failed(String reason) {
            return new ModelReply("", List.of(), reason);
        }
    }
}
