package com.openforge.agentcore.agent;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.agentcore.agent.dto.AgentInfoResponse;
import com.openforge.agentcore.agent.dto.ChatMessageRequest;
import com.openforge.agentcore.agent.dto.ChatReply;
import com.openforge.agentcore.agent.dto.HealthResponse;
import com.openforge.agentcore.agent.event.OutputEvent;
import com.openforge.agentcore.config.AgentProperties;
import com.openforge.agentcore.history.ConversationStats;
import com.openforge.agentcore.history.HistoryStore;
import com.openforge.agentcore.history.StorageUnavailableException;
import com.openforge.agentcore.history.ToolResult;
import com.openforge.agentcore.llm.model.Message;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * HTTP entry point for agent conversations.
 *
 * Endpoints:
 *   POST   /api/agents/chat                               - SSE stream of content / done / error
 *   POST   /api/agents/chat/non-streaming                 - whole reply as JSON
 *   GET    /api/agents/info                               - agent types, backend, cache size
 *   GET    /api/agents/health                             - liveness and agent types
 *   GET    /api/agents/conversations/{chatId}/messages    - stored context
 *   GET    /api/agents/conversations/{chatId}/tool-results - tool audit log
 *   GET    /api/agents/conversations/{chatId}/stats       - stored counts
 *   GET    /api/agents/conversations/{chatId}/state       - state document
 *   DELETE /api/agents/cache/{agentType}/{agentId}        - drop a cached agent
 *
 * The conversation id is the request's chat_id; agents are cached per
 * user_id + chat_id. A second message for a conversation whose turn is still
 * running is rejected with 409. An unreachable history store answers 503.
 */
@Slf4j
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class AgentController {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);

    static final List<String> ENDPOINTS = List.of(
            "POST /api/agents/chat",
            "POST /api/agents/chat/non-streaming",
            "GET /api/agents/info",
            "GET /api/agents/health",
            "GET /api/agents/conversations/{chatId}/messages",
            "GET /api/agents/conversations/{chatId}/tool-results",
            "GET /api/agents/conversations/{chatId}/stats",
            "GET /api/agents/conversations/{chatId}/state",
            "DELETE /api/agents/cache/{agentType}/{agentId}");

    private final AgentCache      agentCache;
    private final AgentRegistry   agentRegistry;
    private final HistoryStore    historyStore;
    private final AgentProperties properties;
    private final ExecutorService streamPumpExecutor;

    // ── Chat ─────────────────────────────────────────────────────────────────

    @PostMapping(value = "/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter chat(@Valid @RequestBody ChatMessageRequest request) {
        OutputChannel channel = startTurn(request, true);

        SseEmitter emitter = new SseEmitter(properties.stream().sseTimeout().toMillis());
        emitter.onCompletion(channel::cancel);
        emitter.onTimeout(channel::cancel);
        emitter.onError(e -> channel.cancel());

        streamPumpExecutor.execute(() -> pump(channel, emitter));
        return emitter;
    }

    /**
     * Runs the turn without streaming and returns the collected reply.
     * An error event maps to 502; no terminal event within the stream
     * timeout maps to 504.
     */
    @PostMapping("/chat/non-streaming")
    public ChatReply chatNonStreaming(@Valid @RequestBody ChatMessageRequest request) {
        OutputChannel channel = startTurn(request, false);
        String response = collect(channel, properties.stream().sseTimeout());
        return new ChatReply(response, request.chatId(), request.userId(),
                request.agentTypeOrDefault(), Instant.now());
    }

    // ── Info ─────────────────────────────────────────────────────────────────

    @GetMapping("/info")
    public AgentInfoResponse info() {
        return new AgentInfoResponse(availableTags(), historyStore.backendName(),
                agentCache.size(), ENDPOINTS);
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", availableTags());
    }

    // ── Conversation history ─────────────────────────────────────────────────

    @GetMapping("/conversations/{chatId}/messages")
    public List<Message> messages(@PathVariable String chatId,
                                  @RequestParam(defaultValue = "0") int turns) {
        return historyStore.getContext(chatId, turns);
    }

    @GetMapping("/conversations/{chatId}/tool-results")
    public List<ToolResult> toolResults(@PathVariable String chatId,
                                        @RequestParam(defaultValue = "20") int limit) {
        return historyStore.getToolResults(chatId, limit);
    }

    @GetMapping("/conversations/{chatId}/stats")
    public ConversationStats stats(@PathVariable String chatId) {
        return historyStore.stats(chatId);
    }

    @GetMapping("/conversations/{chatId}/state")
    public ObjectNode state(@PathVariable String chatId) {
        return historyStore.getState(chatId);
    }

    // ── Cache ────────────────────────────────────────────────────────────────

    @DeleteMapping("/cache/{agentType}/{agentId}")
    public Map<String, Object> evict(@PathVariable String agentType, @PathVariable String agentId) {
        AgentType type = resolveType(agentType);
        boolean evicted = agentCache.evict(type, agentId);
        log.info("[Controller] Evict {}:{} -> {}", type.tag(), agentId, evicted);
        return Map.of("agent_type", type.tag(), "agent_id", agentId, "evicted", evicted);
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> storageUnavailable(StorageUnavailableException e) {
        log.warn("[Controller] History store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "storage_unavailable", "detail", e.getMessage()));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private OutputChannel startTurn(ChatMessageRequest request, boolean stream) {
        AgentType type  = resolveType(request.agentTypeOrDefault());
        Agent     agent = agentCache.getOrCreate(type, request.agentId());
        OutputChannel channel;
        try {
            channel = agent.processMessage(request.message(), request.chatId(), request.persona(), stream);
        } catch (ConversationBusyException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        recordMetadata(request);
        return channel;
    }

    /** Metadata is best effort: a failed write never fails the turn. */
    private void recordMetadata(ChatMessageRequest request) {
        if (!request.hasExtraMetadata()) return;
        ObjectNode update = JsonNodeFactory.instance.objectNode();
        update.put("user_id", request.userId());
        update.set("extra_metadata", request.extraMetadata().deepCopy());
        try {
            historyStore.mergeState(request.chatId(), update);
        } catch (StorageUnavailableException e) {
            log.warn("[Controller] Could not store metadata for conversation {}: {}",
                    request.chatId(), e.getMessage());
        }
    }

    private AgentType resolveType(String tag) {
        return AgentType.fromTag(tag)
                .filter(agentRegistry.availableTypes()::contains)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Unknown agent type '%s'. Available: %s".formatted(tag, availableTags())));
    }

    private List<String> availableTags() {
        return agentRegistry.availableTypes().stream().map(AgentType::tag).toList();
    }

    private void pump(OutputChannel channel, SseEmitter emitter) {
        try {
            while (!channel.isCancelled()) {
                OutputEvent event = channel.next(POLL_INTERVAL);
                if (event == null) continue;
                emitter.send(SseEmitter.event()
                        .name(event.type().wireName())
                        .data(event, MediaType.APPLICATION_JSON));
                if (event.isTerminal()) {
                    emitter.complete();
                    return;
                }
            }
        } catch (IOException e) {
            log.info("[Controller] Client left conversation {}: {}", channel.conversationId(), e.getMessage());
            channel.cancel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.cancel();
            emitter.complete();
        }
    }

    private String collect(OutputChannel channel, Duration timeout) {
        StringBuilder reply    = new StringBuilder();
        long          deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    channel.cancel();
                    throw new ResponseStatusException(HttpStatus.GATEWAY_TIMEOUT,
                            "No reply for conversation " + channel.conversationId() + " within " + timeout);
                }
                OutputEvent event = channel.next(Duration.ofNanos(Math.min(remaining, POLL_INTERVAL.toNanos())));
                if (event == null) continue;
                switch (event.type()) {
                    case CONTENT -> reply.append(event.content());
                    case DONE    -> { return reply.toString(); }
                    case ERROR   -> throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, event.content());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.cancel();
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Interrupted");
        }
    }
}
