package com.openforge.agentcore.history;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.openforge.agentcore.llm.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Process-local history. Conversations expire after {@code ttl} without
 * access; each log is capped at its retention limit, oldest entries first.
 */
@Slf4j
public class InMemoryHistoryStore implements HistoryStore {

    private final Cache<String, ConversationLog> conversations;
    private final int maxStoredMessages;
    private final int toolHistoryLimit;

    public InMemoryHistoryStore(Duration ttl, int maxStoredMessages, int toolHistoryLimit) {
        this.conversations = Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .removalListener((String id, ConversationLog conversation, RemovalCause cause) ->
                        log.debug("[HistoryStore:memory] Conversation {} removed ({})", id, cause))
                .build();
        this.maxStoredMessages = maxStoredMessages;
        this.toolHistoryLimit  = toolHistoryLimit;
    }

    @Override
    public void appendMessage(String conversationId, Message message) {
        conversationLog(conversationId).appendMessage(message, maxStoredMessages);
    }

    @Override
    public void appendToolResult(String conversationId, ToolResult toolResult) {
        conversationLog(conversationId).appendToolResult(toolResult, toolHistoryLimit);
    }

    @Override
    public List<Message> getContext(String conversationId, int maxTurns) {
        ConversationLog conversation = conversations.getIfPresent(conversationId);
        if (conversation == null) return List.of();
        return ContextWindows.lastTurns(conversation.messages(), maxTurns);
    }

    @Override
    public List<ToolResult> getToolResults(String conversationId, int limit) {
        ConversationLog conversation = conversations.getIfPresent(conversationId);
        if (conversation == null) return List.of();
        List<ToolResult> results = conversation.toolResults();
        if (limit <= 0 || results.size() <= limit) return results;
        return results.subList(results.size() - limit, results.size());
    }

    @Override
    public ConversationStats stats(String conversationId) {
        ConversationLog conversation = conversations.getIfPresent(conversationId);
        if (conversation == null) return new ConversationStats(conversationId, 0, 0);
        return new ConversationStats(conversationId,
                conversation.messages().size(), conversation.toolResults().size());
    }

    @Override
    public ObjectNode getState(String conversationId) {
        return conversationLog(conversationId).state(conversationId);
    }

    @Override
    public ObjectNode mergeState(String conversationId, ObjectNode update) {
        return conversationLog(conversationId).mergeState(conversationId, update);
    }

    @Override
    public void ping() {
        // always reachable
    }

    @Override
    public String backendName() {
        return "memory";
    }

    private ConversationLog conversationLog(String conversationId) {
        return conversations.get(conversationId, id -> new ConversationLog());
    }

    // ── Per-conversation logs ────────────────────────────────────────────────

    private static final class ConversationLog {
        private final List<Message>    messages    = new ArrayList<>();
        private final List<ToolResult> toolResults = new ArrayList<>();
        private ObjectNode state;

        synchronized void appendMessage(Message message, int limit) {
            messages.add(message);
            trim(messages, limit);
        }

        synchronized void appendToolResult(ToolResult toolResult, int limit) {
            toolResults.add(toolResult);
            trim(toolResults, limit);
        }

        synchronized List<Message> messages() {
            return List.copyOf(messages);
        }

        synchronized List<ToolResult> toolResults() {
            return List.copyOf(toolResults);
        }

        synchronized ObjectNode state(String conversationId) {
            return currentState(conversationId).deepCopy();
        }

        synchronized ObjectNode mergeState(String conversationId, ObjectNode update) {
            state = ChatStates.merge(currentState(conversationId), update, Instant.now());
            return state.deepCopy();
        }

        private ObjectNode currentState(String conversationId) {
            if (state == null) {
                state = ChatStates.initial(conversationId, Instant.now());
            }
            return state;
        }

        private static void trim(List<?> entries, int limit) {
            if (limit > 0 && entries.size() > limit) {
                entries.subList(0, entries.size() - limit).clear();
            }
        }
    }
}
