package com.openforge.agentcore.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.agentcore.llm.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Redis-backed history. Each conversation maps to two lists of JSON
 * documents:
 *
 *   chat_history:{conversationId}  - messages
 *   tool_history:{conversationId}  - tool results
 *
 * plus one string key holding the state document:
 *
 *   chat_state:{conversationId}    - JSON object
 *
 * RPUSH keeps append order; every write refreshes the key TTL and trims the
 * list to its retention limit. Entries that fail to parse on read are logged
 * and skipped.
 */
@Slf4j
public class RedisHistoryStore implements HistoryStore {

    static final String CHAT_HISTORY_PREFIX = "chat_history:";
    static final String TOOL_HISTORY_PREFIX = "tool_history:";
    static final String CHAT_STATE_PREFIX   = "chat_state:";

    private final StringRedisTemplate redis;
    private final ObjectMapper        objectMapper;
    private final Duration            ttl;
    private final int                 maxStoredMessages;
    private final int                 toolHistoryLimit;

    public RedisHistoryStore(StringRedisTemplate redis,
                             ObjectMapper objectMapper,
                             Duration ttl,
                             int maxStoredMessages,
                             int toolHistoryLimit) {
        this.redis             = redis;
        this.objectMapper      = objectMapper;
        this.ttl               = ttl;
        this.maxStoredMessages = maxStoredMessages;
        this.toolHistoryLimit  = toolHistoryLimit;
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    @Override
    public void appendMessage(String conversationId, Message message) {
        push(CHAT_HISTORY_PREFIX + conversationId, toJson(message), maxStoredMessages);
    }

    @Override
    public void appendToolResult(String conversationId, ToolResult toolResult) {
        push(TOOL_HISTORY_PREFIX + conversationId, toJson(toolResult), toolHistoryLimit);
    }

    private void push(String key, String json, int limit) {
        execute(key, () -> {
            redis.opsForList().rightPush(key, json);
            if (limit > 0) {
                redis.opsForList().trim(key, -limit, -1);
            }
            redis.expire(key, ttl);
            return null;
        });
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    @Override
    public List<Message> getContext(String conversationId, int maxTurns) {
        String key = CHAT_HISTORY_PREFIX + conversationId;
        List<String> raw = execute(key, () -> redis.opsForList().range(key, 0, -1));
        return ContextWindows.lastTurns(parseAll(raw, Message.class, key), maxTurns);
    }

    @Override
    public List<ToolResult> getToolResults(String conversationId, int limit) {
        String key = TOOL_HISTORY_PREFIX + conversationId;
        long start = limit > 0 ? -limit : 0;
        List<String> raw = execute(key, () -> redis.opsForList().range(key, start, -1));
        return parseAll(raw, ToolResult.class, key);
    }

    @Override
    public ConversationStats stats(String conversationId) {
        String chatKey = CHAT_HISTORY_PREFIX + conversationId;
        String toolKey = TOOL_HISTORY_PREFIX + conversationId;
        Long messages    = execute(chatKey, () -> redis.opsForList().size(chatKey));
        Long toolResults = execute(toolKey, () -> redis.opsForList().size(toolKey));
        return new ConversationStats(conversationId,
                messages == null ? 0 : messages,
                toolResults == null ? 0 : toolResults);
    }

    // ── State ────────────────────────────────────────────────────────────────

    @Override
    public ObjectNode getState(String conversationId) {
        String key = CHAT_STATE_PREFIX + conversationId;
        ObjectNode state = readState(key);
        if (state == null) {
            state = ChatStates.initial(conversationId, Instant.now());
            writeState(key, state);
        }
        return state;
    }

    /** Read-modify-write; concurrent merges on one conversation are last-writer-wins. */
    @Override
    public ObjectNode mergeState(String conversationId, ObjectNode update) {
        String key = CHAT_STATE_PREFIX + conversationId;
        ObjectNode current = readState(key);
        if (current == null) {
            current = ChatStates.initial(conversationId, Instant.now());
        }
        ObjectNode merged = ChatStates.merge(current, update, Instant.now());
        writeState(key, merged);
        return merged;
    }

    private ObjectNode readState(String key) {
        String json = execute(key, () -> redis.opsForValue().get(key));
        if (json == null) return null;
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node instanceof ObjectNode state) return state;
            log.warn("[HistoryStore:redis] State in {} is not a JSON object; starting over", key);
        } catch (JsonProcessingException e) {
            log.warn("[HistoryStore:redis] Unreadable state in {}; starting over: {}", key, e.getMessage());
        }
        return null;
    }

    private void writeState(String key, ObjectNode state) {
        String json = toJson(state);
        execute(key, () -> {
            redis.opsForValue().set(key, json, ttl);
            return null;
        });
    }

    // ── Backend ──────────────────────────────────────────────────────────────

    @Override
    public void ping() {
        execute("PING", () -> redis.hasKey(CHAT_HISTORY_PREFIX + "__ping__"));
    }

    @Override
    public String backendName() {
        return "redis";
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private <T> T execute(String key, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Redis unavailable for key " + key, e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> List<T> parseAll(List<String> raw, Class<T> type, String key) {
        if (raw == null || raw.isEmpty()) return List.of();
        List<T> parsed = new ArrayList<>(raw.size());
        for (String json : raw) {
            try {
                parsed.add(objectMapper.readValue(json, type));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[HistoryStore:redis] Skipping unreadable entry in {}: {}", key, e.getMessage());
            }
        }
        return parsed;
    }
}
