package com.openforge.agentcore.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.agentcore.domain.ConversationMessage;
import com.openforge.agentcore.domain.ConversationState;
import com.openforge.agentcore.domain.ToolInvocation;
import com.openforge.agentcore.llm.model.Message;
import com.openforge.agentcore.llm.model.ToolCall;
import com.openforge.agentcore.repository.ConversationMessageRepository;
import com.openforge.agentcore.repository.ConversationStateRepository;
import com.openforge.agentcore.repository.ToolInvocationRepository;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational history through Spring Data JPA. Rows are only ever inserted;
 * the identity id gives append order within a conversation.
 */
@Slf4j
public class JpaHistoryStore implements HistoryStore {

    private static final TypeReference<List<ToolCall>> TOOL_CALL_LIST_TYPE =
            new TypeReference<>() {};

    private final ConversationMessageRepository messageRepository;
    private final ToolInvocationRepository      toolInvocationRepository;
    private final ConversationStateRepository   stateRepository;
    private final ObjectMapper                  objectMapper;

    public JpaHistoryStore(ConversationMessageRepository messageRepository,
                           ToolInvocationRepository toolInvocationRepository,
                           ConversationStateRepository stateRepository,
                           ObjectMapper objectMapper) {
        this.messageRepository        = messageRepository;
        this.toolInvocationRepository = toolInvocationRepository;
        this.stateRepository          = stateRepository;
        this.objectMapper             = objectMapper;
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    @Override
    public void appendMessage(String conversationId, Message message) {
        ConversationMessage row = ConversationMessage.builder()
                .conversationId(conversationId)
                .role(message.role())
                .content(message.content())
                .toolCalls(message.toolCalls() == null ? null : toJson(message.toolCalls()))
                .toolCallId(message.toolCallId())
                .build();
        execute(conversationId, () -> messageRepository.save(row));
    }

    @Override
    public void appendToolResult(String conversationId, ToolResult toolResult) {
        ToolInvocation row = ToolInvocation.builder()
                .conversationId(conversationId)
                .toolCallId(toolResult.toolCallId())
                .toolName(toolResult.toolName())
                .arguments(toolResult.arguments() == null ? null : toolResult.arguments().toString())
                .output(toolResult.output() == null ? null : toolResult.output().toString())
                .errorMessage(toolResult.error())
                .durationMs(toolResult.durationMs())
                .invokedAt(toolResult.timestamp())
                .build();
        execute(conversationId, () -> toolInvocationRepository.save(row));
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    @Override
    public List<Message> getContext(String conversationId, int maxTurns) {
        List<ConversationMessage> rows = execute(conversationId,
                () -> messageRepository.findByConversationIdOrderByIdAsc(conversationId));
        List<Message> messages = new ArrayList<>(rows.size());
        for (ConversationMessage row : rows) {
            try {
                messages.add(toMessage(row));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[HistoryStore:jpa] Skipping unreadable message row {} of {}: {}",
                        row.getId(), conversationId, e.getMessage());
            }
        }
        return ContextWindows.lastTurns(messages, maxTurns);
    }

    @Override
    public List<ToolResult> getToolResults(String conversationId, int limit) {
        Pageable page = limit > 0 ? PageRequest.of(0, limit) : Pageable.unpaged();
        List<ToolInvocation> rows = execute(conversationId,
                () -> toolInvocationRepository.findByConversationIdOrderByIdDesc(conversationId, page));
        List<ToolResult> results = new ArrayList<>(rows.size());
        for (ToolInvocation row : rows) {
            results.add(toToolResult(row));
        }
        Collections.reverse(results);
        return results;
    }

    @Override
    public ConversationStats stats(String conversationId) {
        long messages    = execute(conversationId, () -> messageRepository.countByConversationId(conversationId));
        long toolResults = execute(conversationId, () -> toolInvocationRepository.countByConversationId(conversationId));
        return new ConversationStats(conversationId, messages, toolResults);
    }

    // ── State ────────────────────────────────────────────────────────────────

    @Override
    public ObjectNode getState(String conversationId) {
        Optional<ConversationState> row = execute(conversationId,
                () -> stateRepository.findByConversationId(conversationId));
        ObjectNode state = row.map(this::readState).orElse(null);
        if (state == null) {
            state = ChatStates.initial(conversationId, Instant.now());
            saveState(conversationId, row.orElse(null), state);
        }
        return state;
    }

    @Override
    public ObjectNode mergeState(String conversationId, ObjectNode update) {
        Optional<ConversationState> row = execute(conversationId,
                () -> stateRepository.findByConversationId(conversationId));
        ObjectNode current = row.map(this::readState)
                .orElseGet(() -> ChatStates.initial(conversationId, Instant.now()));
        ObjectNode merged = ChatStates.merge(current, update, Instant.now());
        saveState(conversationId, row.orElse(null), merged);
        return merged;
    }

    private void saveState(String conversationId, ConversationState existing, ObjectNode state) {
        ConversationState row = existing != null
                ? existing
                : ConversationState.builder().conversationId(conversationId).build();
        row.setStateJson(toJson(state));
        execute(conversationId, () -> stateRepository.save(row));
    }

    /** Null when the stored document is not a readable JSON object. */
    private ObjectNode readState(ConversationState row) {
        try {
            JsonNode node = objectMapper.readTree(row.getStateJson());
            if (node instanceof ObjectNode state) return state;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[HistoryStore:jpa] Unreadable state for {}: {}", row.getConversationId(), e.getMessage());
        }
        return null;
    }

    // ── Backend ──────────────────────────────────────────────────────────────

    @Override
    public void ping() {
        execute("ping", messageRepository::count);
    }

    @Override
    public String backendName() {
        return "jpa";
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private Message toMessage(ConversationMessage row) throws JsonProcessingException {
        List<ToolCall> toolCalls = row.getToolCalls() == null
                ? null
                : objectMapper.readValue(row.getToolCalls(), TOOL_CALL_LIST_TYPE);
        return new Message(row.getRole(), row.getContent(), toolCalls, row.getToolCallId());
    }

    private ToolResult toToolResult(ToolInvocation row) {
        return new ToolResult(row.getToolCallId(), row.getToolName(),
                readTreeOrNull(row.getArguments()), readTreeOrNull(row.getOutput()),
                row.getErrorMessage(), row.getDurationMs(), row.getInvokedAt());
    }

    private JsonNode readTreeOrNull(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return objectMapper.getNodeFactory().textNode(json);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * An unreachable database usually fails while the repository opens its
     * transaction (CannotCreateTransactionException), before any data access.
     */
    private <T> T execute(String conversationId, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new StorageUnavailableException(
                    "Database unavailable for conversation " + conversationId, e);
        }
    }
}
