package com.openforge.agentcore.history;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.agentcore.llm.model.Message;

import java.util.List;

/**
 * Durable, append-only conversation history.
 *
 * Each conversation owns two logs: the message log replayed to the model and
 * the tool-result audit log. Entries are never reordered or rewritten;
 * retention is the backend's business. Alongside the logs sits one mutable
 * JSON state document (caller metadata, preferences). Every backend gives read-after-write
 * visibility to the caller that wrote.
 *
 * All operations throw {@link StorageUnavailableException} when the backend
 * cannot be reached. Data is never dropped silently.
 */
public interface HistoryStore {

    void appendMessage(String conversationId, Message message);

    void appendToolResult(String conversationId, ToolResult toolResult);

    /**
     * The most recent {@code maxTurns} turns, oldest first. A turn is a user
     * message plus everything up to the next user message. Tool calls are
     * never separated from their results.
     *
     * @param maxTurns turn limit; zero or negative for no limit
     */
    List<Message> getContext(String conversationId, int maxTurns);

    /** The newest {@code limit} tool results, oldest first. */
    List<ToolResult> getToolResults(String conversationId, int limit);

    ConversationStats stats(String conversationId);

    /**
     * The conversation's state document. A default one (chat_id, created_at,
     * updated_at, empty user_preferences and conversation_context) is created
     * and stored on first read. Callers get a copy.
     */
    ObjectNode getState(String conversationId);

    /**
     * Replaces the top-level fields named in {@code update}, restamps
     * updated_at and stores the result.
     *
     * @return the merged state
     */
    ObjectNode mergeState(String conversationId, ObjectNode update);

    /** Round-trips to the backend; used by health checks. */
    void ping();

    /** Short backend name for logs and the info endpoint. */
    String backendName();
}
