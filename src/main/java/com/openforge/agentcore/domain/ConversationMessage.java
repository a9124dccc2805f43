package com.openforge.agentcore.domain;

import com.openforge.agentcore.llm.model.Role;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One row of a conversation's message log.
 *
 * tool_calls holds the assistant's ToolCall list as a JSON array, verbatim.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "conversation_messages",
    indexes = @Index(name = "idx_message_conversation", columnList = "conversation_id, id")
)
public class ConversationMessage extends BaseEntity {

    @Column(name = "conversation_id", nullable = false, length = 128)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(name = "tool_calls", columnDefinition = "TEXT")
    private String toolCalls;

    @Column(name = "tool_call_id", length = 128)
    private String toolCallId;
}
