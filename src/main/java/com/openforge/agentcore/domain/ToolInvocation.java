package com.openforge.agentcore.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Audit row for one tool dispatch. Exactly one of output / error_message is set.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "tool_invocations",
    indexes = @Index(name = "idx_tool_conversation", columnList = "conversation_id, id")
)
public class ToolInvocation extends BaseEntity {

    @Column(name = "conversation_id", nullable = false, length = 128)
    private String conversationId;

    @Column(name = "tool_call_id", nullable = false, length = 128)
    private String toolCallId;

    @Column(name = "tool_name", nullable = false, length = 128)
    private String toolName;

    /** Parsed arguments as JSON; null when the model sent unparseable arguments. */
    @Column(columnDefinition = "TEXT")
    private String arguments;

    @Column(columnDefinition = "TEXT")
    private String output;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(name = "invoked_at", nullable = false)
    private Instant invokedAt;
}
