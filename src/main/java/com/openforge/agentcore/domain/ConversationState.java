package com.openforge.agentcore.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The state document of one conversation, stored as a JSON object.
 *
 * Unlike the log tables this row is rewritten on every merge; updated_at
 * lives inside the document.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "conversation_states",
    uniqueConstraints = @UniqueConstraint(name = "uk_state_conversation", columnNames = "conversation_id")
)
public class ConversationState extends BaseEntity {

    @Column(name = "conversation_id", nullable = false, length = 128)
    private String conversationId;

    @Column(name = "state_json", nullable = false, columnDefinition = "TEXT")
    private String stateJson;
}
