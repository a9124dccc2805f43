package com.openforge.agentcore.repository;

import com.openforge.agentcore.domain.ConversationMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    /** Full log in append order; the identity id is monotonic per insert. */
    List<ConversationMessage> findByConversationIdOrderByIdAsc(String conversationId);

    long countByConversationId(String conversationId);
}
