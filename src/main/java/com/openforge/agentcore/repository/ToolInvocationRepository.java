package com.openforge.agentcore.repository;

import com.openforge.agentcore.domain.ToolInvocation;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ToolInvocationRepository extends JpaRepository<ToolInvocation, Long> {

    /** Newest first; callers reverse for chronological order. */
    List<ToolInvocation> findByConversationIdOrderByIdDesc(String conversationId, Pageable pageable);

    long countByConversationId(String conversationId);
}
