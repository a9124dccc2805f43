package com.openforge.agentcore.agent;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * One permit per conversation, shared by every agent instance, so two turns
 * of the same conversation never interleave their history writes.
 *
 * Entries are weakly held: a conversation's semaphore lives exactly as long
 * as someone holds it.
 */
@Component
public class ConversationLocks {

    private final LoadingCache<String, Semaphore> permits = Caffeine.newBuilder()
            .weakValues()
            .build(id -> new Semaphore(1));

    /**
     * @return the acquired semaphore, to be released by the caller, or empty
     *         if a turn for this conversation is already running
     */
    public Optional<Semaphore> tryAcquire(String conversationId) {
        Semaphore semaphore = permits.get(conversationId);
        return semaphore.tryAcquire() ? Optional.of(semaphore) : Optional.empty();
    }
}
