package com.openforge.agentcore.agent;

import com.openforge.agentcore.history.HistoryStore;
import com.openforge.agentcore.llm.CompletionClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AgentCacheTest {

    private ExecutorService executor;
    private AgentCache      cache;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        AgentFactory factory = AgentTestSupport.factory(mock(CompletionClient.class), mock(HistoryStore.class), executor);
        AgentRegistry registry = new AgentRegistry(List.of(AgentTestSupport.kind("persona", "search_faq")), factory);
        cache = new AgentCache(registry, factory, AgentTestSupport.properties());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReuseAgentForSameId() {
        Agent first = cache.getOrCreate(AgentType.CUSTOMER_SERVICE, "u1_c1");
        Agent again = cache.getOrCreate(AgentType.CUSTOMER_SERVICE, "u1_c1");
        Agent other = cache.getOrCreate(AgentType.CUSTOMER_SERVICE, "u2_c1");

        assertSame(first, again);
        assertNotSame(first, other);
        assertEquals(2, cache.size());
        assertTrue(cache.keys().contains("customer_service:u1_c1"));
    }

    @Test
    void shouldRebuildAfterEviction() {
        Agent first = cache.getOrCreate(AgentType.CUSTOMER_SERVICE, "u1_c1");

        assertTrue(cache.evict(AgentType.CUSTOMER_SERVICE, "u1_c1"));
        assertFalse(cache.evict(AgentType.CUSTOMER_SERVICE, "u1_c1"));
        assertNotSame(first, cache.getOrCreate(AgentType.CUSTOMER_SERVICE, "u1_c1"));
    }

    @Test
    void shouldBoundNumberOfLiveAgents() {
        for (int i = 0; i < 50; i++) {
            cache.getOrCreate(AgentType.CUSTOMER_SERVICE, "u" + i);
        }

        assertTrue(cache.size() <= 10);
    }
}
