package com.openforge.agentcore.agent;

import com.openforge.agentcore.agent.event.EventType;
import com.openforge.agentcore.agent.event.OutputEvent;
import com.openforge.agentcore.history.InMemoryHistoryStore;
import com.openforge.agentcore.llm.CompletionClient;
import com.openforge.agentcore.llm.CompletionEvent;
import com.openforge.agentcore.llm.CompletionStream;
import com.openforge.agentcore.llm.model.Message;
import com.openforge.agentcore.tool.ToolSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DefaultAgentTest {

    private ExecutorService      executor;
    private InMemoryHistoryStore history;
    private CountDownLatch       gate;
    private List<List<Message>>  prompts;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        history  = new InMemoryHistoryStore(Duration.ofHours(1), 500, 100);
        gate     = new CountDownLatch(0);
        prompts  = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldStreamReplyAndEndWithDone() throws Exception {
        Agent agent = agent("Be brief.");

        List<OutputEvent> events = collect(agent.processMessage("Hi", "c1"));

        assertEquals(List.of(EventType.CONTENT, EventType.DONE), events.stream().map(OutputEvent::type).toList());
        assertEquals("Be brief.", prompts.get(0).get(0).content());
    }

    @Test
    void shouldRejectSecondTurnWhileFirstIsRunning() throws Exception {
        gate = new CountDownLatch(1);
        Agent agent = agent("Be brief.");

        OutputChannel first = agent.processMessage("Hi", "c1");
        assertThrows(ConversationBusyException.class, () -> agent.processMessage("Again", "c1"));
        OutputChannel other = agent.processMessage("Other chat", "c2");
        gate.countDown();

        assertEquals(EventType.DONE, collect(other).get(1).type());

        collect(first);
        assertEquals(EventType.DONE, collect(whenIdle(agent, "Again", null)).get(1).type());
    }

    @Test
    void shouldUsePersonaOverrideForOneTurn() throws Exception {
        Agent agent = agent("Default persona.");

        collect(agent.processMessage("Hi", "c1", "Speak like a pirate.", true));
        collect(whenIdle(agent, "Hi again", null));

        assertEquals("Speak like a pirate.", prompts.get(0).get(0).content());
        assertEquals("Default persona.", prompts.get(1).get(0).content());
    }

    @Test
    void shouldExposeRegisteredTools() {
        Agent agent = AgentTestSupport.factory(client(), history, executor)
                .create(AgentTestSupport.kind("p", "search_faq", "create_ticket"), "u1_c1");

        assertEquals(List.of("search_faq", "create_ticket"), agent.tools().stream().map(ToolSpec::name).toList());
        assertEquals("u1_c1", agent.agentId());
        assertEquals(AgentType.CUSTOMER_SERVICE, agent.type());
    }

    private Agent agent(String persona) {
        return AgentTestSupport.factory(client(), history, executor)
                .create(AgentTestSupport.kind(persona), "u1_c1");
    }

    private CompletionClient client() {
        return (messages, tools, stream) -> {
            prompts.add(List.copyOf(messages));
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CompletionStream.failed("interrupted");
            }
            return CompletionStream.of(List.of(new CompletionEvent.ContentDelta("Hello"), new CompletionEvent.Completed()));
        };
    }

    /** The permit is released just after the terminal event, so the next turn may briefly see it held. */
    private static OutputChannel whenIdle(Agent agent, String text, String persona) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (true) {
            try {
                return agent.processMessage(text, "c1", persona, true);
            } catch (ConversationBusyException e) {
                if (System.nanoTime() > deadline) throw e;
                Thread.sleep(10);
            }
        }
    }

    private static List<OutputEvent> collect(OutputChannel channel) throws InterruptedException {
        List<OutputEvent> events = new CopyOnWriteArrayList<>();
        while (true) {
            OutputEvent event = channel.next(Duration.ofSeconds(5));
            assertNotNull(event, "turn produced no terminal event");
            events.add(event);
            if (event.isTerminal()) return events;
        }
    }
}
