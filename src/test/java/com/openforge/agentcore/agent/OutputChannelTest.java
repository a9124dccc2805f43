package com.openforge.agentcore.agent;

import com.openforge.agentcore.agent.event.EventType;
import com.openforge.agentcore.agent.event.OutputEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OutputChannelTest {

    @Test
    void shouldDeliverEventsInOrder() throws Exception {
        OutputChannel channel = new OutputChannel("c1", 4);

        channel.emit(OutputEvent.content("c1", "Hel"));
        channel.emit(OutputEvent.content("c1", "lo"));
        channel.emit(OutputEvent.done("c1"));

        assertEquals("Hel", channel.next(Duration.ZERO).content());
        assertEquals("lo", channel.next(Duration.ZERO).content());
        assertEquals(EventType.DONE, channel.next(Duration.ZERO).type());
        assertNull(channel.next(Duration.ZERO));
    }

    @Test
    void shouldRejectEventsAfterTerminal() {
        OutputChannel channel = new OutputChannel("c1", 4);

        assertTrue(channel.emit(OutputEvent.error("c1", "failed")));
        assertFalse(channel.emit(OutputEvent.done("c1")));
    }

    @Test
    void shouldBlockProducerUntilConsumerReads() throws Exception {
        OutputChannel channel = new OutputChannel("c1", 1);
        channel.emit(OutputEvent.content("c1", "first"));

        CompletableFuture<Boolean> second = CompletableFuture.supplyAsync(
                () -> channel.emit(OutputEvent.content("c1", "second")));
        Thread.sleep(200);
        assertFalse(second.isDone());

        assertEquals("first", channel.next(Duration.ofSeconds(1)).content());
        assertTrue(second.get(2, TimeUnit.SECONDS));
        assertEquals("second", channel.next(Duration.ofSeconds(1)).content());
    }

    @Test
    void shouldReleaseBlockedProducerOnCancel() throws Exception {
        OutputChannel channel = new OutputChannel("c1", 1);
        channel.emit(OutputEvent.content("c1", "first"));

        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(
                () -> channel.emit(OutputEvent.content("c1", "second")));
        Thread.sleep(100);
        channel.cancel();

        assertFalse(blocked.get(2, TimeUnit.SECONDS));
        assertTrue(channel.isCancelled());
        assertNull(channel.next(Duration.ZERO));
        assertFalse(channel.emit(OutputEvent.done("c1")));
    }
}
