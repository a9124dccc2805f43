package com.openforge.agentcore.agent;

import com.openforge.agentcore.agent.event.OutputEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between a running turn (producer) and the transport
 * that delivers its events (consumer).
 *
 * A full queue blocks the producer until the consumer catches up or the
 * channel is cancelled. After cancellation every emit is discarded and
 * returns false, which tells the producer nobody is listening any more.
 */
@Slf4j
public class OutputChannel {

    private static final long OFFER_SLICE_MS = 100;

    private final String                     conversationId;
    private final BlockingQueue<OutputEvent> queue;

    private volatile boolean cancelled;
    private volatile boolean terminated;

    public OutputChannel(String conversationId, int capacity) {
        this.conversationId = conversationId;
        this.queue          = new ArrayBlockingQueue<>(capacity);
    }

    // ── Producer side ────────────────────────────────────────────────────────

    /**
     * Blocks while the channel is full.
     *
     * @return true if the event was queued, false if the channel was cancelled
     *         or already carried a terminal event
     */
    public boolean emit(OutputEvent event) {
        if (terminated) {
            log.warn("[OutputChannel:{}] Dropping {} after terminal event", conversationId, event.type());
            return false;
        }
        try {
            while (!cancelled) {
                if (queue.offer(event, OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) {
                    if (event.isTerminal()) terminated = true;
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
        return false;
    }

    // ── Consumer side ────────────────────────────────────────────────────────

    /**
     * Next event, waiting up to {@code timeout}.
     *
     * @return the event, or null if none arrived in time
     */
    public OutputEvent next(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops delivery: pending events are discarded and the producer is
     * released if it is blocked on a full queue.
     */
    public void cancel() {
        if (!cancelled) {
            cancelled = true;
            queue.clear();
            log.debug("[OutputChannel:{}] Cancelled", conversationId);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String conversationId() {
        return conversationId;
    }
}
