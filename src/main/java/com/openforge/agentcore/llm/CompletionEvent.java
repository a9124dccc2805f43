package com.openforge.agentcore.llm;

import com.openforge.agentcore.llm.model.ToolCall;

/**
 * Element of a {@link CompletionStream}.
 *
 * A stream yields any number of {@link ContentDelta} and
 * {@link ToolCallRequested} events followed by exactly one terminal event,
 * {@link Completed} or {@link Failed}.
 */
public sealed interface CompletionEvent {

    default boolean isTerminal() {
        return false;
    }

    /** Text fragment; fragments are order-significant. */
    record ContentDelta(String text) implements CompletionEvent {}

    /** Any occurrence makes the whole response a tool branch. */
    record ToolCallRequested(ToolCall toolCall) implements CompletionEvent {}

    record Completed() implements CompletionEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Failed(String reason) implements CompletionEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
