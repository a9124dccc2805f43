package com.openforge.agentcore.llm;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, finite, non-restartable sequence of {@link CompletionEvent}s for one
 * model call. {@link #hasNext()} may block while the provider is producing
 * output. Closing releases the underlying connection.
 */
public interface CompletionStream extends Iterator<CompletionEvent>, AutoCloseable {

    @Override
    void close();

    /** A stream over already-known events; used for non-streaming replies and failures. */
    static CompletionStream of(List<CompletionEvent> events) {
        Iterator<CompletionEvent> it = List.copyOf(events).iterator();
        return new CompletionStream() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public CompletionEvent next() {
                if (!it.hasNext()) {
                    throw new NoSuchElementException();
                }
                return it.next();
            }

            @Override
            public void close() {
                // nothing to release
            }
        };
    }

    static CompletionStream failed(String reason) {
        return of(List.of(new CompletionEvent.Failed(reason)));
    }
}
