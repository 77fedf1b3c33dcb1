package com.securefile.core.process;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Unbounded FIFO between the thread reading a process and the thread displaying its output.
 * One run publishes chunks and then exactly one {@link CompletionSignal}; nothing may follow it.
 */
public final class RelayQueue {

    private final BlockingQueue<RelayItem> items = new LinkedBlockingQueue<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);

    public void publish(String text) {
        if (completed.get()) {
            throw new IllegalStateException("run already completed");
        }
        items.offer(new OutputChunk(text));
    }

    public void complete(int exitCode) {
        if (!completed.compareAndSet(false, true)) {
            throw new IllegalStateException("run already completed");
        }
        items.offer(new CompletionSignal(exitCode));
    }

    public boolean isCompleted() {
        return completed.get();
    }

    /**
     * @return the oldest item, or {@code null} when nothing is queued right now
     */
    public RelayItem poll() {
        return items.poll();
    }

    public int size() {
        return items.size();
    }
}
