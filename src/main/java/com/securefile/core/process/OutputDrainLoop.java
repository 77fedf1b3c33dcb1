package com.securefile.core.process;

import com.securefile.core.loop.OutputSink;
import com.securefile.core.loop.TickScheduler;
import com.securefile.logging.AppLogger;

import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves a run's output from its {@link RelayQueue} into an {@link OutputSink}, one non-blocking
 * pass per tick. The completion signal completes {@code exitCode} after all preceding chunks
 * were appended, and ends the loop.
 */
public final class OutputDrainLoop {

    private static final Logger LOGGER = AppLogger.get();

    private final RelayQueue queue;
    private final OutputSink sink;
    private final TickScheduler scheduler;
    private final int intervalMs;
    private final CompletableFuture<Integer> exitCode;
    private boolean finished;
    // taken from the queue but not yet appended; retried first on the next tick
    private RelayItem pendingItem;

    public OutputDrainLoop(RelayQueue queue,
                           OutputSink sink,
                           TickScheduler scheduler,
                           int intervalMs,
                           CompletableFuture<Integer> exitCode) {
        this.queue = queue;
        this.sink = sink;
        this.scheduler = scheduler;
        this.intervalMs = intervalMs;
        this.exitCode = exitCode;
    }

    public void start() {
        scheduler.schedule(intervalMs, this::tick);
    }

    public boolean isFinished() {
        return finished;
    }

    void tick() {
        if (finished) {
            return;
        }
        try {
            while (pendingItem != null || (pendingItem = queue.poll()) != null) {
                if (pendingItem instanceof CompletionSignal signal) {
                    pendingItem = null;
                    finished = true;
                    exitCode.complete(signal.exitCode());
                    return;
                }
                sink.append(((OutputChunk) pendingItem).text());
                pendingItem = null;
            }
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Output drain failed, retrying on next tick", ex);
        }
        scheduler.schedule(intervalMs, this::tick);
    }
}
