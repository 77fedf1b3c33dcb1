package com.securefile.core.process;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One launched script run: its relay queue, its result and a way to stop it.
 */
public final class RunHandle {

    private final Command command;
    private final RelayQueue queue = new RelayQueue();
    private final CompletableFuture<Integer> exitCode = new CompletableFuture<>();
    private final AtomicReference<Process> process = new AtomicReference<>();
    private volatile boolean cancelRequested;
    private volatile boolean cancelled;

    public RunHandle(Command command) {
        this.command = command;
    }

    public Command command() {
        return command;
    }

    public RelayQueue queue() {
        return queue;
    }

    /**
     * Completes with the exit code once every chunk of the run has reached the sink.
     * The returned future is a copy; completing it does not affect the run.
     */
    public CompletableFuture<Integer> completion() {
        return exitCode.copy();
    }

    public boolean isDone() {
        return exitCode.isDone();
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * Whether the runner stopped the process because of {@link #cancel()}. A cancel that
     * arrives after the process already exited does not count.
     */
    public boolean wasCancelled() {
        return cancelled;
    }

    /**
     * Asks the external process (and its children) to terminate. The run still ends with a
     * single completion signal.
     *
     * @return {@code false} if the run had already produced its exit code
     */
    public boolean cancel() {
        if (queue.isCompleted()) {
            return false;
        }
        cancelRequested = true;
        Process running = process.get();
        if (running != null) {
            destroy(running);
        }
        return true;
    }

    CompletableFuture<Integer> exitCodeFuture() {
        return exitCode;
    }

    void markCancelled() {
        cancelled = true;
    }

    void attach(Process started) {
        process.set(started);
        if (cancelRequested) {
            destroy(started);
        }
    }

    private static void destroy(Process target) {
        target.descendants().forEach(ProcessHandle::destroy);
        target.destroy();
    }
}
