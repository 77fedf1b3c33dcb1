package com.securefile.core.process;

import com.securefile.core.loop.OutputSink;
import com.securefile.core.loop.TickScheduler;
import com.securefile.logging.AppLogger;

import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Launches runs of one script: a daemon worker thread feeds the relay queue while an
 * {@link OutputDrainLoop} empties it on the scheduler's thread. At most one run is active.
 */
public final class ScriptPipeline {

    private static final Logger LOGGER = AppLogger.get();

    private final String name;
    private final ProcessRunner runner;
    private final TickScheduler scheduler;
    private final int drainIntervalMs;
    private final AtomicReference<RunHandle> active = new AtomicReference<>();

    public ScriptPipeline(String name, ProcessRunner runner, TickScheduler scheduler, int drainIntervalMs) {
        this.name = name;
        this.runner = runner;
        this.scheduler = scheduler;
        this.drainIntervalMs = drainIntervalMs;
    }

    public boolean isBusy() {
        return active.get() != null;
    }

    /**
     * @throws IllegalStateException if a previous run of this pipeline has not completed yet
     */
    public RunHandle launch(Command command, OutputSink sink) {
        RunHandle handle = new RunHandle(command);
        if (!active.compareAndSet(null, handle)) {
            throw new IllegalStateException(name + " is already running");
        }
        handle.exitCodeFuture().whenComplete((code, error) -> {
            active.compareAndSet(handle, null);
            LOGGER.info(() -> name + " finished with exit code " + code);
        });

        LOGGER.info(() -> "Starting " + name + ": " + command);
        new OutputDrainLoop(handle.queue(), sink, scheduler, drainIntervalMs, handle.exitCodeFuture()).start();

        Thread worker = new Thread(() -> runToCompletion(handle), name + "-runner");
        worker.setDaemon(true);
        worker.start();
        return handle;
    }

    private void runToCompletion(RunHandle handle) {
        try {
            runner.run(handle.command(), handle.queue(), handle);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, name + " runner failed unexpectedly", ex);
            if (!handle.queue().isCompleted()) {
                handle.queue().publish("[ERROR] Running command failed: " + ex + "\n");
                handle.queue().complete(ProcessRunner.EXIT_FAILED);
            }
        }
    }
}
