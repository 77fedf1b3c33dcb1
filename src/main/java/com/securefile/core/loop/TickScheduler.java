package com.securefile.core.loop;

/**
 * Runs a task once after a delay on the thread that owns the display surfaces.
 * Polling loops reschedule themselves through this instead of blocking.
 */
@FunctionalInterface
public interface TickScheduler {

    void schedule(int delayMillis, Runnable task);
}
