package com.securefile.ui.support;

import com.securefile.core.loop.TickScheduler;

import javax.swing.Timer;

/**
 * Schedules one-shot tasks on the event dispatch thread.
 */
public final class SwingTickScheduler implements TickScheduler {

    @Override
    public void schedule(int delayMillis, Runnable task) {
        Timer timer = new Timer(delayMillis, e -> task.run());
        timer.setRepeats(false);
        timer.start();
    }
}
