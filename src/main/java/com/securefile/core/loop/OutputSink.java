package com.securefile.core.loop;

/**
 * A text view that output is appended to. Implementations keep the newest text visible.
 * Only called from the thread driving the {@link TickScheduler}.
 */
public interface OutputSink {

    void append(String text);

    void clear();
}
