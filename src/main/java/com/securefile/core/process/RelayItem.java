package com.securefile.core.process;

/**
 * Element of a {@link RelayQueue}: either a piece of output or the final exit code.
 */
public interface RelayItem {
}
