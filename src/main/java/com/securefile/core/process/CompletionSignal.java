package com.securefile.core.process;

/**
 * Last item of every run, carrying the exit code of the external process
 * (or {@link ProcessRunner#EXIT_NOT_FOUND} / {@link ProcessRunner#EXIT_FAILED}).
 */
public record CompletionSignal(int exitCode) implements RelayItem {
}
