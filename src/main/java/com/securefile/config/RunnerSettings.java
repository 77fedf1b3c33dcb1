package com.securefile.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable settings handed to the script pipelines and the log tailer when they are built.
 *
 * @param organizeScript  executable invoked as {@code organize <source> <output>}
 * @param verifyScript    executable invoked as {@code verify <organized>}
 * @param drainIntervalMs delay between two drains of a run's output queue
 * @param tailIntervalMs  delay between two reads of the tailed log files
 */
public record RunnerSettings(Path organizeScript, Path verifyScript, int drainIntervalMs, int tailIntervalMs) {

    public static final int DEFAULT_DRAIN_INTERVAL_MS = 100;
    public static final int DEFAULT_TAIL_INTERVAL_MS = 2000;
    public static final String DEFAULT_ORGANIZE_SCRIPT = "organize_files.sh";
    public static final String DEFAULT_VERIFY_SCRIPT = "verify_integrity.sh";

    public RunnerSettings {
        Objects.requireNonNull(organizeScript, "organizeScript");
        Objects.requireNonNull(verifyScript, "verifyScript");
        if (drainIntervalMs <= 0 || tailIntervalMs <= 0) {
            throw new IllegalArgumentException("poll intervals must be positive");
        }
    }

    /** Scripts inside {@code baseDir}, 100 ms drain, 2 s tail. */
    public static RunnerSettings defaultsIn(Path baseDir) {
        return new RunnerSettings(
            baseDir.resolve(DEFAULT_ORGANIZE_SCRIPT),
            baseDir.resolve(DEFAULT_VERIFY_SCRIPT),
            DEFAULT_DRAIN_INTERVAL_MS,
            DEFAULT_TAIL_INTERVAL_MS
        );
    }
}
