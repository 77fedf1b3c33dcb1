package com.securefile.core.process;

import com.securefile.logging.AppLogger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one external command with stderr merged into stdout and relays every line.
 * <p>
 * {@link #run} never throws: a command that cannot be started yields a diagnostic chunk and
 * {@link #EXIT_NOT_FOUND}; a failure while reading yields a diagnostic chunk and
 * {@link #EXIT_FAILED}. Either way the queue receives exactly one completion signal.
 */
public class ProcessRunner {

    public static final int EXIT_NOT_FOUND = 127;
    public static final int EXIT_FAILED = 1;

    private static final Logger LOGGER = AppLogger.get();

    private final File workingDirectory;

    public ProcessRunner() {
        this(null);
    }

    /**
     * @param workingDirectory directory the command starts in, or {@code null} for the current one
     */
    public ProcessRunner(File workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public int run(Command command, RelayQueue queue, RunHandle handle) {
        int exitCode = execute(command, queue, handle);
        queue.complete(exitCode);
        return exitCode;
    }

    /**
     * The merged stdout/stderr stream of a started process.
     */
    InputStream output(Process process) {
        return process.getInputStream();
    }

    private int execute(Command command, RelayQueue queue, RunHandle handle) {
        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command.arguments());
            builder.redirectErrorStream(true);
            if (workingDirectory != null) {
                builder.directory(workingDirectory);
            }
            process = builder.start();
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Could not launch " + command.executable(), ex);
            queue.publish("[ERROR] Script not found: " + command.executable() + "\n" + ex.getMessage() + "\n");
            return EXIT_NOT_FOUND;
        }
        handle.attach(process);
        LOGGER.fine(() -> "Started pid " + process.pid() + ": " + command);

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(output(process), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                queue.publish(line + "\n");
            }
        } catch (IOException ex) {
            if (!handle.isCancelRequested()) {
                LOGGER.log(Level.WARNING, "Reading output of " + command.executable() + " failed", ex);
                queue.publish("[ERROR] Running command failed: " + ex.getMessage() + "\n");
                return EXIT_FAILED;
            }
        }

        try {
            int exitCode = process.waitFor();
            if (handle.isCancelRequested()) {
                handle.markCancelled();
                queue.publish("[INFO] Run cancelled\n");
            }
            return exitCode;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            queue.publish("[ERROR] Running command failed: interrupted while waiting for exit\n");
            return EXIT_FAILED;
        }
    }
}
