package com.securefile.core.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessRunnerTest {

    @TempDir
    Path tempDir;

    private final ProcessRunner runner = new ProcessRunner();

    @Test
    void missingExecutableYieldsOneDiagnosticAndExitCode127() {
        Command command = Command.of(tempDir.resolve("no_such_script.sh").toString(), "a", "b");
        RunHandle handle = new RunHandle(command);

        int exitCode = assertDoesNotThrow(() -> runner.run(command, handle.queue(), handle));

        List<RelayItem> items = drain(handle.queue());
        assertEquals(ProcessRunner.EXIT_NOT_FOUND, exitCode);
        assertEquals(2, items.size());
        OutputChunk diagnostic = assertInstanceOf(OutputChunk.class, items.get(0));
        assertTrue(diagnostic.text().startsWith("[ERROR] Script not found: " + command.executable()));
        assertEquals(new CompletionSignal(127), items.get(1));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void relaysEveryLineInOrderFollowedByExitCode() {
        Command command = Command.of("sh", "-c", "for i in 1 2 3 4 5; do echo line$i; done; exit 3");
        RunHandle handle = new RunHandle(command);

        int exitCode = runner.run(command, handle.queue(), handle);

        assertEquals(3, exitCode);
        assertEquals(List.of(
            new OutputChunk("line1\n"),
            new OutputChunk("line2\n"),
            new OutputChunk("line3\n"),
            new OutputChunk("line4\n"),
            new OutputChunk("line5\n"),
            new CompletionSignal(3)
        ), drain(handle.queue()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void standardErrorIsMergedIntoTheSameStream() {
        Command command = Command.of("sh", "-c", "echo to-out; echo to-err 1>&2; exit 0");
        RunHandle handle = new RunHandle(command);

        runner.run(command, handle.queue(), handle);

        assertEquals(List.of(
            new OutputChunk("to-out\n"),
            new OutputChunk("to-err\n"),
            new CompletionSignal(0)
        ), drain(handle.queue()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cancelledRunStillEndsWithSingleCompletion() {
        Command command = Command.of("sleep", "30");
        RunHandle handle = new RunHandle(command);
        assertTrue(handle.cancel());

        int exitCode = assertTimeoutPreemptively(Duration.ofSeconds(10),
            () -> runner.run(command, handle.queue(), handle));

        List<RelayItem> items = drain(handle.queue());
        assertNotEquals(0, exitCode);
        assertEquals(new OutputChunk("[INFO] Run cancelled\n"), items.get(items.size() - 2));
        assertEquals(new CompletionSignal(exitCode), items.get(items.size() - 1));
        assertTrue(handle.wasCancelled());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cancelAfterTheExitCodeIsQueuedHasNoEffect() {
        Command command = Command.of("sh", "-c", "echo done; exit 0");
        RunHandle handle = new RunHandle(command);

        int exitCode = runner.run(command, handle.queue(), handle);

        assertEquals(0, exitCode);
        assertTrue(handle.queue().isCompleted());
        assertFalse(handle.cancel());
        assertFalse(handle.wasCancelled());
        assertEquals(List.of(new OutputChunk("done\n"), new CompletionSignal(0)), drain(handle.queue()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void readFailureYieldsOneDiagnosticAndExitCode1() {
        ProcessRunner failingReader = new ProcessRunner() {
            @Override
            InputStream output(Process process) {
                return new BrokenAfter("first\n", "stream closed unexpectedly");
            }
        };
        Command command = Command.of("sh", "-c", "exit 0");
        RunHandle handle = new RunHandle(command);

        int exitCode = failingReader.run(command, handle.queue(), handle);

        assertEquals(ProcessRunner.EXIT_FAILED, exitCode);
        assertEquals(List.of(
            new OutputChunk("first\n"),
            new OutputChunk("[ERROR] Running command failed: stream closed unexpectedly\n"),
            new CompletionSignal(1)
        ), drain(handle.queue()));
    }

    /** Serves the given text, then fails every further read. */
    private static final class BrokenAfter extends InputStream {
        private final InputStream data;
        private final String failure;

        BrokenAfter(String text, String failure) {
            this.data = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
            this.failure = failure;
        }

        @Override
        public int read() throws IOException {
            int b = data.read();
            if (b < 0) {
                throw new IOException(failure);
            }
            return b;
        }
    }

    private static List<RelayItem> drain(RelayQueue queue) {
        List<RelayItem> items = new ArrayList<>();
        RelayItem item;
        while ((item = queue.poll()) != null) {
            items.add(item);
        }
        return items;
    }
}
