package com.securefile.core.tail;

import com.securefile.core.loop.ManualTickScheduler;
import com.securefile.core.loop.RecordingSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class LogTailerTest {

    @TempDir
    Path tempDir;

    private final ManualTickScheduler scheduler = new ManualTickScheduler();
    private final RecordingSink sink = new RecordingSink();
    private final LogTailer tailer = new LogTailer(sink, scheduler, 2000);

    @Test
    void contentWrittenBeforeAndAfterStartAppearsOnceEach() throws IOException {
        Path log = tempDir.resolve("organizer.log");
        Files.writeString(log, "X");

        tailer.start(List.of(log));
        Files.writeString(log, "Y", StandardOpenOption.APPEND);
        scheduler.runPending();

        assertEquals("--- organizer.log ---\nX\n--- organizer.log ---\nY\n", sink.text());
        assertEquals(Files.size(log), tailer.offsetOf(log).orElseThrow());
        assertEquals(List.of(2000, 2000), scheduler.delays());
    }

    @Test
    void quietTicksAppendNothing() throws IOException {
        Path log = tempDir.resolve("integrity_check.log");
        Files.writeString(log, "ok\n");

        tailer.start(List.of(log));
        scheduler.runPending();
        scheduler.runPending();

        assertEquals(1, sink.appendCount());
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void filesReadInOneTickAreJoinedWithBlankLine() throws IOException {
        Path organizer = Files.writeString(tempDir.resolve("organizer.log"), "moved a.txt\n");
        Path integrity = Files.writeString(tempDir.resolve("integrity_check.log"), "a.txt: OK\n");

        tailer.start(List.of(organizer, integrity));

        assertEquals("--- organizer.log ---\nmoved a.txt\n\n\n--- integrity_check.log ---\na.txt: OK\n\n",
            sink.text());
    }

    @Test
    void unreadableFileIsSkippedUntilItAppears() throws IOException {
        Path log = tempDir.resolve("organizer.log");

        tailer.start(List.of(log));
        assertEquals("", sink.text());
        assertEquals(0L, tailer.offsetOf(log).orElseThrow());

        Files.writeString(log, "late\n");
        scheduler.runPending();

        assertEquals("--- organizer.log ---\nlate\n\n", sink.text());
        assertEquals(5L, tailer.offsetOf(log).orElseThrow());
    }

    @Test
    void truncatedFileIsReadFromTheBeginning() throws IOException {
        Path log = tempDir.resolve("organizer.log");
        Files.writeString(log, "first run output\n");
        tailer.start(List.of(log));
        sink.clear();

        Files.writeString(log, "new\n");
        scheduler.runPending();

        assertEquals("--- organizer.log ---\nnew\n\n", sink.text());
        assertEquals(4L, tailer.offsetOf(log).orElseThrow());
    }

    @Test
    void multiByteCharacterSplitAcrossWritesIsNotMangled() throws IOException {
        Path log = tempDir.resolve("organizer.log");
        byte[] euro = "€".getBytes(StandardCharsets.UTF_8);
        Files.write(log, new byte[]{'a', euro[0]});

        tailer.start(List.of(log));
        assertEquals(1L, tailer.offsetOf(log).orElseThrow());

        Files.write(log, new byte[]{euro[1], euro[2]}, StandardOpenOption.APPEND);
        scheduler.runPending();

        assertEquals("--- organizer.log ---\na\n--- organizer.log ---\n€\n", sink.text());
    }

    @Test
    void stopEndsPollingAtNextTick() throws IOException {
        Path log = Files.writeString(tempDir.resolve("organizer.log"), "one\n");
        tailer.start(List.of(log));

        tailer.stop();
        Files.writeString(log, "two\n", StandardOpenOption.APPEND);
        scheduler.runPending();

        assertFalse(tailer.isRunning());
        assertEquals(0, scheduler.pendingCount());
        assertEquals("--- organizer.log ---\none\n\n", sink.text());
    }

    @Test
    void restartResetsOffsetsAndKeepsSingleLoop() throws IOException {
        Path log = Files.writeString(tempDir.resolve("organizer.log"), "abc\n");
        tailer.start(List.of(log));
        sink.clear();

        tailer.start(List.of(log));
        assertEquals("--- organizer.log ---\nabc\n\n", sink.text());

        scheduler.runPending();
        assertEquals(1, scheduler.pendingCount());
    }
}
