package com.securefile.core.tail;

import com.securefile.core.loop.OutputSink;
import com.securefile.core.loop.TickScheduler;
import com.securefile.logging.AppLogger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * Follows growing log files. Every tick reads each file from the offset where the previous
 * read stopped and appends the new text under a {@code --- name ---} header.
 * <p>
 * Not thread-safe: start, stop and ticks all run on the scheduler's thread.
 */
public final class LogTailer {

    /** Upper bound for one file in one tick; the rest is picked up on the next tick. */
    static final int MAX_READ_BYTES = 16 * 1024 * 1024;

    private static final Logger LOGGER = AppLogger.get();

    private final OutputSink sink;
    private final TickScheduler scheduler;
    private final int intervalMs;
    private final Map<Path, Long> offsets = new LinkedHashMap<>();
    private boolean running;
    private int generation;

    public LogTailer(OutputSink sink, TickScheduler scheduler, int intervalMs) {
        this.sink = sink;
        this.scheduler = scheduler;
        this.intervalMs = intervalMs;
    }

    /**
     * Forgets previous offsets, reads every file from the beginning right away and keeps
     * polling until {@link #stop()}.
     */
    public void start(List<Path> files) {
        offsets.clear();
        for (Path file : files) {
            offsets.put(file, 0L);
        }
        running = true;
        int current = ++generation;
        LOGGER.info(() -> "Tailing " + offsets.keySet());
        tick(current);
    }

    /** Takes effect at the next tick; a read in progress completes. */
    public void stop() {
        if (running) {
            LOGGER.info("Stopped tailing logs");
        }
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public OptionalLong offsetOf(Path file) {
        Long offset = offsets.get(file);
        return offset == null ? OptionalLong.empty() : OptionalLong.of(offset);
    }

    private void tick(int expectedGeneration) {
        if (!running || expectedGeneration != generation) {
            return;
        }
        List<String> parts = new ArrayList<>();
        for (Path file : offsets.keySet()) {
            String fresh = readNewContent(file);
            if (fresh != null && !fresh.isEmpty()) {
                parts.add("--- " + file.getFileName() + " ---\n" + fresh + "\n");
            }
        }
        if (!parts.isEmpty()) {
            sink.append(String.join("\n", parts));
        }
        scheduler.schedule(intervalMs, () -> tick(expectedGeneration));
    }

    /**
     * @return text appended since the last read, or {@code null} when the file could not be read
     */
    private String readNewContent(Path file) {
        long recorded = offsets.get(file);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            long offset = recorded;
            if (size < recorded) {
                LOGGER.info(() -> file.getFileName() + " shrank below offset " + recorded + ", reading from start");
                offset = 0L;
            }
            int length = (int) Math.min(size - offset, MAX_READ_BYTES);
            if (length == 0) {
                offsets.put(file, offset);
                return "";
            }
            ByteBuffer bytes = ByteBuffer.allocate(length);
            channel.position(offset);
            while (bytes.hasRemaining() && channel.read(bytes) >= 0) {
                // keep reading until the snapshot length is filled or EOF
            }
            bytes.flip();
            String text = decodeComplete(bytes);
            offsets.put(file, offset + bytes.position());
            return text;
        } catch (IOException ex) {
            LOGGER.fine(() -> "Skipping " + file + " this tick: " + ex.getMessage());
            return null;
        }
    }

    // a multi-byte character cut at the end stays in the file for the next tick
    private static String decodeComplete(ByteBuffer bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        CharBuffer chars = CharBuffer.allocate(bytes.remaining());
        decoder.decode(bytes, chars, false);
        chars.flip();
        return chars.toString();
    }
}
