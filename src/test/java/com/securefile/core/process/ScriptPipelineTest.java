package com.securefile.core.process;

import com.securefile.core.loop.ManualTickScheduler;
import com.securefile.core.loop.RecordingSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class ScriptPipelineTest {

    private final ManualTickScheduler scheduler = new ManualTickScheduler();
    private final RecordingSink sink = new RecordingSink();

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void streamsProcessOutputIntoSinkBeforeCompleting() throws Exception {
        ScriptPipeline pipeline = new ScriptPipeline("organizer", new ProcessRunner(), scheduler, 10);
        AtomicInteger completions = new AtomicInteger();
        StringBuilder textAtCompletion = new StringBuilder();

        RunHandle run = pipeline.launch(Command.of("sh", "-c", "printf 'a\\nb\\nc\\n'; exit 7"), sink);
        run.completion().thenAccept(code -> {
            completions.incrementAndGet();
            textAtCompletion.append(sink.text());
        });
        pumpUntilDone(run);

        assertEquals(7, run.completion().get());
        assertEquals("a\nb\nc\n", sink.text());
        assertEquals("a\nb\nc\n", textAtCompletion.toString());
        assertEquals(1, completions.get());
        assertFalse(pipeline.isBusy());
    }

    @Test
    void secondLaunchIsRejectedWhileFirstRunIsActive() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ProcessRunner blocking = new ProcessRunner() {
            @Override
            public int run(Command command, RelayQueue queue, RunHandle handle) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                queue.publish("done\n");
                queue.complete(0);
                return 0;
            }
        };
        ScriptPipeline pipeline = new ScriptPipeline("integrity-check", blocking, scheduler, 10);

        RunHandle first = pipeline.launch(Command.of("verify", "/data"), sink);
        assertTrue(pipeline.isBusy());
        assertThrows(IllegalStateException.class, () -> pipeline.launch(Command.of("verify", "/data"), sink));

        release.countDown();
        pumpUntilDone(first);
        assertFalse(pipeline.isBusy());

        RunHandle second = pipeline.launch(Command.of("verify", "/data"), sink);
        pumpUntilDone(second);
        assertEquals("done\ndone\n", sink.text());
    }

    @Test
    void runnerBugStillProducesCompletion() throws Exception {
        ProcessRunner broken = new ProcessRunner() {
            @Override
            public int run(Command command, RelayQueue queue, RunHandle handle) {
                throw new IllegalArgumentException("boom");
            }
        };
        ScriptPipeline pipeline = new ScriptPipeline("organizer", broken, scheduler, 10);

        RunHandle run = pipeline.launch(Command.of("organize"), sink);
        pumpUntilDone(run);

        assertEquals(ProcessRunner.EXIT_FAILED, run.completion().get());
        assertTrue(sink.text().startsWith("[ERROR] Running command failed:"));
    }

    private void pumpUntilDone(RunHandle run) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!run.isDone()) {
            if (System.nanoTime() > deadline) {
                fail("run did not complete in time");
            }
            scheduler.runPending();
            Thread.sleep(5);
        }
    }
}
