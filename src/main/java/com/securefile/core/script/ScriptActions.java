package com.securefile.core.script;

import com.securefile.config.RunnerSettings;
import com.securefile.core.loop.OutputSink;
import com.securefile.core.loop.TickScheduler;
import com.securefile.core.process.Command;
import com.securefile.core.process.ProcessRunner;
import com.securefile.core.process.RunHandle;
import com.securefile.core.process.ScriptPipeline;
import com.securefile.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Validates user-supplied directories and starts the organize and verify scripts.
 * Validation runs synchronously; no process is started when it fails.
 */
public final class ScriptActions {

    private static final Logger LOGGER = AppLogger.get();

    private final RunnerSettings settings;
    private final ScriptPipeline organizer;
    private final ScriptPipeline verifier;

    public ScriptActions(RunnerSettings settings, ScriptPipeline organizer, ScriptPipeline verifier) {
        this.settings = settings;
        this.organizer = organizer;
        this.verifier = verifier;
    }

    public static ScriptActions create(RunnerSettings settings, TickScheduler scheduler) {
        ProcessRunner runner = new ProcessRunner();
        return new ScriptActions(settings,
            new ScriptPipeline("organizer", runner, scheduler, settings.drainIntervalMs()),
            new ScriptPipeline("integrity-check", runner, scheduler, settings.drainIntervalMs()));
    }

    public ScriptPipeline organizer() {
        return organizer;
    }

    public ScriptPipeline verifier() {
        return verifier;
    }

    /**
     * Runs {@code organize <source> <output>}, creating the output directory when missing.
     */
    public RunHandle organize(String source, String output, OutputSink sink) throws ValidationException {
        if (isBlank(source) || isBlank(output)) {
            throw rejected(ValidationException.Reason.MISSING, "Please select both source and output folders.");
        }
        Path sourceDir = existingDirectory(source, "Source folder does not exist: ");
        Path outputDir = toPath(output);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException ex) {
            LOGGER.warning("Could not create output folder " + outputDir + ": " + ex.getMessage());
            throw new ValidationException(ValidationException.Reason.INVALID,
                "Could not create output folder: " + outputDir, ex);
        }
        return organizer.launch(Command.of(settings.organizeScript().toString(),
            sourceDir.toString(), outputDir.toString()), sink);
    }

    /**
     * Runs {@code verify <organized>}.
     */
    public RunHandle verify(String organized, OutputSink sink) throws ValidationException {
        if (isBlank(organized)) {
            throw rejected(ValidationException.Reason.MISSING, "Select organized directory to verify.");
        }
        Path organizedDir = existingDirectory(organized, "Directory does not exist: ");
        return verifier.launch(Command.of(settings.verifyScript().toString(), organizedDir.toString()), sink);
    }

    private static Path existingDirectory(String raw, String messagePrefix) throws ValidationException {
        Path dir = toPath(raw);
        if (!Files.isDirectory(dir)) {
            throw rejected(ValidationException.Reason.INVALID, messagePrefix + raw.strip());
        }
        return dir;
    }

    private static Path toPath(String raw) throws ValidationException {
        try {
            return Path.of(raw.strip());
        } catch (InvalidPathException ex) {
            throw new ValidationException(ValidationException.Reason.INVALID, "Not a valid path: " + raw.strip(), ex);
        }
    }

    private static ValidationException rejected(ValidationException.Reason reason, String message) {
        LOGGER.info(() -> "Rejected run request: " + message);
        return new ValidationException(reason, message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
