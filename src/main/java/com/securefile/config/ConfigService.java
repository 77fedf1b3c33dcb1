package com.securefile.config;

import com.securefile.logging.AppLogger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves {@link RunnerSettings} and remembered directories.
 * <p>
 * Each setting is looked up as a system property first, then in {@code organizer-settings.json}
 * inside the base directory, then falls back to {@link RunnerSettings#defaultsIn(Path)}.
 */
public final class ConfigService {
    public static final String SETTINGS_FILE = "organizer-settings.json";

    static final String KEY_ORGANIZE_SCRIPT = "organizeScript";
    static final String KEY_VERIFY_SCRIPT = "verifyScript";
    static final String KEY_DRAIN_INTERVAL = "drainIntervalMs";
    static final String KEY_TAIL_INTERVAL = "tailIntervalMs";

    private static final Logger LOGGER = AppLogger.get();
    private static final ConfigService INSTANCE =
        new ConfigService(Path.of("").toAbsolutePath(), PreferencesStore.global());

    private final Path baseDir;
    private final PreferencesStore preferences;

    ConfigService(Path baseDir, PreferencesStore preferences) {
        this.baseDir = baseDir;
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public RunnerSettings loadRunnerSettings() {
        RunnerSettings defaults = RunnerSettings.defaultsIn(baseDir);
        JSONObject file = readSettingsFile();
        return new RunnerSettings(
            resolvePath(KEY_ORGANIZE_SCRIPT, file, defaults.organizeScript()),
            resolvePath(KEY_VERIFY_SCRIPT, file, defaults.verifyScript()),
            resolveInterval(KEY_DRAIN_INTERVAL, file, defaults.drainIntervalMs()),
            resolveInterval(KEY_TAIL_INTERVAL, file, defaults.tailIntervalMs())
        );
    }

    public Optional<Path> getLastDirectory(String key) {
        return preferences.getPath(key);
    }

    public void rememberDirectory(String key, Path directory) {
        preferences.putPath(key, directory);
    }

    private Path resolvePath(String key, JSONObject file, Path fallback) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) {
            raw = file.optString(key, null);
        }
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return baseDir.resolve(raw.trim());
    }

    private int resolveInterval(String key, JSONObject file, int fallback) {
        String override = System.getProperty(key);
        if (override != null && !override.isBlank()) {
            try {
                return positiveOr(Integer.parseInt(override.trim()), key, fallback);
            } catch (NumberFormatException ex) {
                LOGGER.warning("Ignoring non-numeric " + key + "=" + override);
                return fallback;
            }
        }
        if (!file.has(key)) {
            return fallback;
        }
        try {
            return positiveOr(file.getInt(key), key, fallback);
        } catch (JSONException ex) {
            LOGGER.warning("Ignoring " + key + " in " + SETTINGS_FILE + ": " + ex.getMessage());
            return fallback;
        }
    }

    private static int positiveOr(int value, String key, int fallback) {
        if (value > 0) {
            return value;
        }
        LOGGER.warning("Ignoring non-positive " + key + "=" + value);
        return fallback;
    }

    private JSONObject readSettingsFile() {
        Path file = baseDir.resolve(SETTINGS_FILE);
        if (!Files.isRegularFile(file)) {
            return new JSONObject();
        }
        try {
            return new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | JSONException ex) {
            LOGGER.warning("Could not read " + file + ": " + ex.getMessage());
            return new JSONObject();
        }
    }
}
