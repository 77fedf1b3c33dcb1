package com.securefile.ui.main;

import com.securefile.config.ConfigService;
import com.securefile.config.RunnerSettings;
import com.securefile.core.loop.TickScheduler;
import com.securefile.core.script.ScriptActions;
import com.securefile.logging.AppLogger;
import com.securefile.ui.support.SwingTickScheduler;

import javax.swing.SwingUtilities;
import java.nio.file.Files;
import java.util.logging.Logger;

/**
 * Entry point: resolves settings, checks the scripts are in place and opens the main window.
 */
public final class MainUIController {
    private static final Logger LOGGER = AppLogger.get();

    private final MainUIView view;

    public MainUIController(ConfigService config) {
        RunnerSettings settings = config.loadRunnerSettings();
        checkScripts(settings);
        TickScheduler scheduler = new SwingTickScheduler();
        this.view = new MainUIView(settings, ScriptActions.create(settings, scheduler), scheduler, config);
    }

    public MainUIView getView() {
        return view;
    }

    static void checkScripts(RunnerSettings settings) {
        if (!Files.exists(settings.organizeScript())) {
            LOGGER.severe("Organize script not found: " + settings.organizeScript());
        }
        if (!Files.exists(settings.verifyScript())) {
            LOGGER.warning("Verify script not found: " + settings.verifyScript() + " (integrity check will not run)");
        }
    }

    public static void main(String[] args) {
        SwingUtilities.invokeLater(() -> new MainUIController(ConfigService.getInstance()).getView().show());
    }
}
