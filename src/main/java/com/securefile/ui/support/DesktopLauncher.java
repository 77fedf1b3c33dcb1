package com.securefile.ui.support;

import com.securefile.logging.AppLogger;

import java.awt.Desktop;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Opens a folder or file with the platform's default application.
 */
public final class DesktopLauncher {

    private DesktopLauncher() {
    }

    public static void open(Path target) throws IOException {
        if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.OPEN)) {
            Desktop.getDesktop().open(target.toFile());
            return;
        }
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        String opener = os.contains("win") ? "explorer" : os.contains("mac") ? "open" : "xdg-open";
        AppLogger.get().fine(() -> "Desktop API unavailable, using " + opener);
        new ProcessBuilder(opener, target.toString()).start();
    }
}
