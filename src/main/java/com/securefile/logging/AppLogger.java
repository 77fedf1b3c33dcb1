package com.securefile.logging;

import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Shared logger for the organizer front-end. Console output is always on; the central
 * database handler is attached only when a JDBC URL is configured.
 */
public final class AppLogger {
    static final String LOGGER_NAME = "com.securefile.SecureFileOrganizer";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s [%s] %s%n".formatted(
                    record.getLevel().getName(), Thread.currentThread().getName(), formatMessage(record));
                if (record.getThrown() != null) {
                    line += "    caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        var originalOut = System.out;
        StreamHandler consoleHandler = new StreamHandler(originalOut, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // platform default encoding stays in effect
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);

        try {
            DatabaseLogHandler dbHandler = new DatabaseLogHandler();
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (IllegalStateException ex) {
            logger.fine("Central logging disabled: " + ex.getMessage());
        } catch (Exception ex) {
            logger.warning("Failed to initialize central logging: " + ex.getMessage());
        }

        ConsoleOutputRedirector.redirect(logger);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(logger), "log-shutdown"));
        return logger;
    }

    /**
     * Flushes half-written console lines and lets the database writer persist its queue.
     * The console handler is only flushed; closing it would close the original stdout.
     */
    static void shutdown(Logger logger) {
        ConsoleOutputRedirector.restore();
        for (Handler handler : logger.getHandlers()) {
            if (handler instanceof DatabaseLogHandler) {
                handler.close();
            } else {
                handler.flush();
            }
        }
    }
}
