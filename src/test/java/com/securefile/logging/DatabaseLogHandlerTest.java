package com.securefile.logging;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseLogHandlerTest {

    private static final String JDBC_URL = "jdbc:h2:mem:organizer-logs;MODE=PostgreSQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";

    @BeforeAll
    static void createTable() throws SQLException {
        System.setProperty("logging.jdbc.url", JDBC_URL);
        System.setProperty("logging.jdbc.user", "sa");
        System.setProperty("logging.jdbc.pass", "");

        try (Connection connection = DriverManager.getConnection(JDBC_URL, "sa", "");
             Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS app_logs");
            statement.execute("""
                CREATE TABLE app_logs (
                    logged_at   TIMESTAMP NOT NULL,
                    level       VARCHAR(16) NOT NULL,
                    logger      VARCHAR(128),
                    message     TEXT,
                    details     TEXT,
                    thread_name VARCHAR(64),
                    host        VARCHAR(128),
                    thrown_type VARCHAR(256),
                    thrown_msg  TEXT
                )
                """);
        }
    }

    @AfterEach
    void emptyTable() throws SQLException {
        try (Connection connection = DriverManager.getConnection(JDBC_URL, "sa", "");
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM app_logs");
        }
    }

    @AfterAll
    static void clearProperties() {
        System.clearProperty("logging.jdbc.url");
        System.clearProperty("logging.jdbc.user");
        System.clearProperty("logging.jdbc.pass");
    }

    @Test
    void closingFlushesQueuedRecordsToTheTable() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler();
        LogRecord started = new LogRecord(Level.INFO, "Starting {0}: {1}");
        started.setLoggerName("com.securefile.SecureFileOrganizer");
        started.setParameters(new Object[]{"organizer", "organize_files.sh /in /out"});
        LogRecord failed = new LogRecord(Level.WARNING, "Could not launch organize_files.sh");
        failed.setThrown(new java.io.IOException("error=2, No such file or directory"));

        handler.publish(started);
        handler.publish(failed);
        handler.close();

        try (Connection connection = DriverManager.getConnection(JDBC_URL, "sa", "");
             PreparedStatement statement = connection.prepareStatement(
                 "SELECT level, logger, message, details, thrown_type, thrown_msg FROM app_logs ORDER BY level")) {
            ResultSet rows = statement.executeQuery();

            assertTrue(rows.next(), "INFO record missing");
            assertEquals("INFO", rows.getString("level"));
            assertEquals("com.securefile.SecureFileOrganizer", rows.getString("logger"));
            assertEquals("Starting organizer: organize_files.sh /in /out", rows.getString("message"));
            assertEquals("[organizer, organize_files.sh /in /out]", rows.getString("details"));
            assertNull(rows.getString("thrown_type"));

            assertTrue(rows.next(), "WARNING record missing");
            assertEquals("java.io.IOException", rows.getString("thrown_type"));
            assertEquals("error=2, No such file or directory", rows.getString("thrown_msg"));
            assertFalse(rows.next());
        }
    }

    @Test
    void recordsBelowHandlerLevelAreDropped() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler();
        handler.setLevel(Level.WARNING);

        handler.publish(new LogRecord(Level.FINE, "tail skipped organizer.log"));
        handler.close();

        try (Connection connection = DriverManager.getConnection(JDBC_URL, "sa", "");
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery("SELECT COUNT(*) FROM app_logs")) {
            assertTrue(rows.next());
            assertEquals(0, rows.getInt(1));
        }
    }

    @Test
    void storesTheNameOfThePublishingThread() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler();
        Thread worker = new Thread(
            () -> handler.publish(new LogRecord(Level.INFO, "organizer exited with 0")), "organizer-runner");
        worker.start();
        worker.join();
        handler.close();

        try (Connection connection = DriverManager.getConnection(JDBC_URL, "sa", "");
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery("SELECT thread_name FROM app_logs")) {
            assertTrue(rows.next());
            assertEquals("organizer-runner", rows.getString("thread_name"));
            assertFalse(rows.next());
        }
    }

    @Test
    void malformedPatternIsStoredVerbatim() {
        LogRecord record = new LogRecord(Level.INFO, "unbalanced {0");
        record.setParameters(new Object[]{"x"});

        assertEquals("unbalanced {0", DatabaseLogHandler.render(record));
    }
}
