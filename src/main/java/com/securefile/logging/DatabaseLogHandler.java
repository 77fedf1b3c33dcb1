package com.securefile.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.ErrorManager;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Ships log records to a central database table from a single background writer.
 * Construction fails with {@link IllegalStateException} when no JDBC URL is configured.
 */
public final class DatabaseLogHandler extends Handler {

    static final String PROPERTIES_RESOURCE = "logging-db.properties";

    private static final String INSERT_SQL = """
        INSERT INTO app_logs (
            logged_at, level, logger, message, details,
            thread_name, host, thrown_type, thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    private static final int QUEUE_CAPACITY = 2048;
    private static final long POLL_MILLIS = 200;

    private final BlockingQueue<PendingRecord> pending = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final HikariDataSource dataSource;
    private final String hostName;
    private final Thread writer;

    private volatile boolean running = true;

    public DatabaseLogHandler() {
        Settings settings = Settings.resolve();
        if (settings.url() == null) {
            throw new IllegalStateException("no JDBC URL configured for central logging");
        }
        this.dataSource = openPool(settings);
        this.hostName = localHostName();
        this.writer = new Thread(this::writeLoop, "central-log-writer");
        this.writer.setDaemon(true);
        this.writer.start();
        setLevel(Level.ALL);
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!running || !isLoggable(record)) {
            return;
        }
        // JUL publishes on the logging thread, so its name is only known here
        PendingRecord entry = new PendingRecord(record, Thread.currentThread().getName());
        // drop the oldest record rather than block the caller
        while (!pending.offer(entry)) {
            pending.poll();
        }
    }

    @Override
    public void flush() {
        // the writer thread persists records as they arrive
    }

    @Override
    public void close() {
        running = false;
        try {
            writer.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeLoop() {
        while (running) {
            try {
                PendingRecord entry = pending.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (entry != null) {
                    insert(entry);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            } catch (SQLException | RuntimeException ex) {
                reportError("Central log write failed", ex, ErrorManager.WRITE_FAILURE);
            }
        }
        PendingRecord leftover;
        while ((leftover = pending.poll()) != null) {
            try {
                insert(leftover);
            } catch (SQLException | RuntimeException ex) {
                reportError("Central log flush failed", ex, ErrorManager.FLUSH_FAILURE);
            }
        }
    }

    private void insert(PendingRecord entry) throws SQLException {
        LogRecord record = entry.record();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            Throwable thrown = record.getThrown();
            statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
            statement.setString(2, record.getLevel().getName());
            statement.setString(3, record.getLoggerName());
            statement.setString(4, render(record));
            statement.setString(5, details(record));
            statement.setString(6, entry.threadName());
            statement.setString(7, hostName);
            statement.setString(8, thrown == null ? null : thrown.getClass().getName());
            statement.setString(9, thrown == null ? null : thrown.getMessage());
            statement.executeUpdate();
        }
    }

    static String render(LogRecord record) {
        String message = record.getMessage();
        if (message == null) {
            return "";
        }
        Object[] params = record.getParameters();
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    static String details(LogRecord record) {
        Object[] params = record.getParameters();
        return params == null || params.length == 0 ? null : Arrays.toString(params);
    }

    private record PendingRecord(LogRecord record, String threadName) {
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource openPool(Settings settings) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.url());
        config.setUsername(settings.user());
        config.setPassword(settings.password());
        config.setMaximumPoolSize(settings.poolSize());
        config.setPoolName("OrganizerLogPool");
        config.setAutoCommit(true);
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }

    /**
     * Connection settings; system properties win over environment variables, which win over
     * the optional classpath properties file.
     */
    record Settings(String url, String user, String password, int poolSize) {

        static Settings resolve() {
            Properties file = readClasspathFile();
            return new Settings(
                pick("logging.jdbc.url", "LOGGING_JDBC_URL", file.getProperty("jdbc.url")),
                pick("logging.jdbc.user", "LOGGING_JDBC_USER", file.getProperty("jdbc.username")),
                pick("logging.jdbc.pass", "LOGGING_JDBC_PASS", file.getProperty("jdbc.password")),
                poolSize(pick("logging.jdbc.poolSize", "LOGGING_JDBC_POOL", file.getProperty("jdbc.poolSize")))
            );
        }

        private static String pick(String property, String env, String fileValue) {
            for (String candidate : new String[]{System.getProperty(property), System.getenv(env), fileValue}) {
                if (candidate != null && !candidate.isBlank()) {
                    return candidate.trim();
                }
            }
            return null;
        }

        private static int poolSize(String raw) {
            if (raw == null) {
                return 2;
            }
            try {
                return Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return 2;
            }
        }

        private static Properties readClasspathFile() {
            Properties props = new Properties();
            try (InputStream in = DatabaseLogHandler.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
                if (in != null) {
                    props.load(in);
                }
            } catch (IOException ignored) {
                // malformed file: rely on system properties and environment
            }
            return props;
        }
    }
}
