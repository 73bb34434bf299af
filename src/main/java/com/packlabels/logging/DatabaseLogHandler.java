package com.packlabels.logging;

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
import java.util.ArrayList;
import java.util.List;
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
 * Ships JUL records to the central {@code sheet_logs} table in small batches.
 * <p>
 * Construction fails with {@link IllegalStateException} when no JDBC URL is configured, which
 * {@link AppLogger} treats as "console only".
 */
public final class DatabaseLogHandler extends Handler {

    static final String TABLE_NAME = "sheet_logs";
    private static final int MAX_BATCH = 50;

    private static final String INSERT_SQL = """
        INSERT INTO sheet_logs (
            logged_at,
            level,
            logger,
            source,
            message,
            host,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(2048);
    private final HikariDataSource dataSource;
    private final String hostName;
    private final Thread worker;

    private volatile boolean running = true;

    public DatabaseLogHandler() {
        this(DbConfig.load());
    }

    DatabaseLogHandler(DbConfig config) {
        if (!config.enabled()) {
            throw new IllegalStateException("no JDBC URL configured for " + TABLE_NAME);
        }
        this.dataSource = createDataSource(config);
        this.hostName = resolveHostName();
        this.worker = new Thread(this::drainLoop, "sheet-log-writer");
        this.worker.setDaemon(true);
        this.worker.start();
        setLevel(Level.ALL);
    }

    private void drainLoop() {
        List<LogRecord> batch = new ArrayList<>(MAX_BATCH);
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                LogRecord first = queue.poll(1, TimeUnit.SECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, MAX_BATCH - 1);
                writeBatch(batch);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            } catch (SQLException | RuntimeException ex) {
                reportError("sheet_logs write failed: " + ex.getMessage(), ex, ErrorManager.WRITE_FAILURE);
            } finally {
                batch.clear();
            }
        }

        // Whatever is still queued at shutdown goes out in one last pass.
        queue.drainTo(batch);
        if (!batch.isEmpty()) {
            try {
                writeBatch(batch);
            } catch (SQLException | RuntimeException ex) {
                reportError("sheet_logs final flush failed: " + ex.getMessage(), ex, ErrorManager.FLUSH_FAILURE);
            }
        }
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!isLoggable(record) || !running) {
            return;
        }
        if (!queue.offer(record)) {
            queue.poll();
            queue.offer(record);
        }
    }

    @Override
    public void flush() {
        // records are written by the worker thread
    }

    @Override
    public void close() throws SecurityException {
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeBatch(List<LogRecord> records) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : records) {
                statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
                statement.setString(2, record.getLevel().getName());
                statement.setString(3, record.getLoggerName());
                statement.setString(4, source(record));
                statement.setString(5, renderMessage(record));
                statement.setString(6, hostName);
                Throwable thrown = record.getThrown();
                statement.setString(7, thrown == null ? null : thrown.getClass().getName());
                statement.setString(8, thrown == null ? null : thrown.getMessage());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static String source(LogRecord record) {
        String className = record.getSourceClassName();
        if (className == null) {
            return null;
        }
        String method = record.getSourceMethodName();
        return method == null ? className : className + "#" + method;
    }

    static String renderMessage(LogRecord record) {
        String message = record.getMessage();
        Object[] params = record.getParameters();
        if (message == null) {
            return "";
        }
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource createDataSource(DbConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.url());
        hikariConfig.setUsername(config.username());
        hikariConfig.setPassword(config.password());
        hikariConfig.setMaximumPoolSize(config.poolSize());
        hikariConfig.setPoolName("SheetLogPool");
        hikariConfig.setAutoCommit(true);
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }

    record DbConfig(String url, String username, String password, int poolSize) {

        boolean enabled() {
            return url != null && !url.isBlank();
        }

        static DbConfig load() {
            Properties fileProps = loadFileProperties();
            return new DbConfig(
                firstNonBlank(
                    System.getProperty("labelsheet.logging.jdbc.url"),
                    System.getenv("LABELSHEET_LOG_JDBC_URL"),
                    fileProps.getProperty("jdbc.url")),
                firstNonBlank(
                    System.getProperty("labelsheet.logging.jdbc.user"),
                    System.getenv("LABELSHEET_LOG_JDBC_USER"),
                    fileProps.getProperty("jdbc.username")),
                firstNonBlank(
                    System.getProperty("labelsheet.logging.jdbc.pass"),
                    System.getenv("LABELSHEET_LOG_JDBC_PASS"),
                    fileProps.getProperty("jdbc.password")),
                parsePoolSize(firstNonBlank(
                    System.getProperty("labelsheet.logging.jdbc.poolSize"),
                    System.getenv("LABELSHEET_LOG_JDBC_POOL"),
                    fileProps.getProperty("jdbc.poolSize")))
            );
        }

        private static Properties loadFileProperties() {
            Properties props = new Properties();
            try (InputStream stream = DatabaseLogHandler.class
                .getClassLoader()
                .getResourceAsStream("logging-db.properties")) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ex) {
                // a malformed file only means env/system properties have to carry the settings
                props.clear();
            }
            return props;
        }

        private static String firstNonBlank(String... values) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            return null;
        }

        private static int parsePoolSize(String raw) {
            try {
                return raw == null ? 2 : Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return 2;
            }
        }
    }
}
