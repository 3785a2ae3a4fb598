package com.ddpport.logging;

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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Asynchronously writes JUL records to a central {@code port_logs} table, one batch per drain cycle.
 * Records published through {@link SessionLog} carry the session id and platform name as their
 * first two parameters, which end up in dedicated columns.
 * <p>
 * Best effort: when the queue is full the oldest record is dropped and counted.
 */
public final class DatabaseLogHandler extends Handler {
    static final String URL_KEY = "port.logging.jdbc.url";
    static final String USER_KEY = "port.logging.jdbc.user";
    static final String PASSWORD_KEY = "port.logging.jdbc.pass";

    private static final int QUEUE_CAPACITY = 1024;
    private static final int BATCH_SIZE = 64;
    private static final long POLL_MILLIS = 200;

    private static final String INSERT_SQL = """
        INSERT INTO port_logs (logged_at, level, logger, session_id, platform, message, host, thrown_type, thrown_msg)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final AtomicLong dropped = new AtomicLong();
    private final HikariDataSource dataSource;
    private final String hostName;
    private final Thread writer;

    private volatile boolean running = true;

    public DatabaseLogHandler(Target target) {
        Objects.requireNonNull(target, "target");
        this.dataSource = openPool(target);
        this.hostName = resolveHostName();
        this.writer = new Thread(this::writeUntilClosed, "port-log-writer");
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
        while (!queue.offer(record)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
            }
        }
    }

    @Override
    public void flush() {
        // the writer thread commits each batch as it drains
    }

    @Override
    public void close() throws SecurityException {
        // no interrupt: the writer finishes its batch and drains the rest on its next poll
        running = false;
        try {
            writer.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
        if (dropped.get() > 0) {
            System.err.println("DatabaseLogHandler dropped " + dropped.get() + " record(s) on a full queue");
        }
    }

    long droppedCount() {
        return dropped.get();
    }

    private void writeUntilClosed() {
        List<LogRecord> batch = new ArrayList<>(BATCH_SIZE);
        while (running) {
            try {
                LogRecord head = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (head == null) {
                    continue;
                }
                batch.add(head);
                queue.drainTo(batch, BATCH_SIZE - 1);
                writeBatch(batch);
            } catch (InterruptedException ex) {
                break;
            } catch (SQLException | RuntimeException ex) {
                System.err.println("DatabaseLogHandler lost " + batch.size() + " record(s): " + ex.getMessage());
            }
            batch.clear();
        }

        queue.drainTo(batch);
        if (!batch.isEmpty()) {
            try {
                writeBatch(batch);
            } catch (SQLException | RuntimeException ex) {
                System.err.println("DatabaseLogHandler lost " + batch.size() + " record(s) on close: " + ex.getMessage());
            }
        }
    }

    private void writeBatch(List<LogRecord> batch) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : batch) {
                PortLogRow.of(record, hostName).bind(statement);
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static HikariDataSource openPool(Target target) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(target.url());
        config.setUsername(target.user());
        config.setPassword(target.password());
        // a single writer thread never needs more than one connection
        config.setMaximumPoolSize(1);
        config.setPoolName("PortLoggingPool");
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            return "unknown-host";
        }
    }

    /**
     * One {@code port_logs} row.
     */
    record PortLogRow(Instant loggedAt, String level, String logger, String sessionId, String platform,
                      String message, String host, String thrownType, String thrownMessage) {

        static PortLogRow of(LogRecord record, String host) {
            Throwable thrown = record.getThrown();
            return new PortLogRow(
                    Instant.ofEpochMilli(record.getMillis()),
                    record.getLevel().getName(),
                    record.getLoggerName(),
                    parameter(record, 0),
                    parameter(record, 1),
                    record.getMessage() == null ? "" : record.getMessage(),
                    host,
                    thrown == null ? null : thrown.getClass().getName(),
                    thrown == null ? null : thrown.getMessage());
        }

        void bind(PreparedStatement statement) throws SQLException {
            statement.setTimestamp(1, Timestamp.from(loggedAt));
            statement.setString(2, level);
            statement.setString(3, logger);
            statement.setString(4, sessionId);
            statement.setString(5, platform);
            statement.setString(6, message);
            statement.setString(7, host);
            statement.setString(8, thrownType);
            statement.setString(9, thrownMessage);
        }

        private static String parameter(LogRecord record, int index) {
            Object[] params = record.getParameters();
            return params == null || params.length <= index || params[index] == null ? null : params[index].toString();
        }
    }

    /**
     * Where the central log goes. Resolved from system properties, then {@code logging-db.properties} on the
     * classpath (same keys); absent when no URL is configured.
     */
    public record Target(String url, String user, String password) {

        public Target {
            Objects.requireNonNull(url, "url");
        }

        public static Optional<Target> resolve() {
            Properties file = classpathProperties();
            String url = lookup(URL_KEY, file);
            if (url == null) {
                return Optional.empty();
            }
            return Optional.of(new Target(url, lookup(USER_KEY, file), lookup(PASSWORD_KEY, file)));
        }

        private static String lookup(String key, Properties file) {
            String value = System.getProperty(key);
            if (value == null || value.isBlank()) {
                value = file.getProperty(key);
            }
            return value == null || value.isBlank() ? null : value.trim();
        }

        private static Properties classpathProperties() {
            Properties props = new Properties();
            try (InputStream stream = DatabaseLogHandler.class.getClassLoader()
                    .getResourceAsStream("logging-db.properties")) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ex) {
                System.err.println("Ignoring unreadable logging-db.properties: " + ex.getMessage());
            }
            return props;
        }
    }
}
