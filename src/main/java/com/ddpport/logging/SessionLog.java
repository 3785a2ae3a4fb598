package com.ddpport.logging;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Append-only event log for a single donation session.
 * Every line goes to the shared {@link AppLogger} and is kept in memory so it can be donated for inspection.
 */
public final class SessionLog {
    private final String sessionId;
    private final Logger logger;
    private final List<String> lines = new ArrayList<>();

    public SessionLog(String sessionId) {
        this(sessionId, AppLogger.get());
    }

    SessionLog(String sessionId, Logger logger) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public String sessionId() {
        return sessionId;
    }

    public void info(String platform, String message) {
        log(Level.INFO, platform, message, null);
    }

    public void warning(String platform, String message, Throwable thrown) {
        log(Level.WARNING, platform, message, thrown);
    }

    public synchronized List<String> snapshot() {
        return List.copyOf(lines);
    }

    private void log(Level level, String platform, String message, Throwable thrown) {
        LogRecord record = new LogRecord(level, message);
        record.setLoggerName(logger.getName());
        record.setParameters(new Object[]{sessionId, platform});
        record.setThrown(thrown);
        record.setInstant(Instant.now());
        logger.log(record);
        synchronized (this) {
            lines.add(AppLogger.formatLine(record));
        }
    }
}
