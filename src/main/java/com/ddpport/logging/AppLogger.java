package com.ddpport.logging;

import java.io.UnsupportedEncodingException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides a shared logger configuration for the donation port.
 */
public final class AppLogger {
    static final String LOGGER_NAME = "com.ddpport.port";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ").withZone(ZoneId.systemDefault());

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    static String formatLine(LogRecord record) {
        return "%s --- %s --- %s --- %s".formatted(
                TIMESTAMP.format(Instant.ofEpochMilli(record.getMillis())),
                record.getLoggerName(),
                record.getLevel().getName(),
                record.getMessage());
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                return formatLine(record) + System.lineSeparator();
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.err, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (UnsupportedEncodingException ex) {
            throw new IllegalStateException("UTF-8 not supported", ex);
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);

        Optional<DatabaseLogHandler.Target> target = DatabaseLogHandler.Target.resolve();
        if (target.isEmpty()) {
            logger.fine("Central logging disabled: no JDBC URL configured");
            return logger;
        }
        try {
            DatabaseLogHandler dbHandler = new DatabaseLogHandler(target.get());
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (RuntimeException ex) {
            logger.warning("Failed to initialize central logging: " + ex.getMessage());
        }
        return logger;
    }
}
