package com.ddpport.config;

import com.ddpport.core.ddp.MatchRule;
import com.ddpport.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Central entry point for resolving configuration values.
 * System properties win over {@code port.properties} on the classpath, which wins over built-in defaults.
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    public static final String CHUNK_SIZE = "port.donation.chunkSize";
    public static final String MATCH_RULE = "port.classifier.matchRule";
    public static final String DONATE_LOGS = "port.logs.donate";
    public static final String FILE_EXTENSIONS = "port.file.extensions";

    static final int DEFAULT_CHUNK_SIZE = 250_000;
    static final String DEFAULT_FILE_EXTENSIONS = "application/zip, text/plain, application/json";

    private static final ConfigService INSTANCE = new ConfigService(loadClasspathProperties(), true);

    private final Properties properties;
    private final boolean systemOverrides;

    public ConfigService(Properties properties) {
        this(properties, false);
    }

    private ConfigService(Properties properties, boolean systemOverrides) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.systemOverrides = systemOverrides;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * Maximum number of rows shown (and donated) per chunk of a very large table.
     */
    public int getChunkSize() {
        String raw = value(CHUNK_SIZE);
        if (raw == null) {
            return DEFAULT_CHUNK_SIZE;
        }
        try {
            int parsed = Integer.parseInt(raw);
            return parsed > 0 ? parsed : DEFAULT_CHUNK_SIZE;
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring invalid %s '%s'".formatted(CHUNK_SIZE, raw));
            return DEFAULT_CHUNK_SIZE;
        }
    }

    public MatchRule getMatchRule() {
        String raw = value(MATCH_RULE);
        if (raw == null) {
            return MatchRule.ANY_OVERLAP;
        }
        try {
            return MatchRule.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            LOGGER.warning("Ignoring invalid %s '%s'".formatted(MATCH_RULE, raw));
            return MatchRule.ANY_OVERLAP;
        }
    }

    public boolean isDonateLogs() {
        return Boolean.parseBoolean(value(DONATE_LOGS));
    }

    public String getFileExtensions() {
        String raw = value(FILE_EXTENSIONS);
        return raw == null ? DEFAULT_FILE_EXTENSIONS : raw;
    }

    private String value(String key) {
        if (systemOverrides) {
            String override = System.getProperty(key);
            if (override != null && !override.isBlank()) {
                return override.trim();
            }
        }
        String configured = properties.getProperty(key);
        if (configured == null || configured.isBlank()) {
            return null;
        }
        return configured.trim();
    }

    private static Properties loadClasspathProperties() {
        Properties props = new Properties();
        try (InputStream stream = ConfigService.class.getClassLoader().getResourceAsStream("port.properties")) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ex) {
            LOGGER.warning("Could not read port.properties: " + ex.getMessage());
        }
        return props;
    }
}
