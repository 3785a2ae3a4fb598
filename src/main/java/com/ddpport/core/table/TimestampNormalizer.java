package com.ddpport.core.table;

import com.ddpport.logging.AppLogger;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.logging.Logger;

/**
 * Best-effort conversion of the date strings found in exports to ISO-8601.
 * Ambiguous numeric dates are not attempted; anything unrecognised becomes the empty string.
 */
public final class TimestampNormalizer {
    private static final Logger LOGGER = AppLogger.get();

    private static final Pattern UNICODE_SPACE = Pattern.compile("[\\u00A0\\u2007\\u202F]");
    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern GLUED_MERIDIEM = Pattern.compile("(\\d)([AaPp][Mm])\\b");
    private static final Pattern ABBREVIATION_DOT = Pattern.compile("\\b([A-Za-z]{3,4})\\.");
    private static final Pattern TRAILING_ZONE =
            Pattern.compile("\\s+([A-Za-z]{2,5}|(?:GMT|UTC)[+-]\\d{1,2}(?::\\d{2})?)$");
    private static final Pattern DUTCH_MONTH = Pattern.compile("(?i)\\b(mrt|mei|okt)\\b");

    private static final List<DateTimeFormatter> FORMATS = List.of(
            formatter("MMM d, yyyy, h:mm:ss a"),
            formatter("MMM d, yyyy, HH:mm:ss"),
            formatter("d MMM yyyy, HH:mm:ss"),
            formatter("d MMM yyyy HH:mm:ss"),
            formatter("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    private static final DateTimeFormatter EPOCH_OUTPUT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx");

    private TimestampNormalizer() {
    }

    public static String toIso8601(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return "";
        }
        String cleaned = clean(timestamp);
        Optional<String> offset = parse(cleaned, DateTimeFormatter.ISO_OFFSET_DATE_TIME, true);
        if (offset.isPresent()) {
            return offset.get();
        }
        String local = stripZone(cleaned);
        for (DateTimeFormatter format : FORMATS) {
            Optional<String> parsed = parse(local, format, false);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        LOGGER.fine("Cannot convert timestamp: " + timestamp);
        return "";
    }

    private static Optional<String> parse(String text, DateTimeFormatter format, boolean withOffset) {
        try {
            return Optional.of(withOffset
                    ? OffsetDateTime.parse(text, format).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    : LocalDateTime.parse(text, format).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    /**
     * Converts epoch seconds to an ISO-8601 UTC timestamp; returns the input unchanged if it is not a number.
     */
    public static String epochToIso(String epochSeconds) {
        try {
            long seconds = Long.parseLong(epochSeconds.trim());
            return EPOCH_OUTPUT.format(Instant.ofEpochSecond(seconds).atOffset(ZoneOffset.UTC));
        } catch (RuntimeException ex) {
            LOGGER.warning("Could not convert epoch timestamp '%s': %s".formatted(epochSeconds, ex.getMessage()));
            return epochSeconds;
        }
    }

    static String clean(String timestamp) {
        String cleaned = UNICODE_SPACE.matcher(timestamp).replaceAll(" ");
        cleaned = NON_ASCII.matcher(cleaned).replaceAll("");
        cleaned = GLUED_MERIDIEM.matcher(cleaned).replaceAll("$1 $2");
        cleaned = ABBREVIATION_DOT.matcher(cleaned).replaceAll("$1");
        cleaned = replaceDutchMonth(cleaned);
        return cleaned.replaceAll("\\s+", " ").trim();
    }

    private static String replaceDutchMonth(String text) {
        Matcher matcher = DUTCH_MONTH.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        String english = switch (matcher.group(1).toLowerCase(Locale.ROOT)) {
            case "mrt" -> "mar";
            case "mei" -> "may";
            default -> "oct";
        };
        return text.substring(0, matcher.start()) + english + text.substring(matcher.end());
    }

    private static String stripZone(String timestamp) {
        Matcher matcher = TRAILING_ZONE.matcher(timestamp);
        if (matcher.find() && !matcher.group(1).equalsIgnoreCase("AM") && !matcher.group(1).equalsIgnoreCase("PM")) {
            return timestamp.substring(0, matcher.start());
        }
        return timestamp;
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
