package com.ddpport.core.table;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TimestampNormalizerTest {

    @Test
    void englishTakeoutDate() {
        assertEquals("2023-01-05T15:04:05", TimestampNormalizer.toIso8601("Jan 5, 2023, 3:04:05 PM CET"));
        assertEquals("2023-01-05T15:04:05", TimestampNormalizer.toIso8601("Jan 5, 2023, 3:04:05\u202FPM CET"));
        assertEquals("2023-01-05T15:04:05", TimestampNormalizer.toIso8601("Jan 5, 2023, 3:04:05PM CET"));
    }

    @Test
    void dutchTakeoutDate() {
        assertEquals("2023-03-05T14:03:02", TimestampNormalizer.toIso8601("5 mrt. 2023, 14:03:02 CET"));
        assertEquals("2022-10-12T08:00:59", TimestampNormalizer.toIso8601("12 okt 2022, 08:00:59 CEST"));
        assertEquals("2021-05-01T23:59:59", TimestampNormalizer.toIso8601("1 mei 2021 23:59:59"));
    }

    @Test
    void isoAndPlainTimestamps() {
        assertEquals("2023-01-01T10:00:00", TimestampNormalizer.toIso8601("2023-01-01 10:00:00"));
        assertEquals("2023-01-01T10:00:00+01:00", TimestampNormalizer.toIso8601("2023-01-01T10:00:00+01:00"));
    }

    @Test
    void unrecognisedInputBecomesEmpty() {
        assertEquals("", TimestampNormalizer.toIso8601("yesterday"));
        assertEquals("", TimestampNormalizer.toIso8601("01/02/2023"));
        assertEquals("", TimestampNormalizer.toIso8601(""));
        assertEquals("", TimestampNormalizer.toIso8601(null));
    }

    @Test
    void epochSeconds() {
        assertEquals("2023-01-01T00:00:00+00:00", TimestampNormalizer.epochToIso("1672531200"));
        assertEquals("not-a-number", TimestampNormalizer.epochToIso("not-a-number"));
    }

    @Test
    void cleaningRemovesNonAsciiNoise() {
        assertEquals("Jan 5, 2023", TimestampNormalizer.clean("Jan\u00A05,\u200E 2023 "));
    }
}
