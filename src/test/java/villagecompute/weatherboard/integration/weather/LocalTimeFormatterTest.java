/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherboard.integration.weather;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link LocalTimeFormatter}.
 */
class LocalTimeFormatterTest {

    /** 2024-10-19T12:00:00Z */
    private static final long NOON_UTC = 1729339200L;

    @Test
    void testFormat_recentTimestampIncludesDate() {
        Instant now = Instant.ofEpochSecond(NOON_UTC + 60);

        assertEquals("12pm, oct 19", LocalTimeFormatter.format(NOON_UTC, 0, now));
    }

    @Test
    void testFormat_appliesCityOffset() {
        Instant now = Instant.ofEpochSecond(NOON_UTC);

        assertEquals("1pm, oct 19", LocalTimeFormatter.format(NOON_UTC, 3600, now));
        assertEquals("6:30am, oct 19", LocalTimeFormatter.format(NOON_UTC, -19800, now));
    }

    @Test
    void testFormat_wholeHourWithLeadingZero() {
        // 2024-10-05T09:00:00Z
        long nineAm = 1728118800L;

        assertEquals("9am, oct 05", LocalTimeFormatter.format(nineAm, 0, Instant.ofEpochSecond(nineAm)));
    }

    @Test
    void testFormat_distantTimestampIsTimeOnly() {
        // 2024-10-19T15:45:00Z, three hours before now
        long quarterToFour = NOON_UTC + 3 * 3600 + 45 * 60;
        Instant now = Instant.ofEpochSecond(quarterToFour + 3 * 3600);

        assertEquals("3:45pm", LocalTimeFormatter.format(quarterToFour, 0, now));
    }

    @Test
    void testFormat_windowBoundary() {
        long window = LocalTimeFormatter.FULL_DATE_WINDOW_SECONDS;

        assertEquals("12pm, oct 19",
                LocalTimeFormatter.format(NOON_UTC, 0, Instant.ofEpochSecond(NOON_UTC + window - 1)));
        assertEquals("12pm", LocalTimeFormatter.format(NOON_UTC, 0, Instant.ofEpochSecond(NOON_UTC + window)));
        // Timestamps in the future count the same way
        assertEquals("12pm, oct 19",
                LocalTimeFormatter.format(NOON_UTC, 0, Instant.ofEpochSecond(NOON_UTC - window + 1)));
        assertEquals("12pm", LocalTimeFormatter.format(NOON_UTC, 0, Instant.ofEpochSecond(NOON_UTC - window)));
    }

    @Test
    void testFormat_missingInputs() {
        Instant now = Instant.ofEpochSecond(NOON_UTC);

        assertEquals("N/A", LocalTimeFormatter.format(null, 0, now));
        assertEquals("N/A", LocalTimeFormatter.format(NOON_UTC, null, now));
    }

    @Test
    void testFormat_invalidOffset() {
        // Offsets beyond +/-18h are rejected by java.time
        assertEquals("N/A", LocalTimeFormatter.format(NOON_UTC, 100_000, Instant.ofEpochSecond(NOON_UTC)));
    }

    @Test
    void testTidy() {
        assertEquals("10am", LocalTimeFormatter.tidy("10:00AM"));
        assertEquals("7:05pm", LocalTimeFormatter.tidy("07:05PM"));
        assertEquals("3:45pm, oct 19", LocalTimeFormatter.tidy("03:45PM, Oct 19"));
    }
}
