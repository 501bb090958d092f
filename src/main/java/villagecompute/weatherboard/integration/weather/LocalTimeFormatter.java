/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherboard.integration.weather;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import org.jboss.logging.Logger;

import villagecompute.weatherboard.api.types.WeatherSnapshotType;

/**
 * Formats OpenWeatherMap epoch timestamps as short local-time strings.
 *
 * <p>
 * The provider reports times as UTC epoch seconds plus a city-wide UTC offset in seconds. Timestamps close to the
 * current time (the observation time, in practice) carry the date as well; others (sunrise, sunset) show the time
 * only.
 *
 * <h2>Output</h2>
 * <ul>
 * <li>Within {@value #FULL_DATE_WINDOW_SECONDS} seconds of now: {@code 3:45pm, oct 19}</li>
 * <li>Otherwise: {@code 7:21am}</li>
 * <li>Whole hours drop the minutes: {@code 9am}</li>
 * <li>Missing input or any conversion failure: {@code N/A}</li>
 * </ul>
 */
public final class LocalTimeFormatter {

    private static final Logger LOG = Logger.getLogger(LocalTimeFormatter.class);

    static final long FULL_DATE_WINDOW_SECONDS = 7200;

    private static final DateTimeFormatter FULL_DATE = DateTimeFormatter.ofPattern("hh:mma, MMM dd", Locale.US);
    private static final DateTimeFormatter TIME_ONLY = DateTimeFormatter.ofPattern("hh:mma", Locale.US);

    private LocalTimeFormatter() {
        // Utility class
    }

    /**
     * Converts a UTC epoch timestamp to the city's local time.
     *
     * @param epochSeconds
     *            UTC timestamp in seconds, may be null
     * @param offsetSeconds
     *            city UTC offset in seconds, may be null
     * @param now
     *            reference instant for the full-date window
     * @return formatted local time, or {@code N/A}
     */
    public static String format(Long epochSeconds, Integer offsetSeconds, Instant now) {
        if (epochSeconds == null || offsetSeconds == null) {
            return WeatherSnapshotType.NOT_AVAILABLE;
        }

        try {
            ZoneOffset offset = ZoneOffset.ofTotalSeconds(offsetSeconds);
            OffsetDateTime local = Instant.ofEpochSecond(epochSeconds).atOffset(offset);

            long distance = Math.abs(Math.subtractExact(now.getEpochSecond(), epochSeconds));
            DateTimeFormatter formatter = distance < FULL_DATE_WINDOW_SECONDS ? FULL_DATE : TIME_ONLY;

            return tidy(formatter.format(local));
        } catch (DateTimeException | ArithmeticException e) {
            LOG.debugf("Error formatting timestamp %d with offset %d: %s", epochSeconds, offsetSeconds,
                    e.getMessage());
            return WeatherSnapshotType.NOT_AVAILABLE;
        }
    }

    /**
     * Lower-cases, strips the hour's leading zero and removes a ":00" minute component.
     */
    static String tidy(String formatted) {
        String lower = formatted.toLowerCase(Locale.ROOT);
        int start = 0;
        while (start < lower.length() && lower.charAt(start) == '0') {
            start++;
        }
        return lower.substring(start).replace(":00", "");
    }
}
