package com.al.graphsubscriptions.util;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Conversions between {@link Instant} and the ISO-8601 strings Graph exchanges.
 *
 * <p>
 * Graph returns timestamps with up to seven fractional digits, e.g.
 * {@code 2026-10-19T12:55:00.1234567Z}, and occasionally with an explicit {@code +00:00} offset.
 */
public final class DateTimeUtil {

    private DateTimeUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Millisecond precision UTC, matching what JavaScript clients of the same API send.
     */
    public static String formatForGraph(Instant instant) {
        if (instant == null) {
            return null;
        }
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    /**
     * @return the parsed instant, or null for null/blank input
     * @throws java.time.format.DateTimeParseException if the value is not ISO-8601
     */
    public static Instant parseGraphTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(value.trim()).toInstant();
    }
}
