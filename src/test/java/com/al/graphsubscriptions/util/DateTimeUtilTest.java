package com.al.graphsubscriptions.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

public class DateTimeUtilTest {

    @Test
    public void testFormatForGraph_MillisecondPrecisionUtc() {
        Instant instant = Instant.parse("2026-10-19T12:55:00.123456789Z");

        assertEquals("2026-10-19T12:55:00.123Z", DateTimeUtil.formatForGraph(instant));
    }

    @Test
    public void testFormatForGraph_WholeSeconds() {
        assertEquals("2026-10-19T12:55:00Z", DateTimeUtil.formatForGraph(Instant.parse("2026-10-19T12:55:00Z")));
        assertNull(DateTimeUtil.formatForGraph(null));
    }

    @Test
    public void testParseGraphTimestamp_SevenFractionalDigits() {
        Instant parsed = DateTimeUtil.parseGraphTimestamp("2026-10-19T12:55:00.1234567Z");

        assertEquals(Instant.parse("2026-10-19T12:55:00.123456700Z"), parsed);
    }

    @Test
    public void testParseGraphTimestamp_ExplicitOffset() {
        assertEquals(Instant.parse("2026-10-19T10:55:00Z"),
                DateTimeUtil.parseGraphTimestamp("2026-10-19T12:55:00+02:00"));
    }

    @Test
    public void testParseGraphTimestamp_BlankAndInvalid() {
        assertNull(DateTimeUtil.parseGraphTimestamp(" "));
        assertThrows(DateTimeParseException.class, () -> DateTimeUtil.parseGraphTimestamp("tomorrow"));
    }
}
