package org.iomclient.manager.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class ValueConverterTest {

    @Test
    void testForFormat() {
        assertEquals(ValueConverter.DAYS_SINCE_EPOCH, ValueConverter.forFormat("YYMMDD"));
        assertEquals(ValueConverter.DAYS_SINCE_EPOCH, ValueConverter.forFormat("date"));
        assertEquals(ValueConverter.SECONDS_SINCE_EPOCH, ValueConverter.forFormat("DATETIME"));
        assertEquals(ValueConverter.SECONDS_SINCE_EPOCH, ValueConverter.forFormat("E8601DT"));
        assertEquals(ValueConverter.IDENTITY, ValueConverter.forFormat("DOLLAR"));
        assertEquals(ValueConverter.IDENTITY, ValueConverter.forFormat(""));
        assertEquals(ValueConverter.IDENTITY, ValueConverter.forFormat(null));
    }

    @Test
    void testDaysSinceEpoch() {
        assertEquals(LocalDate.of(1960, 1, 1), ValueConverter.DAYS_SINCE_EPOCH.convert(0d));
        assertEquals(LocalDate.of(1959, 12, 31), ValueConverter.DAYS_SINCE_EPOCH.convert(-1d));
        // 2000-01-01 is day 14610
        assertEquals(LocalDate.of(2000, 1, 1), ValueConverter.DAYS_SINCE_EPOCH.convert(14610));
    }

    @Test
    void testSecondsSinceEpoch_microsecondPrecision() {
        // Given: A timestamp with a fraction
        LocalDateTime expected = LocalDateTime.of(2021, 3, 4, 5, 6, 7, 123_456_000);
        double seconds = ValueConverter.toEpochSeconds(expected);

        // When / Then
        assertEquals(expected, ValueConverter.SECONDS_SINCE_EPOCH.convert(seconds));
    }

    @Test
    void testEpochHelpers() {
        assertEquals(0d, ValueConverter.toEpochDays(LocalDate.of(1960, 1, 1)));
        assertEquals(86_400d, ValueConverter.toEpochSeconds(LocalDateTime.of(1960, 1, 2, 0, 0)));
    }

    @Test
    void testMissingValues() {
        assertNull(ValueConverter.DAYS_SINCE_EPOCH.convert(null));
        assertNull(ValueConverter.SECONDS_SINCE_EPOCH.convert(Double.NaN));
        assertNull(ValueConverter.IDENTITY.convert(null));
    }

    @Test
    void testIdentity() {
        assertEquals("abc", ValueConverter.IDENTITY.convert("abc"));
        assertEquals(1.5, ValueConverter.IDENTITY.convert(1.5));
        assertFalse(ValueConverter.IDENTITY.isCalendar());
        assertTrue(ValueConverter.DAYS_SINCE_EPOCH.isCalendar());
    }

    @Test
    void testCalendarRejectsText() {
        assertThrows(IllegalArgumentException.class, () -> ValueConverter.DAYS_SINCE_EPOCH.convert("2020-01-01"));
    }
}
