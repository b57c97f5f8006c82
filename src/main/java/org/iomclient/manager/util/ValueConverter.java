package org.iomclient.manager.util;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Per-column conversion of raw cursor values, chosen from the column's display
 * format. Missing values stay {@code null}.
 */
public enum ValueConverter {

    IDENTITY {
        @Override
        public Object convert(Object raw) {
            return raw;
        }
    },

    DAYS_SINCE_EPOCH {
        @Override
        public Object convert(Object raw) {
            Double days = asNumber(raw);
            if (days == null) {
                return null;
            }
            return FormatCatalog.EPOCH.plusDays((long) Math.floor(days));
        }
    },

    SECONDS_SINCE_EPOCH {
        @Override
        public Object convert(Object raw) {
            Double seconds = asNumber(raw);
            if (seconds == null) {
                return null;
            }
            long whole = (long) Math.floor(seconds);
            long micros = Math.round((seconds - whole) * 1_000_000d);
            return FormatCatalog.EPOCH.atStartOfDay().plusSeconds(whole).plusNanos(micros * 1_000L);
        }
    };

    public abstract Object convert(Object raw);

    public static ValueConverter forFormat(String formatName) {
        if (FormatCatalog.isDateFormat(formatName)) {
            return DAYS_SINCE_EPOCH;
        } else if (FormatCatalog.isDatetimeFormat(formatName)) {
            return SECONDS_SINCE_EPOCH;
        }
        return IDENTITY;
    }

    public boolean isCalendar() {
        return this != IDENTITY;
    }

    private static Double asNumber(Object raw) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Number)) {
            throw new IllegalArgumentException("Calendar column holds a non numeric value: " + raw);
        }
        double value = ((Number) raw).doubleValue();
        return Double.isNaN(value) ? null : value;
    }

    /**
     * Days between the engine epoch and {@code date}.
     */
    public static double toEpochDays(LocalDate date) {
        return date.toEpochDay() - FormatCatalog.EPOCH.toEpochDay();
    }

    /**
     * Seconds between the engine epoch and {@code dateTime}, with microsecond precision.
     */
    public static double toEpochSeconds(LocalDateTime dateTime) {
        long days = dateTime.toLocalDate().toEpochDay() - FormatCatalog.EPOCH.toEpochDay();
        long seconds = days * 86_400L + dateTime.toLocalTime().toSecondOfDay();
        return seconds + (dateTime.getNano() / 1_000L) / 1_000_000d;
    }
}
