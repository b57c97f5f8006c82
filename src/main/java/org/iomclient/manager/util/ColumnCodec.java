package org.iomclient.manager.util;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.iomclient.data.ColumnKind;
import org.iomclient.data.DataFrame;

/**
 * Remote column definition and SQL literal rendering for one kind of local
 * column. Resolved once per column, then applied to every value of it.
 */
public enum ColumnCodec {

    NUMERIC {
        @Override
        public String definition(DataFrame.Column column) {
            return quoteName(column.getName()) + " num";
        }

        @Override
        public String literal(Object value) {
            if (isMissing(value)) {
                return NULL;
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).toPlainString();
            }
            if (!(value instanceof Number)) {
                // the literal is written unquoted, so only numbers may reach it
                throw new IllegalArgumentException(
                        "Not a numeric value: " + value + " (" + value.getClass().getName() + ")");
            }
            return value.toString();
        }
    },

    STRING {
        @Override
        public String definition(DataFrame.Column column) {
            return quoteName(column.getName()) + " char(" + maxLength(column.getValues()) + ")";
        }

        @Override
        public String literal(Object value) {
            return value == null ? NULL : quoteString(value.toString());
        }
    },

    DATETIME {
        @Override
        public String definition(DataFrame.Column column) {
            return quoteName(column.getName()) + " num informat=" + DATETIME_FORMAT + " format=" + DATETIME_FORMAT;
        }

        @Override
        public String literal(Object value) {
            LocalDateTime dateTime = toLocalDateTime(value);
            return dateTime == null ? NULL : "'" + DATETIME_LITERAL.format(dateTime) + "'DT";
        }
    },

    FALLBACK {
        @Override
        public String definition(DataFrame.Column column) {
            return quoteName(column.getName()) + " char(" + maxLength(column.getValues()) + ")";
        }

        @Override
        public String literal(Object value) {
            return value == null ? NULL : quoteString(String.valueOf(value));
        }
    };

    static final String NULL = "NULL";
    static final String DATETIME_FORMAT = "E8601DT26.6";
    static final DateTimeFormatter DATETIME_LITERAL = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS");

    /**
     * Column definition for a {@code create table} statement.
     */
    public abstract String definition(DataFrame.Column column);

    /**
     * SQL literal of one value, {@code NULL} for a missing value.
     */
    public abstract String literal(Object value);

    public static ColumnCodec forKind(ColumnKind kind) {
        switch (kind) {
            case NUMERIC:
                return NUMERIC;
            case STRING:
                return STRING;
            case DATETIME:
                return DATETIME;
            default:
                return FALLBACK;
        }
    }

    /**
     * Name literal {@code 'name'n}, valid for any column name.
     */
    public static String quoteName(String name) {
        return "'" + name.replace("'", "''") + "'n";
    }

    static String quoteString(String value) {
        // a single quote inside a quoted string is written twice
        return "'" + value.replace("'", "''") + "'";
    }

    static int maxLength(List<Object> values) {
        int max = 1;
        for (Object value : values) {
            if (value != null) {
                max = Math.max(max, String.valueOf(value).length());
            }
        }
        return max;
    }

    private static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double) {
            return ((Double) value).isNaN() || ((Double) value).isInfinite();
        }
        if (value instanceof Float) {
            return ((Float) value).isNaN() || ((Float) value).isInfinite();
        }
        return false;
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        throw new IllegalArgumentException("Not a datetime value: " + value + " (" + value.getClass().getName() + ")");
    }
}
