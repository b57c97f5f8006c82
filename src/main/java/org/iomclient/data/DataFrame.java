package org.iomclient.data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Column oriented local table. Every column carries a fixed {@link ColumnKind}
 * and all columns hold the same number of values.
 */
public final class DataFrame {

    public static final class Column {
        private final String name;
        private final ColumnKind kind;
        private final List<Object> values;

        public Column(String name, ColumnKind kind, List<?> values) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Column name must not be empty");
            }
            this.name = name;
            this.kind = kind;
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public String getName() {
            return name;
        }

        public ColumnKind getKind() {
            return kind;
        }

        public List<Object> getValues() {
            return values;
        }

        public int size() {
            return values.size();
        }
    }

    private final List<Column> columns;
    private final int rowCount;

    public DataFrame(List<Column> columns) {
        int rows = columns.isEmpty() ? 0 : columns.get(0).size();
        for (Column column : columns) {
            if (column.size() != rows) {
                throw new IllegalArgumentException("Column " + column.getName() + " has " + column.size()
                        + " values, expected " + rows);
            }
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rowCount = rows;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a frame from a tabular result. A column's kind is taken from its
     * first non-null value; all-null columns become {@link ColumnKind#OTHER}.
     */
    public static DataFrame of(TabularResult result) {
        Builder builder = builder();
        for (int i = 0; i < result.getHeader().size(); i++) {
            List<Object> values = result.getColumnValues(i);
            builder.column(result.getHeader().get(i), inferKind(values), values);
        }
        return builder.build();
    }

    private static ColumnKind inferKind(List<Object> values) {
        for (Object value : values) {
            if (value == null) continue;
            if (value instanceof Number) return ColumnKind.NUMERIC;
            if (value instanceof String) return ColumnKind.STRING;
            if (value instanceof LocalDateTime || value instanceof LocalDate) return ColumnKind.DATETIME;
            return ColumnKind.OTHER;
        }
        return ColumnKind.OTHER;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public int getRowCount() {
        return rowCount;
    }

    public Column getColumn(String name) {
        for (Column column : columns) {
            if (column.getName().equals(name)) {
                return column;
            }
        }
        throw new IllegalArgumentException("No such column: " + name);
    }

    public static final class Builder {
        private final List<Column> columns = new ArrayList<>();

        private Builder() {
        }

        public Builder column(String name, ColumnKind kind, List<?> values) {
            columns.add(new Column(name, kind, values));
            return this;
        }

        public Builder numeric(String name, Number... values) {
            return column(name, ColumnKind.NUMERIC, Arrays.asList(values));
        }

        public Builder string(String name, String... values) {
            return column(name, ColumnKind.STRING, Arrays.asList(values));
        }

        public Builder datetime(String name, LocalDateTime... values) {
            return column(name, ColumnKind.DATETIME, Arrays.asList(values));
        }

        public Builder other(String name, Object... values) {
            return column(name, ColumnKind.OTHER, Arrays.asList(values));
        }

        public DataFrame build() {
            return new DataFrame(columns);
        }
    }
}
