package org.iomclient.manager.util;

/**
 * Column metadata of a remote table as reported by the columns schema rowset,
 * plus the value conversion derived from its display format.
 */
public class ColumnDescriptor {

    public enum DataType {
        NUMERIC, CHARACTER
    }

    private final String columnName;
    private final DataType dataType;
    private final String formatName;
    private final int formatLength;
    private final int formatDecimal;
    private final ValueConverter converter;

    public ColumnDescriptor(String columnName, DataType dataType, String formatName, int formatLength,
                            int formatDecimal) {
        this.columnName = columnName;
        this.dataType = dataType;
        this.formatName = formatName == null ? "" : formatName.trim();
        this.formatLength = formatLength;
        this.formatDecimal = formatDecimal;
        this.converter = dataType == DataType.CHARACTER ? ValueConverter.IDENTITY : ValueConverter.forFormat(this.formatName);
    }

    public String getColumnName() {
        return columnName;
    }

    public DataType getDataType() {
        return dataType;
    }

    public String getFormatName() {
        return formatName;
    }

    public int getFormatLength() {
        return formatLength;
    }

    public int getFormatDecimal() {
        return formatDecimal;
    }

    public ValueConverter getConverter() {
        return converter;
    }

    public boolean isDate() {
        return converter == ValueConverter.DAYS_SINCE_EPOCH;
    }

    public boolean isDatetime() {
        return converter == ValueConverter.SECONDS_SINCE_EPOCH;
    }

    /**
     * Format as written in a FORMAT statement, e.g. {@code DOLLAR10.2}.
     * Empty when the column carries no format.
     */
    public String formatSpec() {
        if (formatName.isEmpty()) {
            return "";
        }
        return formatName + (formatLength > 0 ? Integer.toString(formatLength) : "") + "." +
                (formatDecimal > 0 ? Integer.toString(formatDecimal) : "");
    }

    @Override
    public String toString() {
        return "ColumnDescriptor{" +
                "columnName='" + columnName + '\'' +
                ", dataType=" + dataType +
                ", formatName='" + formatName + '\'' +
                ", formatLength=" + formatLength +
                ", formatDecimal=" + formatDecimal +
                ", converter=" + converter +
                '}';
    }
}
