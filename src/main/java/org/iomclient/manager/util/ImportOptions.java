package org.iomclient.manager.util;

/**
 * Statements of a CSV import step.
 */
public class ImportOptions {

    private Integer dataRow;
    private Character delimiter;
    private Boolean getNames;
    private Integer guessingRows;

    public ImportOptions dataRow(int dataRow) {
        this.dataRow = dataRow;
        return this;
    }

    public ImportOptions delimiter(char delimiter) {
        this.delimiter = delimiter;
        return this;
    }

    public ImportOptions getNames(boolean getNames) {
        this.getNames = getNames;
        return this;
    }

    public ImportOptions guessingRows(int guessingRows) {
        this.guessingRows = guessingRows;
        return this;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        if (dataRow != null) {
            sb.append("datarow=").append(dataRow).append(";\n");
        }
        if (delimiter != null) {
            sb.append("delimiter=").append(hexLiteral(delimiter)).append(";\n");
        }
        if (getNames != null) {
            sb.append("getnames=").append(getNames ? "YES" : "NO").append(";\n");
        }
        if (guessingRows != null) {
            sb.append("guessingrows=").append(guessingRows).append(";\n");
        }
        return sb.toString().trim();
    }

    /**
     * Delimiter as a hex literal, {@code ','} becomes {@code '2c'x}.
     */
    static String hexLiteral(char delimiter) {
        return "'" + String.format("%02x", (int) delimiter) + "'x";
    }
}
