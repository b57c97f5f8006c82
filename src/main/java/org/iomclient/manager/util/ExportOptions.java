package org.iomclient.manager.util;

/**
 * Statements of a CSV export step.
 */
public class ExportOptions {

    private Character delimiter;
    private Boolean putNames;

    public ExportOptions delimiter(char delimiter) {
        this.delimiter = delimiter;
        return this;
    }

    public ExportOptions putNames(boolean putNames) {
        this.putNames = putNames;
        return this;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        if (delimiter != null) {
            sb.append("delimiter=").append(ImportOptions.hexLiteral(delimiter)).append(";\n");
        }
        if (putNames != null) {
            sb.append("putnames=").append(putNames ? "YES" : "NO").append(";\n");
        }
        return sb.toString().trim();
    }
}
