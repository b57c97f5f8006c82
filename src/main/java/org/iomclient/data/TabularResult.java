package org.iomclient.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows read from a remote table. Every row has one value per header column
 * and every value has already been through its column's conversion.
 */
public final class TabularResult {

    private final List<String> header;
    private final List<List<Object>> rows;

    public TabularResult(List<String> header, List<List<Object>> rows) {
        this.header = Collections.unmodifiableList(new ArrayList<>(header));
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            if (row.size() != header.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + row.size()
                        + " values, header has " + header.size() + " columns");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> getHeader() {
        return header;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int columnIndex(String name) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).equalsIgnoreCase(name)) {
                return i;
            }
        }
        throw new IllegalArgumentException("No such column: " + name);
    }

    public Object getValue(int row, String column) {
        return rows.get(row).get(columnIndex(column));
    }

    public List<Object> getColumnValues(int index) {
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    @Override
    public String toString() {
        return "TabularResult{header=" + header + ", rows=" + rows.size() + '}';
    }
}
