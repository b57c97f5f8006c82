package org.iomclient.manager.util;

import org.apache.commons.lang3.StringUtils;

/**
 * Two-level table names. Without a library the engine resolves the table in
 * the WORK library.
 */
public final class TablePath {

    private TablePath() {
    }

    public static String of(String table, String libref) {
        if (StringUtils.isBlank(table)) {
            throw new IllegalArgumentException("Table name must not be blank");
        }
        if (StringUtils.isBlank(libref)) {
            return table.trim();
        }
        return libref.trim() + "." + table.trim();
    }
}
