package org.iomclient.data;

/**
 * Static typing of a local {@link DataFrame} column.
 */
public enum ColumnKind {
    NUMERIC,
    STRING,
    DATETIME,
    /**
     * Anything else. Values are written as their string representation.
     */
    OTHER
}
