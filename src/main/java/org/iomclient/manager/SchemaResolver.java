package org.iomclient.manager;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.iomclient.broker.BrokerException;
import org.iomclient.broker.RecordCursor;
import org.iomclient.manager.util.ColumnDescriptor;
import org.iomclient.manager.util.TablePath;

/**
 * Column metadata of remote tables. Nothing is cached; every call queries the
 * columns schema rowset again.
 */
public class SchemaResolver {

    private static final Logger LOG = LogManager.getLogger(SchemaResolver.class.getName());

    static final String COLUMN_NAME = "COLUMN_NAME";
    static final String DATA_TYPE = "DATA_TYPE";
    static final String FORMAT_NAME = "FORMAT_NAME";
    static final String FORMAT_LENGTH = "FORMAT_LENGTH";
    static final String FORMAT_DECIMAL = "FORMAT_DECIMAL";

    // provider type codes of character columns
    private static final int TYPE_CHAR = 129;
    private static final int TYPE_WCHAR = 130;
    private static final int TYPE_VARCHAR = 200;
    private static final int TYPE_VARWCHAR = 202;

    private final SessionManager session;

    public SchemaResolver(SessionManager session) {
        this.session = session;
    }

    /**
     * Column metadata of {@code libref.table} in column order, keyed by column name.
     * An unknown table yields an empty map.
     */
    public Map<String, ColumnDescriptor> resolve(String table, String libref) throws BrokerException {
        String tablePath = TablePath.of(table, libref);
        Map<String, ColumnDescriptor> metadata = new LinkedHashMap<>();

        RecordCursor schema = session.openColumnsSchema(tablePath);
        try {
            if (!(schema.isBof() && schema.isEof())) {
                schema.moveFirst();
            }
            while (!schema.isEof()) {
                ColumnDescriptor column = new ColumnDescriptor(
                        (String) schema.getValue(COLUMN_NAME),
                        dataType(schema.getValue(DATA_TYPE)),
                        (String) schema.getValue(FORMAT_NAME),
                        intValue(schema.getValue(FORMAT_LENGTH)),
                        intValue(schema.getValue(FORMAT_DECIMAL)));
                metadata.put(column.getColumnName(), column);
                schema.moveNext();
            }
        } finally {
            schema.close();
        }

        LOG.debug("Schema of {}: {}", tablePath, metadata.values());
        return metadata;
    }

    /**
     * True if the columns schema of {@code libref.table} has at least one row.
     */
    public boolean exists(String table, String libref) throws BrokerException {
        String tablePath = TablePath.of(table, libref);
        RecordCursor schema = session.openColumnsSchema(tablePath);
        try {
            return !schema.isBof();
        } finally {
            schema.close();
        }
    }

    private static ColumnDescriptor.DataType dataType(Object code) {
        if (code == null) {
            return ColumnDescriptor.DataType.NUMERIC;
        }
        switch (intValue(code)) {
            case TYPE_CHAR:
            case TYPE_WCHAR:
            case TYPE_VARCHAR:
            case TYPE_VARWCHAR:
                return ColumnDescriptor.DataType.CHARACTER;
            default:
                return ColumnDescriptor.DataType.NUMERIC;
        }
    }

    private static int intValue(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }
}
