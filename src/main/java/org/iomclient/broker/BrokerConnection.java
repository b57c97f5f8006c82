package org.iomclient.broker;

/**
 * Data connection bound to a workspace. Offers schema rowsets, table cursors
 * and SQL execution.
 */
public interface BrokerConnection {

    int STATE_CLOSED = 0;
    int STATE_OPEN = 1;

    void open(String connectionString) throws BrokerException;

    int getState();

    /**
     * Column metadata rowset for one table. Each row carries
     * {@code COLUMN_NAME}, {@code DATA_TYPE}, {@code FORMAT_NAME},
     * {@code FORMAT_LENGTH} and {@code FORMAT_DECIMAL}.
     *
     * @param tablePath fully qualified table path, e.g. {@code WORK.CARS}
     */
    RecordCursor openColumnsSchema(String tablePath) throws BrokerException;

    RecordCursor openRecordSet(String source, RecordSetOptions options) throws BrokerException;

    void execute(String sql) throws BrokerException;

    void close() throws BrokerException;
}
