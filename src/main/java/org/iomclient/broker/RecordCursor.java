package org.iomclient.broker;

import java.util.List;

/**
 * Server side cursor over a schema rowset or a table.
 */
public interface RecordCursor {

    List<String> getFieldNames() throws BrokerException;

    Object getValue(int index) throws BrokerException;

    Object getValue(String fieldName) throws BrokerException;

    /**
     * True when the cursor is positioned before the first row. On an empty
     * rowset both this and {@link #isEof()} are true right after opening.
     */
    boolean isBof() throws BrokerException;

    boolean isEof() throws BrokerException;

    void moveFirst() throws BrokerException;

    void moveNext() throws BrokerException;

    void close() throws BrokerException;
}
