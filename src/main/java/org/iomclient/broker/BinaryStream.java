package org.iomclient.broker;

/**
 * Byte channel to a server file. Reads are bounded by the requested size,
 * writes send the whole buffer.
 */
public interface BinaryStream {

    /**
     * Read up to {@code maxBytes} bytes. An empty array signals end of stream.
     */
    byte[] read(int maxBytes) throws BrokerException;

    void write(byte[] data) throws BrokerException;

    void close() throws BrokerException;
}
