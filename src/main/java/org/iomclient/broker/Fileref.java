package org.iomclient.broker;

public interface Fileref {

    String getFilerefName();

    BinaryStream openBinaryStream(StreamMode mode) throws BrokerException;
}
