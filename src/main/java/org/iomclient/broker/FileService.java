package org.iomclient.broker;

public interface FileService {

    /**
     * Bind a file reference name to a path on the server.
     *
     * @param name       requested fileref name
     * @param engine     access method, {@code DISK} for plain files
     * @param path       server path
     * @param options    extra fileref options, e.g. {@code PERMISSION='...'}
     * @param properties engine specific properties
     * @return the assigned fileref
     */
    Fileref assignFileref(String name, String engine, String path, String options, String properties)
            throws BrokerException;

    void deassignFileref(String name) throws BrokerException;
}
