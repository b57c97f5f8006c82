package org.iomclient.broker;

/**
 * One live computation session in the remote engine.
 */
public interface Workspace {

    String getUniqueIdentifier() throws BrokerException;

    LanguageService getLanguageService() throws BrokerException;

    FileService getFileService() throws BrokerException;

    void close() throws BrokerException;
}
