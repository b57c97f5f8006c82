package org.iomclient.broker;

/**
 * Session registry of the broker. A workspace added here can be looked up by
 * its identifier from a data connection string.
 */
public interface ObjectKeeper {

    void addObject(int type, String name, Workspace workspace) throws BrokerException;

    void removeObject(Workspace workspace) throws BrokerException;
}
