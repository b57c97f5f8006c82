package org.iomclient.broker;

public interface ObjectFactory {

    /**
     * Create a workspace on the server described by {@code server}.
     *
     * @param logicalName the logical server name, e.g. {@code SASApp}
     * @param synchronous whether creation blocks until the workspace is usable
     * @param server      where and how to connect
     * @param user        user name, null for a local broker
     * @param password    password, null for a local broker
     * @return the new workspace
     * @throws BrokerException if the server cannot be reached or refuses the login
     */
    Workspace createObjectByServer(String logicalName, boolean synchronous, ServerDefinition server,
                                   String user, String password) throws BrokerException;
}
