package org.iomclient.broker;

/**
 * Entry point of a broker implementation. One instance hands out the three
 * objects a session needs: a factory for workspaces, a keeper that registers
 * live workspaces, and a data connection bound to a workspace.
 *
 * <p>Implementations are loaded by class name (see
 * {@code SessionOptions#getBrokerImpl()}) and must expose a public no-argument
 * constructor.</p>
 */
public interface ObjectBroker {

    ObjectFactory createObjectFactory() throws BrokerException;

    ObjectKeeper createObjectKeeper() throws BrokerException;

    BrokerConnection createConnection() throws BrokerException;
}
