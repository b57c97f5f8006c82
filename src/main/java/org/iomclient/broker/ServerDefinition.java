package org.iomclient.broker;

import lombok.Data;

/**
 * Connection target handed to {@link ObjectFactory#createObjectByServer}.
 */
@Data
public class ServerDefinition {
    private String machineDnsName;
    private int port;
    private Protocol protocol;
    private String classIdentifier;
}
