package org.iomclient.broker;

/**
 * Failure reported by the object broker or by the remote workspace behind it.
 * Plays the role {@link java.sql.SQLException} plays for JDBC: every call that
 * crosses the broker boundary may throw it and callers are expected to
 * propagate it.
 */
public class BrokerException extends Exception {

    private static final long serialVersionUID = 1L;

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
