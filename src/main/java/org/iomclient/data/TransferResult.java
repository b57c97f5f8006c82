package org.iomclient.data;

import lombok.Value;

/**
 * Outcome of a file transfer. Policy violations such as a missing remote file
 * come back as {@code success == false} instead of an exception.
 */
@Value
public class TransferResult {
    boolean success;
    String message;

    public static TransferResult ok(String message) {
        return new TransferResult(true, message);
    }

    public static TransferResult failed(String message) {
        return new TransferResult(false, message);
    }
}
