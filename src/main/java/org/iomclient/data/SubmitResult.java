package org.iomclient.data;

import lombok.Value;

/**
 * Log and listing produced by one submission.
 */
@Value
public class SubmitResult {
    String log;
    String listing;
}
