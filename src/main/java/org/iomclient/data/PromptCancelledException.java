package org.iomclient.data;

import java.util.concurrent.CancellationException;

/**
 * The user cancelled a macro variable prompt; the submission was not sent.
 */
public class PromptCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    public PromptCancelledException(String message) {
        super(message);
    }
}
