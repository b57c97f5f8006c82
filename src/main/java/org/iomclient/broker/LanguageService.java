package org.iomclient.broker;

/**
 * Program submission channel of a workspace.
 */
public interface LanguageService {

    /**
     * Submit program text. No local validation takes place.
     */
    void submit(String code) throws BrokerException;

    /**
     * Read at most {@code maxChars} characters of pending log text.
     * An empty string means the log buffer is drained.
     */
    String flushLog(int maxChars) throws BrokerException;

    /**
     * Read at most {@code maxChars} characters of pending plain-text listing.
     * An empty string means the listing buffer is drained.
     */
    String flushList(int maxChars) throws BrokerException;

    /**
     * Return the token scanner to its initial state. Clears the error state
     * left behind by incomplete or invalid program text.
     */
    void reset() throws BrokerException;
}
