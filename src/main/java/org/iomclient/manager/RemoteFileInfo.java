package org.iomclient.manager;

import org.iomclient.broker.BrokerException;

/**
 * Answers what a path on the server side denotes.
 */
public interface RemoteFileInfo {

    enum FileState {
        MISSING, DIRECTORY, FILE
    }

    FileState stat(String remotePath) throws BrokerException;
}
