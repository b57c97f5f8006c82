package org.iomclient.manager;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.iomclient.broker.BrokerException;
import org.iomclient.cli.OutputFormat;
import org.iomclient.data.SubmitResult;

/**
 * Learns the state of a server path from a data step that tries to open it
 * as a directory and then checks whether it exists as a file.
 */
public class SubmittedRemoteFileInfo implements RemoteFileInfo {

    private static final Logger LOG = LogManager.getLogger(SubmittedRemoteFileInfo.class.getName());

    static final String FILEREF = "_iocfi";
    static final String STATE_KEY = "FILESTATE=";

    private final CodeSubmitter submitter;

    public SubmittedRemoteFileInfo(CodeSubmitter submitter) {
        this.submitter = submitter;
    }

    @Override
    public FileState stat(String remotePath) throws BrokerException {
        SubmitResult result = submitter.submit(program(remotePath), OutputFormat.TEXT);
        String state = LogScanner.valueOf(result.getLog(), STATE_KEY);
        if (state == null) {
            throw new BrokerException("Could not determine the state of " + remotePath + ": "
                    + LogScanner.firstError(result.getLog()));
        }
        LOG.debug("Remote path {} is {}", remotePath, state);
        try {
            return FileState.valueOf(state);
        } catch (IllegalArgumentException e) {
            throw new BrokerException("Unexpected file state '" + state + "' for " + remotePath, e);
        }
    }

    static String program(String remotePath) {
        String quoted = remotePath.replace("\"", "\"\"");
        return "filename " + FILEREF + " \"" + quoted + "\";\n" +
                "data _null_;\n" +
                "    length state $9;\n" +
                "    did = dopen('" + FILEREF + "');\n" +
                "    if did > 0 then do;\n" +
                "        state = 'DIRECTORY';\n" +
                "        rc = dclose(did);\n" +
                "    end;\n" +
                "    else if fexist('" + FILEREF + "') then state = 'FILE';\n" +
                "    else state = 'MISSING';\n" +
                "    put '" + STATE_KEY + "' state;\n" +
                "run;\n" +
                "filename " + FILEREF + " clear;\n";
    }
}
