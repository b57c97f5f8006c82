package org.iomclient.manager;

import org.iomclient.broker.BrokerException;
import org.iomclient.cli.OutputFormat;
import org.iomclient.data.SubmitResult;

/**
 * Location of the remote WORK directory and the separator used in server
 * paths. Learned once per session from the log of a small program.
 */
public final class WorkspacePaths {

    static final String DISCOVERY_PROGRAM = "%put WORKPATH=%sysfunc(pathname(work));\n%put SYSSCP=&SYSSCP;\n";

    private final String workPath;
    private final String hostSeparator;

    public WorkspacePaths(String workPath, String hostSeparator) {
        this.hostSeparator = hostSeparator;
        this.workPath = workPath.endsWith(hostSeparator) ? workPath : workPath + hostSeparator;
    }

    /**
     * Submit the discovery program and remember the answer in the session.
     */
    public static WorkspacePaths discover(CodeSubmitter submitter, SessionManager session) throws BrokerException {
        SubmitResult result = submitter.submit(DISCOVERY_PROGRAM, OutputFormat.TEXT);
        WorkspacePaths paths = parse(result.getLog());
        session.setWorkspacePaths(paths);
        return paths;
    }

    static WorkspacePaths parse(String log) throws BrokerException {
        String workPath = LogScanner.valueOf(log, "WORKPATH=");
        String sysscp = LogScanner.valueOf(log, "SYSSCP=");
        if (workPath == null || workPath.isEmpty()) {
            throw new BrokerException("Could not determine the WORK path of the workspace");
        }
        String separator = sysscp != null && sysscp.toUpperCase().startsWith("WIN") ? "\\" : "/";
        return new WorkspacePaths(workPath, separator);
    }

    /**
     * WORK directory, always ending with the host separator.
     */
    public String getWorkPath() {
        return workPath;
    }

    public String getHostSeparator() {
        return hostSeparator;
    }

    public String resolve(String fileName) {
        return workPath + fileName;
    }

    /**
     * Last path element of a server path.
     */
    public String baseName(String remotePath) {
        int idx = remotePath.lastIndexOf(hostSeparator);
        return idx < 0 ? remotePath : remotePath.substring(idx + hostSeparator.length());
    }

    @Override
    public String toString() {
        return "WorkspacePaths{workPath='" + workPath + "', hostSeparator='" + hostSeparator + "'}";
    }
}
