package org.iomclient;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import lombok.extern.log4j.Log4j2;
import org.iomclient.broker.BrokerException;
import org.iomclient.broker.ObjectBroker;
import org.iomclient.cli.OutputFormat;
import org.iomclient.cli.SessionOptions;
import org.iomclient.data.DataFrame;
import org.iomclient.data.MacroPrompter;
import org.iomclient.data.SubmitResult;
import org.iomclient.data.TabularResult;
import org.iomclient.data.TransferResult;
import org.iomclient.manager.CodeSubmitter;
import org.iomclient.manager.CsvPrograms;
import org.iomclient.manager.FileTransferManager;
import org.iomclient.manager.FrameWriter;
import org.iomclient.manager.RemoteFileInfo;
import org.iomclient.manager.SchemaResolver;
import org.iomclient.manager.SessionManager;
import org.iomclient.manager.SubmittedRemoteFileInfo;
import org.iomclient.manager.TableReader;
import org.iomclient.manager.WorkspacePaths;
import org.iomclient.manager.util.ColumnDescriptor;
import org.iomclient.manager.util.DatasetOptions;
import org.iomclient.manager.util.ExportOptions;
import org.iomclient.manager.util.ImportOptions;

/**
 * One session against a remote workspace. The session is opened by the
 * constructor and released by {@link #close()}:
 *
 * <pre>
 * try (IomClient client = new IomClient(options)) {
 *     SubmitResult result = client.submit("proc print data=sashelp.class; run;");
 * }
 * </pre>
 *
 * Calls are sequential; an instance must not be shared between threads.
 */
@Log4j2
public class IomClient implements AutoCloseable {

    private final SessionManager session;
    private final CodeSubmitter submitter;
    private final SchemaResolver schemaResolver;
    private final TableReader tableReader;
    private final FrameWriter frameWriter;
    private final FileTransferManager fileTransfer;

    /**
     * Open a session with the broker implementation named in {@code broker.impl}
     * and no macro prompter.
     */
    public IomClient(SessionOptions options) throws BrokerException {
        this(options, SessionManager.loadBroker(options.getBrokerImpl()), null, null);
    }

    public IomClient(SessionOptions options, ObjectBroker broker, MacroPrompter prompter) throws BrokerException {
        this(options, broker, prompter, null);
    }

    /**
     * @param fileInfo file-info collaborator used by transfers, null for the
     *                 default that asks the server with a data step
     */
    public IomClient(SessionOptions options, ObjectBroker broker, MacroPrompter prompter, RemoteFileInfo fileInfo)
            throws BrokerException {
        this.session = new SessionManager(options, broker);
        this.submitter = new CodeSubmitter(session, prompter);
        this.schemaResolver = new SchemaResolver(session);
        this.tableReader = new TableReader(session, submitter, schemaResolver);
        this.frameWriter = new FrameWriter(session);
        this.fileTransfer = new FileTransferManager(session,
                fileInfo != null ? fileInfo : new SubmittedRemoteFileInfo(submitter));

        session.open();
        try {
            WorkspacePaths paths = WorkspacePaths.discover(submitter, session);
            log.debug("Workspace paths: {}", paths);
        } catch (BrokerException | RuntimeException e) {
            log.error("Could not initialize the session: {}", e.getMessage());
            try {
                session.close();
            } catch (BrokerException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    public String getSessionId() throws BrokerException {
        return session.getSessionId();
    }

    public SessionManager.State getState() {
        return session.getState();
    }

    public WorkspacePaths getWorkspacePaths() {
        return session.getWorkspacePaths();
    }

    /*
     * Code submission
     */

    public SubmitResult submit(String code) throws BrokerException {
        return submit(code, OutputFormat.HTML);
    }

    public SubmitResult submit(String code, OutputFormat format) throws BrokerException {
        return submitter.submit(code, format);
    }

    /**
     * @param prompts macro variables to prompt for, name to hide-input flag
     */
    public SubmitResult submit(String code, OutputFormat format, Map<String, Boolean> prompts) throws BrokerException {
        return submitter.submit(code, format, prompts);
    }

    public void submitAsync(String code, OutputFormat format) throws BrokerException {
        submitter.submitAsync(code, format);
    }

    /**
     * Every log drained since the session was opened.
     */
    public String sessionLog() {
        return session.getSessionLog();
    }

    /*
     * Tables
     */

    public boolean exist(String table) throws BrokerException {
        return exist(table, null);
    }

    public boolean exist(String table, String libref) throws BrokerException {
        return schemaResolver.exists(table, libref);
    }

    public Map<String, ColumnDescriptor> schema(String table, String libref) throws BrokerException {
        return schemaResolver.resolve(table, libref);
    }

    public TabularResult read(String table) throws BrokerException {
        return read(table, null, null);
    }

    public TabularResult read(String table, String libref, DatasetOptions dsOptions) throws BrokerException {
        return tableReader.read(table, libref, dsOptions);
    }

    public TabularResult readCsv(String table) throws BrokerException, IOException {
        return readCsv(table, null, null, null);
    }

    /**
     * @param keepCopy local file to keep the transferred CSV text in, or null
     */
    public TabularResult readCsv(String table, String libref, DatasetOptions dsOptions, Path keepCopy)
            throws BrokerException, IOException {
        return tableReader.readCsv(table, libref, dsOptions, keepCopy);
    }

    public void write(DataFrame frame, String table) throws BrokerException {
        write(frame, table, null);
    }

    public void write(DataFrame frame, String table, String libref) throws BrokerException {
        frameWriter.write(frame, table, libref);
    }

    /*
     * CSV files on the server
     */

    public SubmitResult importCsv(String source, String table) throws BrokerException {
        return importCsv(source, table, null, null);
    }

    public SubmitResult importCsv(String source, String table, String libref, ImportOptions options)
            throws BrokerException {
        return submitter.submit(importCsvCode(source, table, libref, options), OutputFormat.TEXT);
    }

    /**
     * Program text {@link #importCsv} would submit.
     */
    public String importCsvCode(String source, String table, String libref, ImportOptions options) {
        return CsvPrograms.importProgram(source, table, libref, options);
    }

    public SubmitResult exportCsv(String table, String target) throws BrokerException {
        return exportCsv(table, null, target, null, null);
    }

    public SubmitResult exportCsv(String table, String libref, String target, DatasetOptions dsOptions,
                                  ExportOptions options) throws BrokerException {
        return submitter.submit(exportCsvCode(table, libref, target, dsOptions, options), OutputFormat.TEXT);
    }

    /**
     * Program text {@link #exportCsv} would submit.
     */
    public String exportCsvCode(String table, String libref, String target, DatasetOptions dsOptions,
                                ExportOptions options) {
        return CsvPrograms.exportProgram(target, table, libref, dsOptions, options);
    }

    /*
     * Files
     */

    public TransferResult upload(File localFile, String remotePath) throws BrokerException, IOException {
        return upload(localFile, remotePath, true, "");
    }

    public TransferResult upload(File localFile, String remotePath, boolean overwrite, String permission)
            throws BrokerException, IOException {
        return fileTransfer.upload(localFile, remotePath, overwrite, permission);
    }

    public TransferResult download(File localFile, String remotePath) throws BrokerException, IOException {
        return download(localFile, remotePath, true);
    }

    public TransferResult download(File localFile, String remotePath, boolean overwrite)
            throws BrokerException, IOException {
        return fileTransfer.download(localFile, remotePath, overwrite);
    }

    @Override
    public void close() throws BrokerException {
        session.close();
    }
}
