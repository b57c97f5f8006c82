package org.iomclient.manager;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.iomclient.broker.BinaryStream;
import org.iomclient.broker.BrokerConnection;
import org.iomclient.broker.BrokerException;
import org.iomclient.broker.FileService;
import org.iomclient.broker.Fileref;
import org.iomclient.broker.LanguageService;
import org.iomclient.broker.ObjectBroker;
import org.iomclient.broker.ObjectFactory;
import org.iomclient.broker.ObjectKeeper;
import org.iomclient.broker.Protocol;
import org.iomclient.broker.RecordCursor;
import org.iomclient.broker.RecordSetOptions;
import org.iomclient.broker.ServerDefinition;
import org.iomclient.broker.StreamMode;
import org.iomclient.broker.Workspace;
import org.iomclient.cli.SessionOptions;
import org.iomclient.manager.util.StreamPump;

/**
 * Owns the workspace, the object keeper and the data connection of one
 * session. Every other component reaches the broker through the delegating
 * methods of this class and never keeps a broker handle of its own.
 *
 * <p>Lifecycle: {@code UNOPENED -> OPEN -> (ERROR <-> OPEN) -> CLOSED}.</p>
 */
public class SessionManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SessionManager.class.getName());

    public enum State {
        UNOPENED, OPEN, ERROR, CLOSED
    }

    static final String LOGICAL_SERVER_NAME = "SASApp";
    static final String WORKSPACE_OBJECT_NAME = "WorkspaceObject";
    static final String LOCAL_HOST = "127.0.0.1";
    private static final int WORKSPACE_OBJECT_TYPE = 1;
    private static final String DISK_ENGINE = "DISK";

    private final SessionOptions options;
    private final ObjectBroker broker;

    private Workspace workspace;
    private ObjectKeeper keeper;
    private BrokerConnection connection;
    private WorkspacePaths workspacePaths;
    private State state = State.UNOPENED;

    // append only, every log drained during the session
    private final StringBuilder sessionLog = new StringBuilder();

    public SessionManager(SessionOptions options, ObjectBroker broker) {
        this.options = options;
        this.broker = broker;
    }

    /**
     * Instantiate the broker implementation named in the options.
     */
    public static ObjectBroker loadBroker(String brokerClass) {
        if (brokerClass == null || brokerClass.isEmpty()) {
            throw new IllegalArgumentException("Broker implementation class is not defined in '"
                    + SessionOptions.BROKER_IMPL + "'");
        }
        try {
            Class<?> clazz = Class.forName(brokerClass);
            return (ObjectBroker) clazz.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new IllegalArgumentException("Could not load broker class: " + brokerClass, e);
        }
    }

    /**
     * Create a workspace and open the data connection against it.
     *
     * @return the workspace identifier. If a workspace is already live it is
     * returned unchanged and nothing is created.
     * @throws BrokerException if the broker cannot create the workspace or
     *                         open the connection. Not retried.
     */
    public String open() throws BrokerException {
        if (isOpen()) {
            return workspace.getUniqueIdentifier();
        }
        if (state == State.CLOSED) {
            throw new IllegalStateException("Session is closed");
        }

        ServerDefinition server = new ServerDefinition();
        String user;
        String password;

        if (!options.isRemote()) {
            server.setMachineDnsName(LOCAL_HOST);
            server.setPort(0);
            server.setProtocol(Protocol.COM);
            user = null;
            password = null;
            LOG.info("Creating local workspace");
        } else {
            if (options.getPort() == null || options.getClassId() == null) {
                throw new IllegalArgumentException("A remote workspace needs host, port and class.id. Got host="
                        + options.getHost() + " port=" + options.getPort() + " class.id=" + options.getClassId());
            }
            server.setMachineDnsName(options.getHost());
            server.setPort(options.getPort());
            server.setProtocol(Protocol.IOM);
            server.setClassIdentifier(options.getClassId());
            user = options.getUser();
            password = options.getPassword();
            LOG.info("Creating remote workspace on {}:{}", options.getHost(), options.getPort());
        }

        ObjectFactory factory = broker.createObjectFactory();
        ObjectKeeper newKeeper = broker.createObjectKeeper();
        BrokerConnection newConnection = broker.createConnection();

        Workspace newWorkspace = factory.createObjectByServer(LOGICAL_SERVER_NAME, true, server, user, password);
        boolean registered = false;
        String id;
        try {
            id = newWorkspace.getUniqueIdentifier();
            newKeeper.addObject(WORKSPACE_OBJECT_TYPE, WORKSPACE_OBJECT_NAME, newWorkspace);
            registered = true;
            newConnection.open("Provider=" + options.getProvider() + "; Data Source=iom-id://" + id);
        } catch (BrokerException | RuntimeException e) {
            LOG.error("Could not open the workspace: {}", e.getMessage());
            release(newWorkspace, registered ? newKeeper : null, newConnection, e);
            throw e;
        }

        this.workspace = newWorkspace;
        this.keeper = newKeeper;
        this.connection = newConnection;
        options.freeze();
        this.state = State.OPEN;
        LOG.info("Workspace {} opened", id);
        return id;
    }

    public boolean isOpen() {
        return state == State.OPEN || state == State.ERROR;
    }

    public State getState() {
        return state;
    }

    public SessionOptions getOptions() {
        return options;
    }

    public String getSessionId() throws BrokerException {
        return requireWorkspace().getUniqueIdentifier();
    }

    public WorkspacePaths getWorkspacePaths() {
        if (workspacePaths == null) {
            throw new IllegalStateException("Workspace paths have not been discovered yet");
        }
        return workspacePaths;
    }

    void setWorkspacePaths(WorkspacePaths workspacePaths) {
        this.workspacePaths = workspacePaths;
    }

    /*
     * Program submission
     */

    void submit(String code) throws BrokerException {
        languageService().submit(code);
    }

    /**
     * Drain the pending log and append it to the session log.
     */
    String drainLog() throws BrokerException {
        LanguageService ls = languageService();
        String log = StreamPump.drainText(ls::flushLog, StreamPump.DEFAULT_BUFFER_SIZE);
        sessionLog.append(log);
        return log;
    }

    String drainListing() throws BrokerException {
        LanguageService ls = languageService();
        return StreamPump.drainText(ls::flushList, StreamPump.DEFAULT_BUFFER_SIZE);
    }

    /**
     * Return the token scanner to its initial state. Clears the error state.
     */
    void reset() throws BrokerException {
        languageService().reset();
        if (state == State.ERROR) {
            LOG.debug("Parser reset, leaving error state");
        }
        this.state = State.OPEN;
    }

    void markError() {
        if (isOpen()) {
            this.state = State.ERROR;
        }
    }

    public String getSessionLog() {
        return sessionLog.toString();
    }

    /*
     * Files
     */

    byte[] readFile(String path) throws BrokerException {
        FileService fileService = requireWorkspace().getFileService();
        Fileref fileref = fileService.assignFileref("outfile", DISK_ENGINE, path, "", "");
        try {
            BinaryStream stream = fileref.openBinaryStream(StreamMode.READ);
            try {
                // binary stream: no line length limit, text and images alike
                return StreamPump.drain(stream::read, StreamPump.DEFAULT_BUFFER_SIZE);
            } finally {
                stream.close();
            }
        } finally {
            fileService.deassignFileref(fileref.getFilerefName());
        }
    }

    void writeFile(String path, byte[] content, String filerefOptions) throws BrokerException {
        FileService fileService = requireWorkspace().getFileService();
        Fileref fileref = fileService.assignFileref("infile", DISK_ENGINE, path, filerefOptions, "");
        try {
            BinaryStream stream = fileref.openBinaryStream(StreamMode.WRITE);
            try {
                stream.write(content);
            } finally {
                stream.close();
            }
        } finally {
            fileService.deassignFileref(fileref.getFilerefName());
        }
    }

    /*
     * Data connection
     */

    RecordCursor openColumnsSchema(String tablePath) throws BrokerException {
        return requireConnection().openColumnsSchema(tablePath);
    }

    RecordCursor openRecordSet(String source, RecordSetOptions recordSetOptions) throws BrokerException {
        return requireConnection().openRecordSet(source, recordSetOptions);
    }

    void execute(String sql) throws BrokerException {
        requireConnection().execute(sql);
    }

    /**
     * Close the data connection, release the workspace from the keeper and
     * close the workspace, in that order. Safe to call more than once. Every
     * step is attempted; the first failure is rethrown after the others ran.
     */
    @Override
    public void close() throws BrokerException {
        if (state == State.CLOSED || workspace == null) {
            this.state = State.CLOSED;
            return;
        }

        BrokerException failure = null;

        try {
            if (connection.getState() == BrokerConnection.STATE_OPEN) {
                connection.close();
            }
        } catch (BrokerException e) {
            LOG.error("Error closing data connection: {}", e.getMessage(), e);
            failure = e;
        }

        try {
            keeper.removeObject(workspace);
        } catch (BrokerException e) {
            LOG.error("Error releasing workspace from object keeper: {}", e.getMessage(), e);
            failure = keep(failure, e);
        }

        try {
            workspace.close();
        } catch (BrokerException e) {
            LOG.error("Error closing workspace: {}", e.getMessage(), e);
            failure = keep(failure, e);
        }

        this.state = State.CLOSED;
        LOG.info("Session closed");

        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Undo a partly completed open. Failures are attached to {@code cause}.
     */
    private static void release(Workspace workspace, ObjectKeeper keeper, BrokerConnection connection,
                                Exception cause) {
        try {
            if (connection.getState() == BrokerConnection.STATE_OPEN) {
                connection.close();
            }
        } catch (BrokerException | RuntimeException e) {
            cause.addSuppressed(e);
        }
        if (keeper != null) {
            try {
                keeper.removeObject(workspace);
            } catch (BrokerException | RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
        try {
            workspace.close();
        } catch (BrokerException | RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private static BrokerException keep(BrokerException first, BrokerException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    private LanguageService languageService() throws BrokerException {
        return requireWorkspace().getLanguageService();
    }

    private Workspace requireWorkspace() {
        if (!isOpen()) {
            throw new IllegalStateException("Session is not open (state " + state + ")");
        }
        return workspace;
    }

    private BrokerConnection requireConnection() {
        requireWorkspace();
        return connection;
    }
}
