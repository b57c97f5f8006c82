package org.iomclient.broker.fake;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.iomclient.broker.BrokerException;
import org.iomclient.broker.RecordSetOptions;
import org.iomclient.broker.ServerDefinition;

/**
 * State of one fake remote engine: server files, tables, log and listing
 * buffers, and a record of what the client asked for. Shared by every broker
 * object a {@link FakeObjectBroker} hands out.
 */
public class FakeEngine {

    public static final String WORK_DIRECTORY = "/work";

    final Map<String, byte[]> files = new HashMap<>();
    final Set<String> directories = new HashSet<>();
    final Map<String, FakeTable> tables = new LinkedHashMap<>();
    final Map<String, String> macroVariables = new HashMap<>();
    final StringBuilder log = new StringBuilder();
    final StringBuilder listing = new StringBuilder();

    private final List<String> events = new ArrayList<>();
    private final Set<String> failures = new HashSet<>();
    private final List<String> submissions = new ArrayList<>();
    private final List<String> executedSql = new ArrayList<>();
    private final Map<String, String> fileOptions = new HashMap<>();

    private final FakeInterpreter interpreter = new FakeInterpreter(this);
    private final FakeSql sql = new FakeSql(this);

    String sysscp = "LIN X64";
    // upper bound of every flush and stream read, whatever size the client asks for
    int chunkLimit = 16;
    int resetCount;
    ServerDefinition lastServer;
    String lastUser;
    String lastPassword;
    String connectionString;
    RecordSetOptions lastRecordSetOptions;

    public FakeEngine() {
        directories.add("/");
        directories.add(WORK_DIRECTORY);
    }

    /*
     * Test setup
     */

    public FakeEngine putFile(String path, String content) {
        files.put(path, content.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public FakeEngine addDirectory(String path) {
        directories.add(stripSeparator(path));
        return this;
    }

    public FakeEngine putTable(String tablePath, FakeTable table) {
        tables.put(normalize(tablePath), table);
        return this;
    }

    public FakeEngine setSysscp(String sysscp) {
        this.sysscp = sysscp;
        return this;
    }

    public FakeEngine setChunkLimit(int chunkLimit) {
        this.chunkLimit = chunkLimit;
        return this;
    }

    /**
     * Make the broker call with this event name throw.
     */
    public FakeEngine failOn(String event) {
        failures.add(event);
        return this;
    }

    /*
     * Inspection
     */

    public byte[] getFile(String path) {
        return files.get(path);
    }

    public String getFileText(String path) {
        byte[] content = files.get(path);
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    public FakeTable getTable(String tablePath) {
        return tables.get(normalize(tablePath));
    }

    public boolean hasTable(String tablePath) {
        return tables.containsKey(normalize(tablePath));
    }

    public List<String> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<String> getSubmissions() {
        return Collections.unmodifiableList(submissions);
    }

    public String lastSubmission() {
        return submissions.isEmpty() ? null : submissions.get(submissions.size() - 1);
    }

    public List<String> getExecutedSql() {
        return Collections.unmodifiableList(executedSql);
    }

    public String getFileOptions(String path) {
        return fileOptions.get(path);
    }

    public int getResetCount() {
        return resetCount;
    }

    public boolean isParserStuck() {
        return interpreter.isStuck();
    }

    public ServerDefinition getLastServer() {
        return lastServer;
    }

    public String getLastUser() {
        return lastUser;
    }

    public String getLastPassword() {
        return lastPassword;
    }

    public String getConnectionString() {
        return connectionString;
    }

    public RecordSetOptions getLastRecordSetOptions() {
        return lastRecordSetOptions;
    }

    public String getMacroVariable(String name) {
        return macroVariables.get(name.toUpperCase(Locale.ROOT));
    }

    /*
     * Used by the broker objects
     */

    void event(String name) throws BrokerException {
        events.add(name);
        if (failures.contains(name)) {
            throw new BrokerException("Injected failure: " + name);
        }
    }

    void submit(String code) {
        submissions.add(code);
        interpreter.run(code);
    }

    void reset() {
        resetCount++;
        interpreter.reset();
    }

    void execute(String statement) throws BrokerException {
        executedSql.add(statement);
        sql.execute(statement);
    }

    void writeFile(String path, byte[] content, String options) {
        files.put(path, content);
        fileOptions.put(path, options);
    }

    String take(StringBuilder buffer, int maxChars) {
        int n = Math.min(Math.min(maxChars, chunkLimit), buffer.length());
        String chunk = buffer.substring(0, n);
        buffer.delete(0, n);
        return chunk;
    }

    void log(String line) {
        log.append(line).append('\n');
    }

    boolean isDirectory(String path) {
        return directories.contains(stripSeparator(path));
    }

    static String normalize(String tablePath) {
        String upper = tablePath.trim().toUpperCase(Locale.ROOT);
        return upper.contains(".") ? upper : "WORK." + upper;
    }

    private static String stripSeparator(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
