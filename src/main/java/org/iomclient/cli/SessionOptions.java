package org.iomclient.cli;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import lombok.Getter;
import lombok.ToString;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.iomclient.manager.util.ListingFixup;

/**
 * Connection and transfer settings of one session.
 *
 * <p>Values come from built-in defaults, then from an options file, then from
 * overrides. Overrides pass through {@link #override(String, String)}, which
 * honors them only while {@code lock.down} is false. The lock flag itself is
 * read from the options file and cannot be overridden.</p>
 */
@Getter
@ToString
@Log4j2
public class SessionOptions {

    public static final String HOST = "host";
    public static final String PORT = "port";
    public static final String USER = "user";
    public static final String PASSWORD = "password";
    public static final String CLASS_ID = "class.id";
    public static final String PROVIDER = "provider";
    public static final String ENCODING = "encoding";
    public static final String MAX_OPEN_ROWS = "max.open.rows";
    public static final String PAGE_SIZE = "page.size";
    public static final String CACHE_SIZE = "cache.size";
    public static final String OUTPUT = "output";
    public static final String HTML_STYLE = "html.style";
    public static final String BROKER_IMPL = "broker.impl";
    public static final String LOCK_DOWN = "lock.down";

    private static final String DEFAULT_PROVIDER = "sas.iomprovider";
    private static final String DEFAULT_ENCODING = "UTF-8";
    private static final int DEFAULT_MAX_OPEN_ROWS = 100;
    private static final int DEFAULT_PAGE_SIZE = 55;
    private static final int DEFAULT_CACHE_SIZE = 1;
    private static final String DEFAULT_OUTPUT = "html5";
    private static final String DEFAULT_HTML_STYLE = "HTMLBlue";

    private String host;
    private Integer port;
    private String user;
    @ToString.Exclude
    private String password;
    private String classId;
    private String provider = DEFAULT_PROVIDER;
    private String encoding = DEFAULT_ENCODING;
    private int maxOpenRows = DEFAULT_MAX_OPEN_ROWS;
    private int pageSize = DEFAULT_PAGE_SIZE;
    private int cacheSize = DEFAULT_CACHE_SIZE;
    private String output = DEFAULT_OUTPUT;
    private String htmlStyle = DEFAULT_HTML_STYLE;
    private String brokerImpl;
    private boolean lockDown = true;
    private List<ListingFixup> listingFixups = ListingFixup.defaults();

    @Getter(lombok.AccessLevel.NONE)
    @ToString.Exclude
    private boolean frozen = false;

    /**
     * Built-in defaults only. Locked, so overrides are rejected.
     */
    public SessionOptions() {
    }

    /**
     * Options as read from a configuration source.
     */
    public SessionOptions(Properties configuration) {
        applyConfiguration(new OptionsFile(configuration));
    }

    /**
     * Options given as command line style arguments. {@code --options-file}
     * loads the configuration, every other argument is an override.
     */
    public SessionOptions(String[] args) throws ParseException, IOException {
        checkOptions(args);
    }

    public static SessionOptions fromOptionsFile(String optionsFilePath) throws IOException {
        SessionOptions options = new SessionOptions();
        options.applyConfiguration(new OptionsFile(optionsFilePath));
        return options;
    }

    private void checkOptions(String[] args) throws ParseException, IOException {
        Options options = new Options();

        options.addOption(Option.builder().longOpt("options-file")
                .desc("Options file path location").hasArg().argName("file-path").build());
        options.addOption(Option.builder().longOpt("host")
                .desc("Remote IOM host. Omit for a local workspace").hasArg().argName("host").build());
        options.addOption(Option.builder().longOpt("port")
                .desc("Remote IOM port").hasArg().argName("port").build());
        options.addOption(Option.builder().longOpt("user")
                .desc("Remote IOM user name").hasArg().argName("username").build());
        options.addOption(Option.builder().longOpt("password")
                .desc("Remote IOM password").hasArg().argName("password").build());
        options.addOption(Option.builder().longOpt("class-id")
                .desc("Workspace server class identifier").hasArg().argName("class-id").build());
        options.addOption(Option.builder().longOpt("provider")
                .desc("Data provider used by the data connection").hasArg().argName("provider").build());
        options.addOption(Option.builder().longOpt("encoding")
                .desc("Server text encoding. Default UTF-8").hasArg().argName("charset").build());
        options.addOption(Option.builder().longOpt("max-open-rows")
                .desc("Server side row cache of record sets. Default 100").hasArg().argName("n").build());
        options.addOption(Option.builder().longOpt("page-size")
                .desc("Rows per download buffer of record sets. Default 55").hasArg().argName("n").build());
        options.addOption(Option.builder().longOpt("cache-size")
                .desc("Client side record cache. Default 1").hasArg().argName("n").build());
        options.addOption(Option.builder().longOpt("output")
                .desc("Output destination used for HTML results. Default html5").hasArg().argName("destination").build());
        options.addOption(Option.builder().longOpt("html-style")
                .desc("Style of HTML results. Default HTMLBlue").hasArg().argName("style").build());
        options.addOption(Option.builder().longOpt("broker-impl")
                .desc("Class name of the object broker implementation").hasArg().argName("class").build());

        CommandLineParser parser = new DefaultParser();
        CommandLine line = parser.parse(options, args);

        String optionsFile = line.getOptionValue("options-file");
        if (optionsFile != null && !optionsFile.isEmpty()) {
            applyConfiguration(new OptionsFile(optionsFile));
        }

        Map<String, String> overrides = new LinkedHashMap<>();
        putIfPresent(overrides, line, "host", HOST);
        putIfPresent(overrides, line, "port", PORT);
        putIfPresent(overrides, line, "user", USER);
        putIfPresent(overrides, line, "password", PASSWORD);
        putIfPresent(overrides, line, "class-id", CLASS_ID);
        putIfPresent(overrides, line, "provider", PROVIDER);
        putIfPresent(overrides, line, "encoding", ENCODING);
        putIfPresent(overrides, line, "max-open-rows", MAX_OPEN_ROWS);
        putIfPresent(overrides, line, "page-size", PAGE_SIZE);
        putIfPresent(overrides, line, "cache-size", CACHE_SIZE);
        putIfPresent(overrides, line, "output", OUTPUT);
        putIfPresent(overrides, line, "html-style", HTML_STYLE);
        putIfPresent(overrides, line, "broker-impl", BROKER_IMPL);
        applyOverrides(overrides);
    }

    private static void putIfPresent(Map<String, String> overrides, CommandLine line, String opt, String field) {
        String value = line.getOptionValue(opt);
        if (value != null && !value.isEmpty()) {
            overrides.put(field, value);
        }
    }

    private void applyConfiguration(OptionsFile optionsFile) {
        Properties prop = optionsFile.getProperties();
        for (String field : prop.stringPropertyNames()) {
            if (LOCK_DOWN.equals(field)) {
                this.lockDown = Boolean.parseBoolean(prop.getProperty(field));
            } else if (isKnownField(field)) {
                setField(field, prop.getProperty(field));
            } else if (!field.startsWith("listing.fixup.")) {
                log.warn("Unknown option '{}' in configuration was ignored", field);
            }
        }

        List<ListingFixup> fixups = optionsFile.getListingFixups();
        if (!fixups.isEmpty()) {
            this.listingFixups = fixups;
        }
    }

    /**
     * Apply every entry through {@link #override(String, String)}.
     */
    public void applyOverrides(Map<String, String> overrides) {
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            override(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Override one configuration field.
     *
     * @param field one of the field constants of this class
     * @param value new value in its textual form
     * @return true if the value was applied, false if the configuration is locked
     * @throws IllegalArgumentException if the field is unknown or not overridable
     * @throws IllegalStateException    if the options belong to an open session
     */
    public boolean override(String field, String value) {
        if (frozen) {
            throw new IllegalStateException("Options are read-only once the session is open");
        }
        if (LOCK_DOWN.equals(field)) {
            throw new IllegalArgumentException("Param '" + LOCK_DOWN + "' can only be set in the options file");
        }
        if (!isKnownField(field)) {
            throw new IllegalArgumentException("Unknown param '" + field + "'");
        }

        if (lockDown) {
            log.warn("Param '{}' was ignored due to configuration restriction", field);
            return false;
        }

        setField(field, value);
        return true;
    }

    /**
     * Mark these options as belonging to an open session. Later overrides fail.
     */
    public void freeze() {
        this.frozen = true;
    }

    public boolean isRemote() {
        return host != null && !host.isEmpty();
    }

    private static boolean isKnownField(String field) {
        switch (field) {
            case HOST:
            case PORT:
            case USER:
            case PASSWORD:
            case CLASS_ID:
            case PROVIDER:
            case ENCODING:
            case MAX_OPEN_ROWS:
            case PAGE_SIZE:
            case CACHE_SIZE:
            case OUTPUT:
            case HTML_STYLE:
            case BROKER_IMPL:
                return true;
            default:
                return false;
        }
    }

    private void setField(String field, String value) {
        switch (field) {
            case HOST:
                this.host = emptyToNull(value);
                break;
            case PORT:
                this.port = value == null || value.isEmpty() ? null : parsePositive(PORT, value);
                break;
            case USER:
                this.user = emptyToNull(value);
                break;
            case PASSWORD:
                this.password = emptyToNull(value);
                break;
            case CLASS_ID:
                this.classId = emptyToNull(value);
                break;
            case PROVIDER:
                this.provider = value;
                break;
            case ENCODING:
                this.encoding = value;
                break;
            case MAX_OPEN_ROWS:
                this.maxOpenRows = parsePositive(MAX_OPEN_ROWS, value);
                break;
            case PAGE_SIZE:
                this.pageSize = parsePositive(PAGE_SIZE, value);
                break;
            case CACHE_SIZE:
                this.cacheSize = parsePositive(CACHE_SIZE, value);
                break;
            case OUTPUT:
                this.output = value;
                break;
            case HTML_STYLE:
                this.htmlStyle = value;
                break;
            case BROKER_IMPL:
                this.brokerImpl = emptyToNull(value);
                break;
            default:
                throw new IllegalArgumentException("Unknown param '" + field + "'");
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static int parsePositive(String field, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) throw new NumberFormatException();
            return parsed;
        } catch (NumberFormatException | NullPointerException e) {
            log.error("Option {} must be a positive integer greater than 0.", field);
            throw new IllegalArgumentException("Option " + field + " must be a positive integer, got: " + value, e);
        }
    }

    public List<ListingFixup> getListingFixups() {
        return Collections.unmodifiableList(new ArrayList<>(listingFixups));
    }
}
