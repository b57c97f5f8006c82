package org.iomclient.cli;

import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;

import lombok.extern.log4j.Log4j2;
import org.iomclient.manager.util.ListingFixup;

@Log4j2
public class OptionsFile {

    private static final String LISTING_FIXUP_PREFIX = "listing.fixup.";
    private static final String FIND_SUFFIX = ".find";
    private static final String REPLACE_SUFFIX = ".replace";

    private final Properties properties;

    public OptionsFile(String optionsFilePath) throws IOException {
        this.properties = new Properties();
        loadProperties(optionsFilePath);
    }

    OptionsFile(Properties properties) {
        this.properties = properties;
        resolvePropertiesEnvVar();
    }

    public Properties getProperties() {
        return properties;
    }

    private void loadProperties(String optionsFilePath) throws IOException {

        try (FileReader in = new FileReader(optionsFilePath, StandardCharsets.UTF_8)) {
            this.properties.load(in);
            resolvePropertiesEnvVar();
        } catch (IOException e) {
            log.error("Could not read options file {}", optionsFilePath, e);
            throw e;
        }
    }

    /**
     * Listing fix-up rules declared as {@code listing.fixup.<n>.find} /
     * {@code listing.fixup.<n>.replace} pairs, in ascending order of {@code n}.
     * Escapes such as {@code \f} are already decoded by the properties format.
     *
     * @return the declared rules, empty when the file declares none
     */
    public List<ListingFixup> getListingFixups() {
        TreeSet<Integer> indexes = new TreeSet<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(LISTING_FIXUP_PREFIX) && key.endsWith(FIND_SUFFIX)) {
                String index = key.substring(LISTING_FIXUP_PREFIX.length(), key.length() - FIND_SUFFIX.length());
                try {
                    indexes.add(Integer.parseInt(index));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid listing fix-up key: " + key, e);
                }
            }
        }

        List<ListingFixup> fixups = new ArrayList<>();
        for (Integer index : indexes) {
            String find = properties.getProperty(LISTING_FIXUP_PREFIX + index + FIND_SUFFIX);
            String replace = properties.getProperty(LISTING_FIXUP_PREFIX + index + REPLACE_SUFFIX, "");
            fixups.add(new ListingFixup(find, replace));
        }
        return fixups;
    }

    private void resolvePropertiesEnvVar() {
        Enumeration<?> propertyNames = this.properties.propertyNames();
        while (propertyNames.hasMoreElements()) {
            String name = propertyNames.nextElement().toString();
            String value = this.properties.getProperty(name);

            if (value != null && !value.isEmpty())
                this.properties.setProperty(name, EnvironmentVariableEvaluator.resolveEnvVars(value));

        }
    }
}
