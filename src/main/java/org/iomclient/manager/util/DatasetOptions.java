package org.iomclient.manager.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filter, projection, row bounds and display formats applied when a table is
 * read. Renders to the engine's data set option syntax, for example
 * {@code (where=(msrp < 20000) keep=msrp horsepower obs=10)} followed by an
 * optional {@code format} statement.
 */
public class DatasetOptions {

    private final List<String> where = new ArrayList<>();
    private final List<String> keep = new ArrayList<>();
    private final List<String> drop = new ArrayList<>();
    private Long firstObs;
    private Long obs;
    private final Map<String, String> other = new LinkedHashMap<>();
    private final Map<String, String> formats = new LinkedHashMap<>();
    private String formatText;

    /**
     * Add row filters. Several clauses are combined with {@code and}.
     */
    public DatasetOptions where(String... clauses) {
        where.addAll(Arrays.asList(clauses));
        return this;
    }

    public DatasetOptions keep(String... columns) {
        keep.addAll(Arrays.asList(columns));
        return this;
    }

    public DatasetOptions drop(String... columns) {
        drop.addAll(Arrays.asList(columns));
        return this;
    }

    public DatasetOptions firstObs(long firstObs) {
        this.firstObs = firstObs;
        return this;
    }

    public DatasetOptions obs(long obs) {
        this.obs = obs;
        return this;
    }

    /**
     * Any other data set option, rendered as {@code key=value}.
     */
    public DatasetOptions option(String key, String value) {
        other.put(key, value);
        return this;
    }

    public DatasetOptions format(String column, String format) {
        formats.put(column, format);
        return this;
    }

    /**
     * Free text of a format statement, e.g. {@code msrp dollar10.2}.
     */
    public DatasetOptions format(String formatStatement) {
        this.formatText = formatStatement;
        return this;
    }

    /**
     * Options in parentheses, empty when none are set.
     */
    public String renderOptions() {
        StringBuilder opts = new StringBuilder();
        if (!where.isEmpty()) {
            opts.append("where=(").append(String.join(" and ", where)).append(") ");
        }
        if (!keep.isEmpty()) {
            opts.append("keep=").append(String.join(" ", keep)).append(' ');
        }
        if (!drop.isEmpty()) {
            opts.append("drop=").append(String.join(" ", drop)).append(' ');
        }
        if (firstObs != null) {
            opts.append("firstobs=").append(firstObs).append(' ');
        }
        if (obs != null) {
            opts.append("obs=").append(obs).append(' ');
        }
        for (Map.Entry<String, String> entry : other.entrySet()) {
            opts.append(entry.getKey()).append('=').append(entry.getValue()).append(' ');
        }

        if (opts.length() == 0) {
            return "";
        }
        return "(" + opts.toString().trim() + ")";
    }

    /**
     * The format statement, empty when no formats are set.
     */
    public String renderFormatStatement() {
        StringBuilder fmt = new StringBuilder();
        if (formatText != null && !formatText.isEmpty()) {
            fmt.append(formatText);
        }
        for (Map.Entry<String, String> entry : formats.entrySet()) {
            if (fmt.length() > 0) fmt.append(' ');
            fmt.append(entry.getKey()).append(' ').append(entry.getValue());
        }
        return fmt.length() == 0 ? "" : "format " + fmt + ";";
    }

    /**
     * Options and format statement as they follow a table name in a
     * {@code set} statement.
     */
    public String render() {
        String fmt = renderFormatStatement();
        return fmt.isEmpty() ? renderOptions() : renderOptions() + ";\n\t" + fmt;
    }

    public boolean isEmpty() {
        return render().isEmpty();
    }

    @Override
    public String toString() {
        return render();
    }
}
