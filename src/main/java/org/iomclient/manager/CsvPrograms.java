package org.iomclient.manager;

import org.iomclient.manager.util.DatasetOptions;
import org.iomclient.manager.util.ExportOptions;
import org.iomclient.manager.util.ImportOptions;
import org.iomclient.manager.util.TablePath;

/**
 * Program text of CSV import and export steps between a server side file and
 * a table.
 */
public final class CsvPrograms {

    static final String FILEREF = "csv_file";

    private CsvPrograms() {
    }

    /**
     * @param source server path, or an http(s) URL the server can reach
     */
    public static String importProgram(String source, String table, String libref, ImportOptions options) {
        String access = source.toLowerCase().startsWith("http") ? "url " : "";
        return "filename " + FILEREF + " " + access + "\"" + quote(source) + "\";\n" +
                "proc import datafile=" + FILEREF + " out=" + TablePath.of(table, libref) + " dbms=csv replace;\n" +
                "    " + (options == null ? "" : options.render()) + "\n" +
                "run;\n";
    }

    public static String exportProgram(String target, String table, String libref, DatasetOptions dsOptions,
                                       ExportOptions options) {
        String dataset = TablePath.of(table, libref) + (dsOptions == null ? "" : dsOptions.renderOptions());
        return "filename " + FILEREF + " \"" + quote(target) + "\";\n" +
                "proc export data=" + dataset + " outfile=" + FILEREF + " dbms=csv replace;\n" +
                "    " + (options == null ? "" : options.render()) + "\n" +
                "run;\n";
    }

    private static String quote(String path) {
        return path.replace("\"", "\"\"");
    }
}
