package org.iomclient.manager;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.iomclient.broker.BrokerException;
import org.iomclient.broker.RecordCursor;
import org.iomclient.broker.RecordSetOptions;
import org.iomclient.cli.OutputFormat;
import org.iomclient.cli.SessionOptions;
import org.iomclient.data.SubmitResult;
import org.iomclient.data.TabularResult;
import org.iomclient.manager.util.ColumnCodec;
import org.iomclient.manager.util.ColumnDescriptor;
import org.iomclient.manager.util.DatasetOptions;
import org.iomclient.manager.util.FormatCatalog;
import org.iomclient.manager.util.TablePath;
import org.iomclient.manager.util.ValueConverter;

/**
 * Reads remote tables into a {@link TabularResult}, either by walking a
 * record set or by exporting the table to CSV in the work directory and
 * parsing the downloaded file.
 */
public class TableReader {

    private static final Logger LOG = LogManager.getLogger(TableReader.class.getName());

    static final String TARGET = "_iomclient_sd2df";
    static final String CSV_FILE = "_iomclient_sd2df.csv";

    private final SessionManager session;
    private final CodeSubmitter submitter;
    private final SchemaResolver schemaResolver;

    public TableReader(SessionManager session, CodeSubmitter submitter, SchemaResolver schemaResolver) {
        this.session = session;
        this.submitter = submitter;
        this.schemaResolver = schemaResolver;
    }

    /**
     * Read through a forward-only, read-only, table-direct record set.
     */
    public TabularResult read(String table, String libref, DatasetOptions dsOptions) throws BrokerException {
        materialize(table, libref, dsOptions);
        Map<String, ColumnDescriptor> metadata = schemaResolver.resolve(TARGET, null);

        SessionOptions options = session.getOptions();
        RecordSetOptions recordSetOptions = RecordSetOptions.builder()
                .cursorType(RecordSetOptions.CursorType.FORWARD_ONLY)
                .lockType(RecordSetOptions.LockType.READ_ONLY)
                .commandType(RecordSetOptions.CommandType.TABLE_DIRECT)
                .maximumOpenRows(options.getMaxOpenRows())
                .pageSize(options.getPageSize())
                .cacheSize(options.getCacheSize())
                .build();

        RecordCursor recordSet = session.openRecordSet(TARGET, recordSetOptions);
        try {
            List<String> header = recordSet.getFieldNames();
            ValueConverter[] converters = new ValueConverter[header.size()];
            for (int i = 0; i < header.size(); i++) {
                ColumnDescriptor column = metadata.get(header.get(i));
                converters[i] = column == null ? ValueConverter.IDENTITY : column.getConverter();
            }

            List<List<Object>> rows = new ArrayList<>();
            if (!(recordSet.isBof() && recordSet.isEof())) {
                recordSet.moveFirst();
            }
            while (!recordSet.isEof()) {
                List<Object> row = new ArrayList<>(header.size());
                for (int i = 0; i < header.size(); i++) {
                    row.add(converters[i].convert(recordSet.getValue(i)));
                }
                rows.add(row);
                recordSet.moveNext();
            }

            LOG.info("Read {} rows from {}", rows.size(), TablePath.of(table, libref));
            return new TabularResult(header, rows);
        } finally {
            recordSet.close();
        }
    }

    /**
     * Read through a CSV export. Date and datetime columns are exported in
     * ISO-8601 and parsed back into {@link LocalDate} and {@link LocalDateTime}.
     *
     * @param keepCopy local path to store the downloaded CSV text, or null
     */
    public TabularResult readCsv(String table, String libref, DatasetOptions dsOptions, Path keepCopy)
            throws BrokerException, IOException {
        materialize(table, libref, dsOptions);
        Map<String, ColumnDescriptor> metadata = schemaResolver.resolve(TARGET, null);

        String csvPath = session.getWorkspacePaths().resolve(CSV_FILE);
        String export = "data " + TARGET + ";\n" +
                "    set " + TARGET + ";\n" +
                "    " + exportFormats(metadata) + "\n" +
                "run;\n" +
                "proc export data=" + TARGET + "\n" +
                "    outfile=\"" + quote(csvPath) + "\"\n" +
                "    dbms=csv replace;\n" +
                "run;\n";
        requireClean(submitter.submit(export, OutputFormat.TEXT), table);

        byte[] content = session.readFile(csvPath);
        String text = new String(content, Charset.forName(session.getOptions().getEncoding()));

        if (keepCopy != null) {
            FileUtils.writeStringToFile(keepCopy.toFile(), text, Charset.forName(session.getOptions().getEncoding()));
            LOG.info("CSV copy written to {}", keepCopy);
        }

        TabularResult result = parseCsv(text, metadata);
        LOG.info("Read {} rows from {} through CSV", result.getRowCount(), TablePath.of(table, libref));
        return result;
    }

    /**
     * Copy the table into the intermediate work table with the data set
     * options applied.
     */
    private void materialize(String table, String libref, DatasetOptions dsOptions) throws BrokerException {
        String opts = dsOptions == null ? "" : dsOptions.render();
        String step = "data " + TARGET + ";\n" +
                "    set " + TablePath.of(table, libref) + opts + ";\n" +
                "run;\n";
        requireClean(submitter.submit(step, OutputFormat.TEXT), table);
    }

    private static void requireClean(SubmitResult result, String table) throws BrokerException {
        String error = LogScanner.firstError(result.getLog());
        if (error != null) {
            throw new BrokerException("Could not read table " + table + ": " + error);
        }
    }

    /**
     * Format statement covering every formatted column, with calendar columns
     * forced to the ISO-8601 formats.
     */
    static String exportFormats(Map<String, ColumnDescriptor> metadata) {
        StringBuilder formats = new StringBuilder();
        for (ColumnDescriptor column : metadata.values()) {
            String spec;
            if (column.isDate()) {
                spec = FormatCatalog.DEFAULT_DATE_NAME + FormatCatalog.DEFAULT_DATE_LENGTH + "."
                        + (FormatCatalog.DEFAULT_DATE_PRECISION > 0 ? FormatCatalog.DEFAULT_DATE_PRECISION : "");
            } else if (column.isDatetime()) {
                spec = FormatCatalog.DEFAULT_DATETIME_NAME + FormatCatalog.DEFAULT_DATETIME_LENGTH + "."
                        + FormatCatalog.DEFAULT_DATETIME_PRECISION;
            } else {
                spec = column.formatSpec();
            }
            if (!spec.isEmpty()) {
                formats.append(' ').append(ColumnCodec.quoteName(column.getColumnName())).append(' ').append(spec);
            }
        }
        return formats.length() == 0 ? "" : "format" + formats + ";";
    }

    static TabularResult parseCsv(String text, Map<String, ColumnDescriptor> metadata) throws IOException {
        Map<String, ColumnDescriptor> byName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        byName.putAll(metadata);

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .build();

        try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
            List<String> header = parser.getHeaderNames();
            ColumnDescriptor[] columns = new ColumnDescriptor[header.size()];
            for (int i = 0; i < header.size(); i++) {
                columns[i] = byName.get(header.get(i));
            }

            List<List<Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<Object> row = new ArrayList<>(header.size());
                for (int i = 0; i < header.size(); i++) {
                    row.add(parseCell(record.get(i), columns[i]));
                }
                rows.add(row);
            }
            return new TabularResult(header, rows);
        }
    }

    private static Object parseCell(String cell, ColumnDescriptor column) {
        if (cell == null || cell.isEmpty()) {
            return null;
        }
        if (column == null || column.getDataType() == ColumnDescriptor.DataType.CHARACTER) {
            return cell;
        }
        try {
            if (column.isDate()) {
                return LocalDate.parse(cell);
            }
            if (column.isDatetime()) {
                return LocalDateTime.parse(cell);
            }
        } catch (DateTimeParseException e) {
            LOG.debug("Column {} value '{}' is not ISO-8601, kept as text", column.getColumnName(), cell);
            return cell;
        }
        // missing numeric values are exported as a single period
        if (".".equals(cell)) {
            return null;
        }
        try {
            return Double.valueOf(cell.trim().toUpperCase(Locale.ROOT));
        } catch (NumberFormatException e) {
            return cell;
        }
    }

    private static String quote(String path) {
        return path.replace("\"", "\"\"");
    }
}
