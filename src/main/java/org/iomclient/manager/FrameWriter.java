package org.iomclient.manager;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.iomclient.broker.BrokerException;
import org.iomclient.data.DataFrame;
import org.iomclient.manager.util.ColumnCodec;
import org.iomclient.manager.util.TablePath;

/**
 * Writes a local {@link DataFrame} into a new remote table with one
 * {@code create table} and one bulk {@code insert} statement.
 */
public class FrameWriter {

    private static final Logger LOG = LogManager.getLogger(FrameWriter.class.getName());

    private final SessionManager session;

    public FrameWriter(SessionManager session) {
        this.session = session;
    }

    public void write(DataFrame frame, String table, String libref) throws BrokerException {
        if (frame.getColumns().isEmpty()) {
            throw new IllegalArgumentException("Cannot create table " + table + " from a frame without columns");
        }
        String tablePath = TablePath.of(table, libref);
        List<ColumnCodec> codecs = codecs(frame);

        // both statements are rendered first so a rejected value creates nothing
        String create = createStatement(frame, tablePath, codecs);
        String insert = frame.getRowCount() == 0 ? null : insertStatement(frame, tablePath, codecs);
        LOG.debug("Create statement: {}", create);
        session.execute(create);

        if (insert == null) {
            LOG.info("Created empty table {}", tablePath);
            return;
        }

        LOG.debug("Insert statement with {} rows", frame.getRowCount());
        session.execute(insert);
        LOG.info("Wrote {} rows to {}", frame.getRowCount(), tablePath);
    }

    static List<ColumnCodec> codecs(DataFrame frame) {
        List<ColumnCodec> codecs = new ArrayList<>(frame.getColumns().size());
        for (DataFrame.Column column : frame.getColumns()) {
            codecs.add(ColumnCodec.forKind(column.getKind()));
        }
        return codecs;
    }

    static String createStatement(DataFrame frame, String tablePath, List<ColumnCodec> codecs) {
        StringBuilder sql = new StringBuilder("create table ").append(tablePath).append(" (");
        List<DataFrame.Column> columns = frame.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sql.append(", ");
            sql.append(codecs.get(i).definition(columns.get(i)));
        }
        return sql.append(")").toString();
    }

    static String insertStatement(DataFrame frame, String tablePath, List<ColumnCodec> codecs) {
        StringBuilder sql = new StringBuilder("insert into ").append(tablePath);
        List<DataFrame.Column> columns = frame.getColumns();
        for (int row = 0; row < frame.getRowCount(); row++) {
            // every row tuple carries its own values keyword
            sql.append(row == 0 ? " " : "\n").append("values(");
            for (int col = 0; col < columns.size(); col++) {
                if (col > 0) sql.append(", ");
                sql.append(codecs.get(col).literal(columns.get(col).getValues().get(row)));
            }
            sql.append(')');
        }
        return sql.toString();
    }
}
