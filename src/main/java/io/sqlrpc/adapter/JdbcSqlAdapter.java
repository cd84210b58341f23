package io.sqlrpc.adapter;

import io.sqlrpc.model.ResultTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

public final class JdbcSqlAdapter implements SqlAdapter {
    private static final Logger LOG = LogManager.getLogger(JdbcSqlAdapter.class);

    private final ConnectionProfile profile;
    private Connection connection;

    public JdbcSqlAdapter(ConnectionProfile profile) {
        this.profile = profile;
    }

    private Connection connection() throws DatabaseException {
        if (connection != null) {
            return connection;
        }
        LOG.debug("Opening a new connection to {}", profile.adapterType());
        try {
            connection = profile.user() == null
                    ? DriverManager.getConnection(profile.url())
                    : DriverManager.getConnection(profile.url(), profile.user(), profile.password());
            return connection;
        } catch (SQLException e) {
            throw new DatabaseException("Could not connect to " + profile.adapterType() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ResultTable execute(String sql, String nodeName, boolean fetch) throws DatabaseException {
        LOG.debug("On {}: {}", nodeName, sql);
        long startedNs = System.nanoTime();
        try (Statement st = connection().createStatement()) {
            boolean hasResultSet = st.execute(sql);
            ResultTable table = new ResultTable(List.of(), List.of());
            if (hasResultSet && fetch) {
                try (ResultSet rs = st.getResultSet()) {
                    table = readTable(rs);
                }
            }
            LOG.debug("SQL status: OK in {} seconds", String.format("%.2f", (System.nanoTime() - startedNs) / 1_000_000_000.0d));
            return table;
        } catch (SQLException e) {
            LOG.debug("Database error on {}: {}", nodeName, e.getMessage());
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public void dropRelation(String relation) throws DatabaseException {
        try (Statement st = connection().createStatement()) {
            LOG.debug("On drop: drop view if exists {}", relation);
            try {
                st.execute("drop view if exists " + relation);
                return;
            } catch (SQLException notAView) {
                LOG.debug("{} is not a view ({}), dropping it as a table", relation, notAView.getMessage());
            }
            st.execute("drop table if exists " + relation);
        } catch (SQLException e) {
            throw new DatabaseException(e.getMessage(), e);
        }
    }

    @Override
    public void loadTable(String relation, List<String> columns, List<String> columnTypes, List<List<Object>> rows)
            throws DatabaseException {
        if (columns.isEmpty()) {
            throw new DatabaseException("Cannot create " + relation + " without columns");
        }
        StringBuilder create = new StringBuilder("create table ").append(relation).append(" (");
        StringBuilder placeholders = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                create.append(", ");
                placeholders.append(", ");
            }
            create.append(quote(columns.get(i))).append(' ').append(columnTypes.get(i));
            placeholders.append('?');
        }
        create.append(')');
        String insert = "insert into " + relation + " values (" + placeholders + ")";
        Connection conn = connection();
        try {
            conn.setAutoCommit(false);
            dropRelation(relation);
            try (Statement st = conn.createStatement()) {
                LOG.debug("On seed: {}", create);
                st.execute(create.toString());
            }
            try (PreparedStatement ps = conn.prepareStatement(insert)) {
                for (List<Object> row : rows) {
                    for (int i = 0; i < columns.size(); i++) {
                        ps.setObject(i + 1, i < row.size() ? row.get(i) : null);
                    }
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            conn.commit();
            LOG.debug("Inserted {} rows into {}", rows.size(), relation);
        } catch (SQLException e) {
            rollbackQuietly(conn, e);
            throw new DatabaseException(e.getMessage(), e);
        } catch (DatabaseException e) {
            rollbackQuietly(conn, e);
            throw e;
        } finally {
            try {
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                LOG.warn("Failed to restore autocommit: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close connection: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }

    private static ResultTable readTable(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }
        return new ResultTable(columns, rows);
    }

    private static void rollbackQuietly(Connection conn, Exception original) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            original.addSuppressed(e);
        }
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
