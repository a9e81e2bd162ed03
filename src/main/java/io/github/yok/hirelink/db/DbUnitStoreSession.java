package io.github.yok.hirelink.db;

import io.github.yok.hirelink.model.Department;
import io.github.yok.hirelink.model.HireTimestamp;
import io.github.yok.hirelink.model.HiredEmployee;
import io.github.yok.hirelink.model.Job;
import io.github.yok.hirelink.model.WorkforceRow;
import io.github.yok.hirelink.model.WorkforceTable;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.dbunit.operation.DatabaseOperation;

/**
 * {@link StoreSession} backed by one JDBC connection and its DBUnit {@link DatabaseConnection}.
 *
 * <p>
 * Bulk inserts are executed as DBUnit {@code INSERT} operations over an in-memory
 * {@link DefaultTable}; reads go through DBUnit query tables or plain JDBC.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DbUnitStoreSession implements StoreSession {

    /**
     * Executes DBUnit operations. Replaceable in tests.
     */
    interface OperationExecutor {

        /**
         * Executes DBUnit INSERT.
         *
         * @param connection DBUnit connection
         * @param dataSet rows to insert
         * @throws DatabaseUnitException if DBUnit fails
         * @throws SQLException if the driver fails
         */
        void insert(IDatabaseConnection connection, IDataSet dataSet)
                throws DatabaseUnitException, SQLException;
    }

    // Underlying JDBC connection
    private final Connection jdbc;

    // DBUnit wrapper of the same connection
    private final DatabaseConnection dbConn;

    // Dialect that supplies the truncate statement
    private final DbDialectHandler dialectHandler;

    // DBUnit operation executor
    private final OperationExecutor operationExecutor;

    /**
     * Creates a session.
     *
     * @param jdbc JDBC connection
     * @param dbConn DBUnit connection wrapping {@code jdbc}
     * @param dialectHandler dialect handler
     */
    public DbUnitStoreSession(Connection jdbc, DatabaseConnection dbConn,
            DbDialectHandler dialectHandler) {
        this(jdbc, dbConn, dialectHandler, DatabaseOperation.INSERT::execute);
    }

    DbUnitStoreSession(Connection jdbc, DatabaseConnection dbConn,
            DbDialectHandler dialectHandler, OperationExecutor operationExecutor) {
        this.jdbc = jdbc;
        this.dbConn = dbConn;
        this.dialectHandler = dialectHandler;
        this.operationExecutor = operationExecutor;
    }

    @Override
    public void begin() throws SQLException {
        jdbc.setAutoCommit(false);
    }

    @Override
    public void commit() throws SQLException {
        jdbc.commit();
    }

    @Override
    public void rollback() throws SQLException {
        jdbc.rollback();
    }

    @Override
    public void bulkInsert(WorkforceTable table, List<? extends WorkforceRow> rows)
            throws SQLException {
        if (rows.isEmpty()) {
            return;
        }
        try {
            DefaultTable dataTable = new DefaultTable(WorkforceTableMetaData.of(table));
            for (WorkforceRow row : rows) {
                dataTable.addRow(row.toColumnValues());
            }
            operationExecutor.insert(dbConn, new DefaultDataSet(dataTable));
            log.debug("[{}] INSERT rows={}", table, rows.size());
        } catch (DatabaseUnitException e) {
            throw new SQLException("Bulk insert into " + table + " failed", e);
        }
    }

    @Override
    public void execute(String sql) throws SQLException {
        try (Statement st = jdbc.createStatement()) {
            st.execute(sql);
        }
    }

    @Override
    public Set<Integer> queryIds(WorkforceTable table) throws SQLException {
        Set<Integer> ids = new LinkedHashSet<>();
        try (Statement st = jdbc.createStatement();
                ResultSet rs = st.executeQuery("SELECT id FROM " + table.getTableName())) {
            while (rs.next()) {
                ids.add(rs.getInt(1));
            }
        }
        return ids;
    }

    @Override
    public List<WorkforceRow> queryAll(WorkforceTable table) throws SQLException {
        String sql = "SELECT " + String.join(", ", table.getColumns()) + " FROM "
                + table.getTableName() + " ORDER BY id";
        try {
            ITable result = dbConn.createQueryTable(table.getTableName(), sql);
            List<WorkforceRow> rows = new ArrayList<>(result.getRowCount());
            for (int i = 0; i < result.getRowCount(); i++) {
                rows.add(toRow(table, result, i));
            }
            return rows;
        } catch (DatabaseUnitException e) {
            throw new SQLException("Query on " + table + " failed", e);
        }
    }

    @Override
    public List<Object[]> queryRows(String sql, Object... params) throws SQLException {
        List<Object[]> rows = new ArrayList<>();
        try (PreparedStatement ps = jdbc.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                int columnCount = rs.getMetaData().getColumnCount();
                while (rs.next()) {
                    Object[] row = new Object[columnCount];
                    for (int c = 0; c < columnCount; c++) {
                        row[c] = rs.getObject(c + 1);
                    }
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    @Override
    public void truncate(WorkforceTable table) throws SQLException {
        String sql = dialectHandler.truncateSql(table.getTableName());
        log.debug("[{}] {}", table, sql);
        execute(sql);
    }

    @Override
    public void close() throws SQLException {
        try {
            if (!jdbc.isClosed() && !jdbc.getAutoCommit()) {
                jdbc.rollback();
            }
        } finally {
            jdbc.close();
        }
    }

    /**
     * Maps one query-table row to its typed row.
     */
    private WorkforceRow toRow(WorkforceTable table, ITable result, int row)
            throws DatabaseUnitException {
        int id = ((Number) result.getValue(row, "id")).intValue();
        String name = (String) result.getValue(row, "name");
        switch (table) {
            case DEPARTMENTS:
                return new Department(id, name);
            case JOBS:
                return new Job(id, name);
            default:
                return new HiredEmployee(id, name, toTimestamp(result.getValue(row, "datetime")),
                        toInteger(result.getValue(row, "department_id")),
                        toInteger(result.getValue(row, "job_id")));
        }
    }

    private static HireTimestamp toTimestamp(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp) {
            return HireTimestamp.of(((Timestamp) value).toLocalDateTime());
        }
        if (value instanceof LocalDateTime) {
            return HireTimestamp.of((LocalDateTime) value);
        }
        return HireTimestamp.fromText(value.toString());
    }

    private static Integer toInteger(Object value) {
        return (value == null) ? null : ((Number) value).intValue();
    }
}
