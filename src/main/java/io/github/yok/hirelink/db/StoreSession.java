package io.github.yok.hirelink.db;

import io.github.yok.hirelink.model.WorkforceRow;
import io.github.yok.hirelink.model.WorkforceTable;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;

/**
 * One unit of work against the relational store, bound to a single JDBC connection.
 *
 * <p>
 * A session is acquired at the start of a request and closed at its end. It is never shared
 * between units of work. Until {@link #begin()} is called the connection runs in auto-commit
 * mode.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface StoreSession extends AutoCloseable {

    /**
     * Starts a transaction by switching auto-commit off.
     *
     * @throws SQLException if the connection rejects the change
     */
    void begin() throws SQLException;

    /**
     * Commits the current transaction.
     *
     * @throws SQLException if the commit fails
     */
    void commit() throws SQLException;

    /**
     * Rolls back the current transaction.
     *
     * @throws SQLException if the rollback fails
     */
    void rollback() throws SQLException;

    /**
     * Inserts typed rows into one table as a single DBUnit {@code INSERT} operation.
     *
     * @param table target table
     * @param rows rows of that table; an empty list is a no-op
     * @throws SQLException if the insert fails; the driver's exception is kept in the cause chain
     */
    void bulkInsert(WorkforceTable table, List<? extends WorkforceRow> rows) throws SQLException;

    /**
     * Executes a raw statement.
     *
     * @param sql statement
     * @throws SQLException if execution fails
     */
    void execute(String sql) throws SQLException;

    /**
     * Returns the ids currently stored in a table.
     *
     * @param table table to scan
     * @return id set
     * @throws SQLException if the query fails
     */
    Set<Integer> queryIds(WorkforceTable table) throws SQLException;

    /**
     * Reads all rows of a table, ordered by id. Only the table's known columns are selected.
     *
     * @param table table to read
     * @return typed rows
     * @throws SQLException if the query fails
     */
    List<WorkforceRow> queryAll(WorkforceTable table) throws SQLException;

    /**
     * Runs a read-only query and returns each row as an array of column values.
     *
     * @param sql query with {@code ?} placeholders
     * @param params placeholder values
     * @return result rows
     * @throws SQLException if the query fails
     */
    List<Object[]> queryRows(String sql, Object... params) throws SQLException;

    /**
     * Removes every row of a table and resets its identity sequence.
     *
     * @param table table to truncate
     * @throws SQLException if the statement fails
     */
    void truncate(WorkforceTable table) throws SQLException;

    /**
     * Releases the connection. Uncommitted work is rolled back.
     *
     * @throws SQLException if closing fails
     */
    @Override
    void close() throws SQLException;
}
