package io.github.yok.hirelink.db;

import io.github.yok.hirelink.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.SQLException;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;

/**
 * Database-dialect behavior needed by {@link StoreSession}.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler {

    /**
     * Applies dialect-specific initialization to JDBC connection.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if session initialization fails
     */
    void prepareConnection(Connection connection) throws SQLException;

    /**
     * Resolves schema name for the configured connection.
     *
     * @param config connection settings
     * @return schema name handled by the dialect
     */
    String resolveSchema(ConnectionConfig config);

    /**
     * Creates a DBUnit connection configured for the dialect.
     *
     * @param connection JDBC connection
     * @param schema resolved schema name
     * @return initialized DBUnit connection
     * @throws DatabaseUnitException if DBUnit rejects the connection or schema
     */
    DatabaseConnection createDbUnitConnection(Connection connection, String schema)
            throws DatabaseUnitException;

    /**
     * Returns DBUnit datatype factory for the dialect.
     *
     * @return DBUnit datatype factory
     */
    IDataTypeFactory getDataTypeFactory();

    /**
     * Returns the statement that removes every row of a table and resets its identity sequence.
     *
     * @param table table name
     * @return truncate statement
     */
    String truncateSql(String table);
}
