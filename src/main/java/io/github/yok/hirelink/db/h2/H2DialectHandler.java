package io.github.yok.hirelink.db.h2;

import io.github.yok.hirelink.config.ConnectionConfig;
import io.github.yok.hirelink.db.DbDialectHandler;
import io.github.yok.hirelink.db.DbUnitConfigFactory;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.RequiredArgsConstructor;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;

/**
 * H2-specific implementation of {@link DbDialectHandler}.
 *
 * <p>
 * Used for embedded stores and tests. Unquoted identifiers live in the {@code PUBLIC} schema in
 * upper case.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class H2DialectHandler implements DbDialectHandler {

    // Factory that applies common DBUnit settings
    private final DbUnitConfigFactory configFactory;

    /**
     * Pins the session time zone to UTC.
     *
     * @param connection JDBC connection
     * @throws SQLException if the statement fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET TIME ZONE 'UTC'");
        }
    }

    @Override
    public String resolveSchema(ConnectionConfig config) {
        return "PUBLIC";
    }

    @Override
    public DatabaseConnection createDbUnitConnection(Connection jdbc, String schema)
            throws DatabaseUnitException {
        DatabaseConnection dbConn = new DatabaseConnection(jdbc, schema);
        configFactory.configure(dbConn.getConfig(), getDataTypeFactory());
        return dbConn;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return new H2DataTypeFactory();
    }

    @Override
    public String truncateSql(String table) {
        return "TRUNCATE TABLE " + table + " RESTART IDENTITY";
    }
}
