package io.github.yok.hirelink.db.mysql;

import io.github.yok.hirelink.config.ConnectionConfig;
import io.github.yok.hirelink.db.DbDialectHandler;
import io.github.yok.hirelink.db.DbUnitConfigFactory;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.RequiredArgsConstructor;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.mysql.MySqlMetadataHandler;

/**
 * MySQL-specific implementation of {@link DbDialectHandler}.
 *
 * <p>
 * MySQL's {@code TRUNCATE TABLE} always resets {@code AUTO_INCREMENT}, so no extra clause is
 * needed. The schema is the database name taken from the JDBC URL.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class MySqlDialectHandler implements DbDialectHandler {

    // Fallback database name when the URL carries none
    private static final String DEFAULT_DATABASE = "hirelink";

    // Factory that applies common DBUnit settings
    private final DbUnitConfigFactory configFactory;

    /**
     * Pins the session time zone to UTC and the character set to utf8mb4.
     *
     * @param connection JDBC connection
     * @throws SQLException if a statement fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET time_zone = '+00:00'");
            st.execute("SET NAMES utf8mb4");
        }
    }

    /**
     * Resolves the database name from a URL such as {@code jdbc:mysql://host:3306/db?opts}.
     *
     * @param config connection settings
     * @return database name
     */
    @Override
    public String resolveSchema(ConnectionConfig config) {
        String url = config.getUrl();
        if (url == null) {
            return DEFAULT_DATABASE;
        }
        int slash = url.lastIndexOf('/');
        if (slash < 0 || slash == url.length() - 1) {
            return DEFAULT_DATABASE;
        }
        String tail = url.substring(slash + 1);
        int q = tail.indexOf('?');
        String dbName = q >= 0 ? tail.substring(0, q) : tail;
        if (dbName.isBlank()) {
            return DEFAULT_DATABASE;
        }
        return dbName;
    }

    /**
     * Opens a DBUnit connection scoped to the database named by {@code schema}.
     *
     * <p>
     * MySQL exposes databases as catalogs, so the schema is not validated against
     * {@code DatabaseMetaData#getSchemas()}; {@link MySqlMetadataHandler} maps it to the
     * catalog.
     * </p>
     *
     * @param jdbc JDBC connection
     * @param schema database name from {@link #resolveSchema(ConnectionConfig)}
     * @return DBUnit connection
     * @throws DatabaseUnitException if DBUnit rejects the connection
     */
    @Override
    public DatabaseConnection createDbUnitConnection(Connection jdbc, String schema)
            throws DatabaseUnitException {
        DatabaseConnection dbConn = new DatabaseConnection(jdbc, schema, false);
        DatabaseConfig config = dbConn.getConfig();
        configFactory.configure(config, getDataTypeFactory());
        config.setProperty(DatabaseConfig.PROPERTY_METADATA_HANDLER, new MySqlMetadataHandler());
        return dbConn;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return new MySqlDataTypeFactory();
    }

    @Override
    public String truncateSql(String table) {
        return "TRUNCATE TABLE " + table;
    }
}
