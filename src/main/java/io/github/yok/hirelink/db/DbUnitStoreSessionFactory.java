package io.github.yok.hirelink.db;

import io.github.yok.hirelink.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.springframework.stereotype.Component;

/**
 * Opens {@link DbUnitStoreSession}s from {@code connection.*} settings.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbUnitStoreSessionFactory implements StoreSessionFactory {

    // JDBC URL and credentials
    private final ConnectionConfig connectionConfig;

    // Resolves the dialect from dbunit.data-type-factory-mode
    private final DbDialectHandlerFactory dialectFactory;

    /**
     * Opens a JDBC connection, applies dialect session settings and wraps it for DBUnit.
     *
     * @return open session
     * @throws SQLException if the connection or its DBUnit wrapper cannot be created
     */
    @Override
    public StoreSession open() throws SQLException {
        loadDriver(connectionConfig.getDriverClass());
        DbDialectHandler handler = dialectFactory.create();
        Connection jdbc = DriverManager.getConnection(connectionConfig.getUrl(),
                connectionConfig.getUser(), connectionConfig.getPassword());
        try {
            handler.prepareConnection(jdbc);
            String schema = handler.resolveSchema(connectionConfig);
            DatabaseConnection dbConn = handler.createDbUnitConnection(jdbc, schema);
            log.debug("Session opened: url={}, schema={}", connectionConfig.getUrl(), schema);
            return new DbUnitStoreSession(jdbc, dbConn, handler);
        } catch (SQLException | DatabaseUnitException | RuntimeException e) {
            jdbc.close();
            if (e instanceof SQLException) {
                throw (SQLException) e;
            }
            throw new SQLException("Failed to initialize DBUnit connection", e);
        }
    }

    private static void loadDriver(String driverClass) throws SQLException {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver not found: " + driverClass, e);
        }
    }
}
