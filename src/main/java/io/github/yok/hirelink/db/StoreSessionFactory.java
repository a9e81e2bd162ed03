package io.github.yok.hirelink.db;

import java.sql.SQLException;

/**
 * Acquires {@link StoreSession}s.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface StoreSessionFactory {

    /**
     * Opens a new session on its own connection.
     *
     * @return open session
     * @throws SQLException if the connection cannot be established
     */
    StoreSession open() throws SQLException;
}
