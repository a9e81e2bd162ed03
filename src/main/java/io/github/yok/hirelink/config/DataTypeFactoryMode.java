package io.github.yok.hirelink.config;

/**
 * Enumeration of supported DBUnit DataTypeFactory modes.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataTypeFactoryMode {
    // PostgreSQL
    POSTGRESQL,
    // MySQL
    MYSQL,
    // H2 (embedded and in-memory databases)
    H2
}
