/**
 * Database access package for HireLink.
 *
 * <p>
 * Wraps JDBC connections in DBUnit {@code DatabaseConnection}s behind the
 * {@link io.github.yok.hirelink.db.StoreSession} contract and selects the dialect handler
 * (PostgreSQL, MySQL, H2) from {@code dbunit.data-type-factory-mode}.
 * </p>
 */
package io.github.yok.hirelink.db;
