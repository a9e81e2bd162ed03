package io.github.yok.hirelink.integration;

import io.github.yok.hirelink.config.ConnectionConfig;
import io.github.yok.hirelink.config.DataTypeFactoryMode;
import io.github.yok.hirelink.config.DbUnitConfig;
import io.github.yok.hirelink.db.DbDialectHandlerFactory;
import io.github.yok.hirelink.db.DbUnitConfigFactory;
import io.github.yok.hirelink.db.DbUnitStoreSessionFactory;
import io.github.yok.hirelink.db.StoreSessionFactory;
import org.flywaydb.core.Flyway;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Testing support that prepares the PostgreSQL container schema with Flyway
 * (classpath:db/migration/postgresql).
 */
final class PostgresqlIntegrationSupport {

    private PostgresqlIntegrationSupport() {}

    /**
     * スキーマを作り直し、接続設定を返します。
     *
     * @param postgres コンテナ
     * @return 接続設定
     */
    static ConnectionConfig prepareDatabase(PostgreSQLContainer<?> postgres) {
        Flyway flyway = Flyway.configure()
                .dataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword())
                .locations("classpath:db/migration/postgresql").cleanDisabled(false).load();
        flyway.clean();
        flyway.migrate();

        ConnectionConfig config = new ConnectionConfig();
        config.setUrl(postgres.getJdbcUrl());
        config.setUser(postgres.getUsername());
        config.setPassword(postgres.getPassword());
        config.setDriverClass("org.postgresql.Driver");
        return config;
    }

    /**
     * PostgreSQL 方言のセッションファクトリを生成します。
     *
     * @param config 接続設定
     * @return セッションファクトリ
     */
    static StoreSessionFactory sessionFactory(ConnectionConfig config) {
        DbUnitConfig dbUnitConfig = new DbUnitConfig();
        dbUnitConfig.setDataTypeFactoryMode(DataTypeFactoryMode.POSTGRESQL);
        return new DbUnitStoreSessionFactory(config,
                new DbDialectHandlerFactory(dbUnitConfig, new DbUnitConfigFactory()));
    }
}
