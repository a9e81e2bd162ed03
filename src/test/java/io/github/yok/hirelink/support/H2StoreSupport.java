package io.github.yok.hirelink.support;

import io.github.yok.hirelink.config.ConnectionConfig;
import io.github.yok.hirelink.config.DataTypeFactoryMode;
import io.github.yok.hirelink.config.DbUnitConfig;
import io.github.yok.hirelink.db.DbDialectHandlerFactory;
import io.github.yok.hirelink.db.DbUnitConfigFactory;
import io.github.yok.hirelink.db.DbUnitStoreSessionFactory;
import io.github.yok.hirelink.db.StoreSessionFactory;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import org.flywaydb.core.Flyway;

/**
 * Testing support that prepares an in-memory H2 store with Flyway
 * (classpath:db/migration/h2) and builds HireLink sessions on it.
 */
public final class H2StoreSupport {

    private H2StoreSupport() {}

    /**
     * 新しいインメモリDBを作成し、スキーマを作成します。
     *
     * @return 接続設定
     */
    public static ConnectionConfig prepareDatabase() {
        ConnectionConfig config = new ConnectionConfig();
        config.setUrl("jdbc:h2:mem:hirelink_" + UUID.randomUUID().toString().replace("-", "")
                + ";DB_CLOSE_DELAY=-1");
        config.setUser("sa");
        config.setPassword("");
        config.setDriverClass("org.h2.Driver");

        Flyway.configure().dataSource(config.getUrl(), config.getUser(), config.getPassword())
                .locations("classpath:db/migration/h2").load().migrate();
        return config;
    }

    /**
     * H2 方言のセッションファクトリを生成します。
     *
     * @param config 接続設定
     * @return セッションファクトリ
     */
    public static StoreSessionFactory sessionFactory(ConnectionConfig config) {
        DbUnitConfig dbUnitConfig = new DbUnitConfig();
        dbUnitConfig.setDataTypeFactoryMode(DataTypeFactoryMode.H2);
        return new DbUnitStoreSessionFactory(config,
                new DbDialectHandlerFactory(dbUnitConfig, new DbUnitConfigFactory()));
    }

    /**
     * JDBC 接続を開きます。
     *
     * @param config 接続設定
     * @return 接続
     * @throws SQLException 接続失敗時
     */
    public static Connection openConnection(ConnectionConfig config) throws SQLException {
        return DriverManager.getConnection(config.getUrl(), config.getUser(),
                config.getPassword());
    }

    /**
     * SQL を実行します。
     *
     * @param config 接続設定
     * @param sqls 実行する SQL
     * @throws SQLException 実行失敗時
     */
    public static void execute(ConnectionConfig config, String... sqls) throws SQLException {
        try (Connection conn = openConnection(config); Statement st = conn.createStatement()) {
            for (String sql : sqls) {
                st.execute(sql);
            }
        }
    }

    /**
     * テーブルの件数を返します。
     *
     * @param config 接続設定
     * @param table テーブル名
     * @return 件数
     * @throws SQLException 実行失敗時
     */
    public static int count(ConnectionConfig config, String table) throws SQLException {
        try (Connection conn = openConnection(config);
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
