package io.github.yok.hirelink.db.postgresql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.hirelink.config.ConnectionConfig;
import io.github.yok.hirelink.db.DbUnitConfigFactory;
import java.sql.Connection;
import java.sql.Statement;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;
import org.junit.jupiter.api.Test;

class PostgresqlDialectHandlerTest {

    private final PostgresqlDialectHandler handler =
            new PostgresqlDialectHandler(mock(DbUnitConfigFactory.class));

    @Test
    void resolveSchema_正常ケース_publicが返ること() {
        assertEquals("public", handler.resolveSchema(new ConnectionConfig()));
    }

    @Test
    void truncateSql_正常ケース_テーブル名を指定する_RESTART_IDENTITY_CASCADE付きで返ること() {
        assertEquals("TRUNCATE TABLE departments RESTART IDENTITY CASCADE",
                handler.truncateSql("departments"));
    }

    @Test
    void getDataTypeFactory_正常ケース_PostgresqlDataTypeFactoryが返ること() {
        assertInstanceOf(PostgresqlDataTypeFactory.class, handler.getDataTypeFactory());
    }

    @Test
    void prepareConnection_正常ケース_セッションのタイムゾーンがUTCに設定されること()
            throws Exception {
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement);

        handler.prepareConnection(connection);

        verify(statement).execute("SET TIME ZONE 'UTC'");
        verify(statement).close();
    }
}
