package io.github.yok.hirelink.db;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import io.github.yok.hirelink.config.DataTypeFactoryMode;
import io.github.yok.hirelink.config.DbUnitConfig;
import io.github.yok.hirelink.db.h2.H2DialectHandler;
import io.github.yok.hirelink.db.mysql.MySqlDialectHandler;
import io.github.yok.hirelink.db.postgresql.PostgresqlDialectHandler;
import org.junit.jupiter.api.Test;

class DbDialectHandlerFactoryTest {

    private static DbDialectHandlerFactory factory(DataTypeFactoryMode mode) {
        DbUnitConfig dbUnitConfig = new DbUnitConfig();
        dbUnitConfig.setDataTypeFactoryMode(mode);
        return new DbDialectHandlerFactory(dbUnitConfig, mock(DbUnitConfigFactory.class));
    }

    @Test
    void create_正常ケース_既定設定を使用する_PostgresqlDialectHandlerが返ること() {
        DbDialectHandlerFactory factory = new DbDialectHandlerFactory(new DbUnitConfig(),
                mock(DbUnitConfigFactory.class));
        assertInstanceOf(PostgresqlDialectHandler.class, factory.create());
    }

    @Test
    void create_正常ケース_MYSQLを指定する_MySqlDialectHandlerが返ること() {
        assertInstanceOf(MySqlDialectHandler.class, factory(DataTypeFactoryMode.MYSQL).create());
    }

    @Test
    void create_正常ケース_H2を指定する_H2DialectHandlerが返ること() {
        assertInstanceOf(H2DialectHandler.class, factory(DataTypeFactoryMode.H2).create());
    }

    @Test
    void create_異常ケース_モード未設定である_IllegalStateExceptionが送出されること() {
        assertThrows(IllegalStateException.class, () -> factory(null).create());
    }
}
