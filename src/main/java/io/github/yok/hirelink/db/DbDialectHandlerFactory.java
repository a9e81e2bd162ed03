package io.github.yok.hirelink.db;

import io.github.yok.hirelink.config.DataTypeFactoryMode;
import io.github.yok.hirelink.config.DbUnitConfig;
import io.github.yok.hirelink.db.h2.H2DialectHandler;
import io.github.yok.hirelink.db.mysql.MySqlDialectHandler;
import io.github.yok.hirelink.db.postgresql.PostgresqlDialectHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to the database type.
 *
 * <p>
 * The dialect is taken from {@code dbunit.data-type-factory-mode} in {@code application.yml}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbDialectHandlerFactory {

    // DBUnit settings (data-type-factory-mode)
    private final DbUnitConfig dbUnitConfig;

    // Applies common settings to DBUnit's DatabaseConfig
    private final DbUnitConfigFactory configFactory;

    /**
     * Creates the handler for the configured mode.
     *
     * @return dialect handler
     * @throws IllegalStateException if no mode is configured
     */
    public DbDialectHandler create() {
        return create(dbUnitConfig.getDataTypeFactoryMode());
    }

    /**
     * Creates the handler for the given mode.
     *
     * <ul>
     * <li>{@code POSTGRESQL}: instantiate {@link PostgresqlDialectHandler}</li>
     * <li>{@code MYSQL}: instantiate {@link MySqlDialectHandler}</li>
     * <li>{@code H2}: instantiate {@link H2DialectHandler}</li>
     * </ul>
     *
     * @param mode dialect
     * @return dialect handler
     * @throws IllegalStateException if {@code mode} is {@code null}
     */
    public DbDialectHandler create(DataTypeFactoryMode mode) {
        if (mode == null) {
            throw new IllegalStateException(
                    "dbunit.data-type-factory-mode is not configured in application.yml.");
        }
        log.debug("Creating dialect handler: mode={}", mode);
        switch (mode) {
            case POSTGRESQL:
                return new PostgresqlDialectHandler(configFactory);
            case MYSQL:
                return new MySqlDialectHandler(configFactory);
            case H2:
                return new H2DialectHandler(configFactory);
            default:
                throw new IllegalStateException("Unsupported dialect: " + mode);
        }
    }
}
