package io.github.yok.hirelink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code dbunit} section in {@code application.yml}.
 *
 * <p>
 * <strong>Supported modes:</strong>
 * </p>
 * <ul>
 * <li>{@link DataTypeFactoryMode#POSTGRESQL}: Use the factory for PostgreSQL</li>
 * <li>{@link DataTypeFactoryMode#MYSQL}: Use the factory for MySQL</li>
 * <li>{@link DataTypeFactoryMode#H2}: Use the factory for H2</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit")
@Data
public class DbUnitConfig {

    /**
     * Dialect used for truncation SQL, schema resolution and DBUnit data types.
     */
    private DataTypeFactoryMode dataTypeFactoryMode = DataTypeFactoryMode.POSTGRESQL;
}
