package io.github.yok.hirelink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the relational store connection loaded from
 * {@code application.yml}.
 *
 * <pre>
 * connection:
 *   url: jdbc:postgresql://localhost:5432/hirelink
 *   user: hirelink
 *   password: password
 *   driver-class: org.postgresql.Driver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // JDBC connection URL (e.g., jdbc:postgresql://localhost:5432/hirelink)
    private String url;
    // Database user name
    private String user;
    // Database password
    private String password;
    // Fully qualified JDBC driver class name (optional; JDBC 4 drivers self-register)
    private String driverClass;
}
