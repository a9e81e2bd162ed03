package io.github.yok.hirelink.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * DBUnit settings shared by every store session ({@code dbunit.config.*}).
 *
 * <ul>
 * <li>{@code allow-empty-fields}: accept {@code ""} as a column value (names may be blank)</li>
 * <li>{@code batched-statements} / {@code batch-size}: JDBC batching for bulk INSERTs</li>
 * <li>{@code table-types}: metadata table types treated as workforce tables</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit.config")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    private boolean allowEmptyFields = true;

    private boolean batchedStatements = true;

    /**
     * Statements per JDBC batch. Independent of the ingestion chunk size.
     */
    private int batchSize = 100;

    // H2 2.x reports plain tables as "BASE TABLE"
    private List<String> tableTypes = new ArrayList<>(List.of("TABLE", "BASE TABLE"));
}
