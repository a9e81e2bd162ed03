package io.github.yok.hirelink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code ingestion} section in {@code application.yml}.
 *
 * <pre>
 * ingestion:
 *   max-batch-size: 1000
 *   migration-chunk-size: 10000
 *   migration-source-prefix: raw_data/
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "ingestion")
@Data
public class IngestionConfig {

    // Upper bound of the total row count of one batch-insert request
    private int maxBatchSize = 1000;
    // Rows per INSERT chunk during historical migration
    private int migrationChunkSize = 10000;
    // Object-storage key prefix of the historical CSV files
    private String migrationSourcePrefix = "raw_data/";
}
