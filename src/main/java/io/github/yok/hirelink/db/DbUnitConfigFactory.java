package io.github.yok.hirelink.db;

import io.github.yok.hirelink.config.DbUnitConfigProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.springframework.stereotype.Component;

/**
 * Applies the store-wide DBUnit settings to a freshly opened connection.
 *
 * <p>
 * Table names are looked up case-insensitively and left unescaped, so {@code departments} resolves
 * to whatever case the DDL folded it to (upper on H2, lower on PostgreSQL).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbUnitConfigFactory {

    private final DbUnitConfigProperties props;

    /**
     * Uses default {@link DbUnitConfigProperties}; for callers outside the Spring context.
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfigProperties();
    }

    /**
     * Applies the settings.
     *
     * @param cfg connection config to modify
     * @param dataTypeFactory dialect data type factory
     */
    public void configure(DatabaseConfig cfg, IDataTypeFactory dataTypeFactory) {
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        cfg.setProperty(DatabaseConfig.FEATURE_CASE_SENSITIVE_TABLE_NAMES, false);
        cfg.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE,
                props.getTableTypes().toArray(new String[0]));
        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());
        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, props.getBatchSize());
        log.debug("DBUnit: dataTypeFactory={}, tableTypes={}, batched={}, batchSize={}",
                dataTypeFactory.getClass().getSimpleName(), props.getTableTypes(),
                props.isBatchedStatements(), props.getBatchSize());
    }
}
