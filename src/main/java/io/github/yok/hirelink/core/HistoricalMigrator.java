package io.github.yok.hirelink.core;

import io.github.yok.hirelink.codec.CsvTransformException;
import io.github.yok.hirelink.codec.TabularCsvCodec;
import io.github.yok.hirelink.db.StoreSession;
import io.github.yok.hirelink.db.StoreSessionFactory;
import io.github.yok.hirelink.model.WorkforceRow;
import io.github.yok.hirelink.model.WorkforceTable;
import io.github.yok.hirelink.storage.ObjectStorage;
import java.io.IOException;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends historical CSV snapshots from object storage to the store.
 *
 * <p>
 * Tables are processed in the order departments, jobs, hired_employees, each in its own
 * transaction. Historical data is not validated against existing rows, except that ids already
 * present in the target table reject the whole table. The first failing table aborts the run;
 * tables migrated before it keep their rows.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class HistoricalMigrator {

    private final StoreSessionFactory sessionFactory;
    private final ObjectStorage objectStorage;
    private final TabularCsvCodec csvCodec;
    private final TransactionalWriter writer;

    // Object key prefix, e.g. "raw_data/"
    private final String sourcePrefix;

    // Rows per INSERT operation
    private final int chunkSize;

    /**
     * Migrates all tables.
     *
     * @return rows appended per table
     * @throws WorkforceException naming the failed table
     */
    public MigrationSummary migrateAll() {
        log.info("=== Historical migration started (source={}) ===", sourcePrefix);
        Map<WorkforceTable, Integer> counts = new LinkedHashMap<>();
        for (WorkforceTable table : WorkforceTable.loadOrder()) {
            try {
                counts.put(table, migrate(table));
            } catch (WorkforceException e) {
                log.error("[{}] Migration aborted; completed tables={}", table, counts.keySet());
                throw e.forResource(table.getTableName());
            }
        }
        MigrationSummary summary = new MigrationSummary(counts);
        log.info("=== Historical migration completed: {} ===", counts);
        return summary;
    }

    /**
     * Migrates one table.
     *
     * @param table target table
     * @return rows appended
     * @throws WorkforceException {@link ErrorKind#NOT_FOUND},
     *         {@link ErrorKind#CONSTRAINT_VIOLATION} or {@link ErrorKind#INFRASTRUCTURE_FAULT}
     */
    public int migrate(WorkforceTable table) {
        String key = sourcePrefix + table.getTableName() + ".csv";
        String text;
        try {
            text = objectStorage.fetchText(key)
                    .orElseThrow(() -> new WorkforceException(ErrorKind.NOT_FOUND,
                            "CSV file for table '" + table + "' not found.",
                            table.getTableName(), null));
        } catch (IOException e) {
            throw new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                    "Failed to fetch the CSV file for table '" + table + "'.",
                    table.getTableName(), e);
        }

        List<WorkforceRow> rows;
        try {
            rows = csvCodec.decode(table, text);
        } catch (CsvTransformException e) {
            throw new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                    "Failed to transform the CSV file for table '" + table + "': "
                            + e.getMessage(),
                    table.getTableName(), e);
        }
        log.info("[{}] Fetched {} rows from {}", table, rows.size(), key);

        try (StoreSession session = sessionFactory.open()) {
            Set<Integer> existingIds = session.queryIds(table);
            long conflicts = rows.stream().filter(r -> existingIds.contains(r.getId())).count();
            if (conflicts > 0) {
                throw new WorkforceException(ErrorKind.CONSTRAINT_VIOLATION,
                        "Table '" + table + "' already contains " + conflicts
                                + " of the ids being migrated.",
                        table.getTableName(), null);
            }
            int loaded = writer.load(session, table, rows, chunkSize);
            log.info("[{}] Migrated rows={}", table, loaded);
            return loaded;
        } catch (SQLException e) {
            throw new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                    "Failed to migrate table '" + table + "'.", table.getTableName(), e);
        }
    }
}
