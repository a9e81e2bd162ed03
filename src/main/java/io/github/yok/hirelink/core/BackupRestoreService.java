package io.github.yok.hirelink.core;

import io.github.yok.hirelink.codec.AvroSnapshotCodec;
import io.github.yok.hirelink.db.StoreSession;
import io.github.yok.hirelink.db.StoreSessionFactory;
import io.github.yok.hirelink.model.WorkforceRow;
import io.github.yok.hirelink.model.WorkforceTable;
import io.github.yok.hirelink.storage.ArtifactStore;
import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Exports every table to a binary snapshot and restores a single table from its snapshot.
 *
 * <p>
 * Restore replaces the whole table: it truncates (resetting the identity sequence), commits, and
 * then bulk-loads the decoded rows in a second transaction. A failure in the second step leaves the
 * table empty and is reported as {@link ErrorKind#RELOAD_FAILED}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class BackupRestoreService {

    private final StoreSessionFactory sessionFactory;
    private final AvroSnapshotCodec codec;
    private final ArtifactStore artifactStore;
    private final TransactionalWriter writer;

    // Rows per INSERT operation during reload
    private final int chunkSize;

    /**
     * Writes one artifact per non-empty table, in the order departments, jobs, hired_employees.
     *
     * @return per-table counts and skipped tables
     * @throws WorkforceException {@link ErrorKind#INFRASTRUCTURE_FAULT} on any failure
     */
    public BackupSummary backupAll() {
        log.info("=== Backup started ===");
        Map<WorkforceTable, Integer> counts = new LinkedHashMap<>();
        List<WorkforceTable> skipped = new ArrayList<>();
        try (StoreSession session = sessionFactory.open()) {
            for (WorkforceTable table : WorkforceTable.loadOrder()) {
                List<WorkforceRow> rows = session.queryAll(table);
                if (rows.isEmpty()) {
                    log.info("[{}] No rows found; backup skipped.", table);
                    skipped.add(table);
                    continue;
                }
                artifactStore.write(table.getTableName(), codec.encode(table, rows));
                counts.put(table, rows.size());
                log.info("[{}] Backed up rows={}", table, rows.size());
            }
        } catch (SQLException | IOException | RuntimeException e) {
            throw new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                    "Failed to create a new backup for the database.", e);
        }
        BackupSummary summary = new BackupSummary(counts, skipped);
        log.info("=== Backup completed: {} ===", summary.getMessage());
        return summary;
    }

    /**
     * Replaces a table's contents with its last backup.
     *
     * @param tableName table name
     * @return restored count
     * @throws WorkforceException {@link ErrorKind#UNRECOGNIZED_RESOURCE},
     *         {@link ErrorKind#NOT_FOUND}, {@link ErrorKind#TRUNCATE_FAILED},
     *         {@link ErrorKind#RELOAD_FAILED} or {@link ErrorKind#INFRASTRUCTURE_FAULT}
     */
    public RestoreSummary restore(String tableName) {
        WorkforceTable table = WorkforceTable.fromName(tableName)
                .orElseThrow(() -> new WorkforceException(ErrorKind.UNRECOGNIZED_RESOURCE,
                        "Table '" + tableName + "' is not recognized.", tableName, null));
        log.info("=== Restore started: {} ===", table);

        List<WorkforceRow> rows = readBackup(table);

        try (StoreSession session = sessionFactory.open()) {
            truncate(session, table);
            try {
                writer.load(session, table, rows, chunkSize);
            } catch (WorkforceException e) {
                throw new WorkforceException(ErrorKind.RELOAD_FAILED,
                        "Failed to reload table '" + table
                                + "' from its backup; the table was left truncated.",
                        table.getTableName(), e);
            }
        } catch (SQLException e) {
            throw new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                    "Failed to restore table '" + table + "'.", table.getTableName(), e);
        }

        RestoreSummary summary = new RestoreSummary(table, rows.size());
        log.info("=== Restore completed: {} ===", summary.getMessage());
        return summary;
    }

    /**
     * Reads and decodes the artifact before the store is touched.
     */
    private List<WorkforceRow> readBackup(WorkforceTable table) {
        byte[] bytes;
        try {
            bytes = artifactStore.read(table.getTableName())
                    .orElseThrow(() -> new WorkforceException(ErrorKind.NOT_FOUND,
                            "Backup file for table '" + table + "' not found.",
                            table.getTableName(), null));
        } catch (IOException e) {
            throw new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                    "Failed to read the backup file for table '" + table + "'.",
                    table.getTableName(), e);
        }
        try {
            List<WorkforceRow> rows = codec.decode(table, bytes);
            log.info("[{}] Backup decoded rows={}", table, rows.size());
            return rows;
        } catch (IOException e) {
            throw new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                    "Failed to decode the backup file for table '" + table + "'.",
                    table.getTableName(), e);
        }
    }

    private static void truncate(StoreSession session, WorkforceTable table) {
        try {
            session.begin();
            session.truncate(table);
            session.commit();
            log.info("[{}] Table truncated.", table);
        } catch (SQLException | RuntimeException e) {
            try {
                session.rollback();
                log.warn("[{}] Transaction rolled back due to error.", table);
            } catch (SQLException rollbackEx) {
                log.warn("[{}] Rollback failed: {}", table, rollbackEx.getMessage(), rollbackEx);
            }
            throw new WorkforceException(ErrorKind.TRUNCATE_FAILED,
                    "Failed to truncate table '" + table + "'; its contents are unchanged.",
                    table.getTableName(), e);
        }
    }
}
