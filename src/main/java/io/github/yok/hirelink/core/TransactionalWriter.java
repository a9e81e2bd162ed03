package io.github.yok.hirelink.core;

import com.google.common.collect.Lists;
import io.github.yok.hirelink.db.StoreSession;
import io.github.yok.hirelink.model.WorkforceRow;
import io.github.yok.hirelink.model.WorkforceTable;
import io.github.yok.hirelink.util.SqlStates;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes rows inside one transaction and undoes everything on failure.
 *
 * <p>
 * Failures are classified once, here: an integrity constraint violation reported by the store
 * (SQLState class {@code 23}) becomes {@link ErrorKind#CONSTRAINT_VIOLATION}; anything else becomes
 * {@link ErrorKind#INFRASTRUCTURE_FAULT}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TransactionalWriter {

    /**
     * Inserts a validated batch in the order departments, jobs, hired employees and commits.
     *
     * <p>
     * The caller has already begun the transaction on {@code session}, typically before reading
     * the existing ids the batch was validated against.
     * </p>
     *
     * @param session session with an open transaction
     * @param batch validated batch
     * @return inserted counts
     * @throws WorkforceException {@link ErrorKind#CONSTRAINT_VIOLATION} or
     *         {@link ErrorKind#INFRASTRUCTURE_FAULT}; the transaction has been rolled back
     */
    public InsertCounts write(StoreSession session, ValidatedBatch batch) {
        try {
            session.bulkInsert(WorkforceTable.DEPARTMENTS, batch.getDepartments());
            session.bulkInsert(WorkforceTable.JOBS, batch.getJobs());
            session.bulkInsert(WorkforceTable.HIRED_EMPLOYEES, batch.getHiredEmployees());
            session.commit();
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(session, "batch");
            throw classify(e, "Failed to insert records into the database.", null);
        }
        InsertCounts counts = new InsertCounts(batch.getDepartments().size(),
                batch.getJobs().size(), batch.getHiredEmployees().size());
        log.info("[batch] Transaction committed (departments={}, jobs={}, hired_employees={})",
                counts.getDepartments(), counts.getJobs(), counts.getHiredEmployees());
        return counts;
    }

    /**
     * Appends rows to one table in chunks, inside a single transaction, and commits.
     *
     * @param session open session
     * @param table target table
     * @param rows rows of {@code table}
     * @param chunkSize rows per INSERT operation; must be positive
     * @return number of rows inserted
     * @throws WorkforceException {@link ErrorKind#CONSTRAINT_VIOLATION} or
     *         {@link ErrorKind#INFRASTRUCTURE_FAULT} naming {@code table}; the transaction has been
     *         rolled back
     */
    public int load(StoreSession session, WorkforceTable table,
            List<? extends WorkforceRow> rows, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        try {
            session.begin();
            int chunkNo = 0;
            for (List<? extends WorkforceRow> chunk : Lists.partition(rows, chunkSize)) {
                session.bulkInsert(table, chunk);
                log.debug("[{}] chunk {} inserted (rows={})", table, ++chunkNo, chunk.size());
            }
            session.commit();
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(session, table.getTableName());
            throw classify(e, "Failed to load records into table '" + table + "'.",
                    table.getTableName());
        }
        log.info("[{}] Transaction committed (rows={})", table, rows.size());
        return rows.size();
    }

    private static WorkforceException classify(Exception e, String faultMessage,
            String resource) {
        return SqlStates.findIntegrityViolation(e)
                .map(sql -> new WorkforceException(ErrorKind.CONSTRAINT_VIOLATION,
                        "Integrity constraint violated: " + sql.getMessage(), resource, e))
                .orElseGet(() -> new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                        faultMessage, resource, e));
    }

    private static void rollbackQuietly(StoreSession session, String context) {
        try {
            session.rollback();
            log.warn("[{}] Transaction rolled back due to error.", context);
        } catch (SQLException rollbackEx) {
            log.warn("[{}] Rollback failed: {}", context, rollbackEx.getMessage(), rollbackEx);
        }
    }
}
