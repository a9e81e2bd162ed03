package io.github.yok.hirelink.core;

import io.github.yok.hirelink.db.StoreSession;
import io.github.yok.hirelink.db.StoreSessionFactory;
import io.github.yok.hirelink.model.WorkforceTable;
import io.github.yok.hirelink.parser.BatchRequest;
import java.sql.SQLException;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Real-time batch insert: size guard, existing-id scan, validation and transactional write.
 *
 * <p>
 * The id scan, the validation and the inserts share one session and one transaction. The session
 * is closed when the request ends, whatever the outcome.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class BatchIngestionService {

    // Opens one session per request
    private final StoreSessionFactory sessionFactory;

    // Cross-reference checks
    private final BatchValidator validator;

    // Atomic multi-table insert
    private final TransactionalWriter writer;

    // Upper bound of the total row count
    private final int maxBatchSize;

    /**
     * Inserts a batch atomically.
     *
     * @param request batch request
     * @return inserted counts
     * @throws WorkforceException {@link ErrorKind#MALFORMED_BATCH} when the size is outside
     *         [1, maxBatchSize], {@link ErrorKind#VALIDATION_FAILURE} with every violation,
     *         {@link ErrorKind#CONSTRAINT_VIOLATION} or {@link ErrorKind#INFRASTRUCTURE_FAULT}
     */
    public InsertCounts insert(BatchRequest request) {
        int total = request.totalRows();
        if (total < 1 || total > maxBatchSize) {
            throw new WorkforceException(ErrorKind.MALFORMED_BATCH,
                    "Batch size must be between 1 and " + maxBatchSize
                            + " rows in total, but was " + total + ".");
        }
        log.info("=== Batch insert started (departments={}, jobs={}, hired_employees={}) ===",
                request.getDepartments().size(), request.getJobs().size(),
                request.getHiredEmployees().size());

        try (StoreSession session = sessionFactory.open()) {
            session.begin();
            Set<Integer> departmentIds = session.queryIds(WorkforceTable.DEPARTMENTS);
            Set<Integer> jobIds = session.queryIds(WorkforceTable.JOBS);
            log.debug("Existing ids: departments={}, jobs={}", departmentIds.size(),
                    jobIds.size());

            ValidationResult result = validator.validate(departmentIds, jobIds,
                    request.getDepartments(), request.getJobs(), request.getHiredEmployees());
            if (!result.isValid()) {
                session.rollback();
                throw WorkforceException.validationFailure(result.getViolations());
            }

            InsertCounts counts = writer.write(session, result.getBatch());
            log.info("=== Batch insert completed: {} ===", counts.getMessage());
            return counts;
        } catch (SQLException e) {
            throw new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                    "Failed to insert records into the database.", e);
        }
    }
}
