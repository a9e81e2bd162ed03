package io.github.yok.hirelink.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classification of ingestion failures.
 *
 * <p>
 * The kind is decided where the failure happens and is carried unchanged to the boundary, which
 * maps it to an HTTP-equivalent status code.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    /** Batch size outside the accepted range, or an unreadable request document. */
    MALFORMED_BATCH(400, false),

    /** One or more shape or referential violations in a batch. */
    VALIDATION_FAILURE(422, false),

    /** Uniqueness or foreign-key rejection by the store, or a migration id collision. */
    CONSTRAINT_VIOLATION(400, false),

    /** Missing backup artifact or migration source. */
    NOT_FOUND(404, false),

    /** Table name outside the known set. */
    UNRECOGNIZED_RESOURCE(400, false),

    /** Restore could not truncate the target table. */
    TRUNCATE_FAILED(500, true),

    /** Restore truncated the table but could not reload it. */
    RELOAD_FAILED(500, true),

    /** Any other failure. */
    INFRASTRUCTURE_FAULT(500, true);

    // HTTP-equivalent status code
    private final int status;

    // Whether the failure is logged with a stack trace (server-side fault)
    private final boolean serverFault;
}
