package io.github.yok.hirelink.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Unchecked exception raised by every ingestion operation.
 *
 * <p>
 * Carries the {@link ErrorKind}, an optional resource name (the affected table) and, for
 * {@link ErrorKind#VALIDATION_FAILURE}, the complete list of violations.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class WorkforceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Failure classification
    private final ErrorKind kind;

    // Affected table name, or null
    private final String resource;

    // Violation messages (empty unless VALIDATION_FAILURE)
    private final ImmutableList<String> violations;

    /**
     * Creates an exception without resource, violations or cause.
     *
     * @param kind failure classification
     * @param message user-facing message
     */
    public WorkforceException(ErrorKind kind, String message) {
        this(kind, message, null, ImmutableList.of(), null);
    }

    /**
     * Creates an exception with a cause.
     *
     * @param kind failure classification
     * @param message user-facing message
     * @param cause underlying failure
     */
    public WorkforceException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, ImmutableList.of(), cause);
    }

    /**
     * Creates an exception for a specific table.
     *
     * @param kind failure classification
     * @param message user-facing message
     * @param resource affected table name
     * @param cause underlying failure, or {@code null}
     */
    public WorkforceException(ErrorKind kind, String message, String resource, Throwable cause) {
        this(kind, message, resource, ImmutableList.of(), cause);
    }

    private WorkforceException(ErrorKind kind, String message, String resource,
            List<String> violations, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.resource = resource;
        this.violations = ImmutableList.copyOf(violations);
    }

    /**
     * Creates a {@link ErrorKind#VALIDATION_FAILURE} carrying all violations.
     *
     * @param violations violation messages in input order
     * @return exception
     */
    public static WorkforceException validationFailure(List<String> violations) {
        return new WorkforceException(ErrorKind.VALIDATION_FAILURE,
                "Batch validation failed with " + violations.size() + " violation(s).", null,
                violations, null);
    }

    /**
     * Returns the same failure attributed to the given table, keeping kind, message and cause.
     *
     * @param table table name
     * @return this exception if it already names a resource, otherwise a copy naming
     *         {@code table}
     */
    public WorkforceException forResource(String table) {
        if (resource != null) {
            return this;
        }
        return new WorkforceException(kind, getMessage(), table, violations, getCause());
    }

    /**
     * Returns the HTTP-equivalent status code.
     *
     * @return status code
     */
    public int getStatus() {
        return kind.getStatus();
    }
}
