package io.github.yok.hirelink.util;

import java.sql.SQLException;
import java.util.Optional;
import lombok.Generated;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Classifies JDBC failures by SQLState.
 *
 * <p>
 * DBUnit wraps the driver's {@link SQLException} in its own exceptions, and batched execution
 * reports the real cause through {@link SQLException#getNextException()}; both chains are
 * searched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlStates {

    // SQL:2011 class "23": integrity constraint violation
    private static final String INTEGRITY_CONSTRAINT_CLASS = "23";

    @Generated
    private SqlStates() {}

    /**
     * Finds the first {@link SQLException} whose SQLState belongs to class {@code 23}
     * (uniqueness, foreign-key, not-null or check constraint).
     *
     * @param failure failure to inspect; may be {@code null}
     * @return matching exception, or empty
     */
    public static Optional<SQLException> findIntegrityViolation(Throwable failure) {
        if (failure == null) {
            return Optional.empty();
        }
        for (Throwable t : ExceptionUtils.getThrowableList(failure)) {
            if (!(t instanceof SQLException)) {
                continue;
            }
            SQLException sql = (SQLException) t;
            while (sql != null) {
                String state = sql.getSQLState();
                if (state != null && state.startsWith(INTEGRITY_CONSTRAINT_CLASS)) {
                    return Optional.of(sql);
                }
                SQLException next = sql.getNextException();
                sql = (next == sql) ? null : next;
            }
        }
        return Optional.empty();
    }
}
