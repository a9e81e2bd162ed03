package io.github.yok.hirelink.model;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Enumerates the three workforce tables handled by HireLink.
 *
 * <p>
 * Constants are declared in load order: departments and jobs come before hired employees, which
 * reference both of them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum WorkforceTable {
    // Department master
    DEPARTMENTS("departments", ImmutableList.of("id", "name")),
    // Job master
    JOBS("jobs", ImmutableList.of("id", "name")),
    // Hired employees (reference departments and jobs)
    HIRED_EMPLOYEES("hired_employees",
            ImmutableList.of("id", "name", "datetime", "department_id", "job_id"));

    // Physical table name in the store, also used for artifact and CSV object names
    private final String tableName;

    // Column names in their fixed order (CSV column order, SELECT order)
    private final List<String> columns;

    /**
     * Resolves a table by its physical name.
     *
     * @param name table name, case-insensitive; may be {@code null}
     * @return matching table, or empty if the name is not one of the known tables
     */
    public static Optional<WorkforceTable> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values()).filter(t -> t.tableName.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    /**
     * Returns the tables in load order.
     *
     * @return immutable list of all tables, parents first
     */
    public static List<WorkforceTable> loadOrder() {
        return ImmutableList.copyOf(values());
    }

    @Override
    public String toString() {
        return tableName;
    }
}
