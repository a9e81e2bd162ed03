package io.github.yok.hirelink.parser;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Batch-insert request: new departments, jobs and hired employees.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class BatchRequest {

    List<DepartmentRow> departments;
    List<JobRow> jobs;
    List<HiredEmployeeRow> hiredEmployees;

    /**
     * Creates a request; {@code null} lists are treated as empty.
     *
     * @param departments new departments
     * @param jobs new jobs
     * @param hiredEmployees new hired employees
     */
    public BatchRequest(List<DepartmentRow> departments, List<JobRow> jobs,
            List<HiredEmployeeRow> hiredEmployees) {
        this.departments = copy(departments);
        this.jobs = copy(jobs);
        this.hiredEmployees = copy(hiredEmployees);
    }

    /**
     * Returns the row count across all three lists.
     *
     * @return total rows
     */
    public int totalRows() {
        return departments.size() + jobs.size() + hiredEmployees.size();
    }

    private static <T> List<T> copy(List<T> rows) {
        return (rows == null) ? ImmutableList.of() : ImmutableList.copyOf(rows);
    }
}
