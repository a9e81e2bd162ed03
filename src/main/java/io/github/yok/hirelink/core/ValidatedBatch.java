package io.github.yok.hirelink.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.hirelink.model.Department;
import io.github.yok.hirelink.model.HiredEmployee;
import io.github.yok.hirelink.model.Job;
import java.util.List;
import lombok.Value;

/**
 * Typed batch that passed validation and is ready to be written.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ValidatedBatch {

    ImmutableList<Department> departments;
    ImmutableList<Job> jobs;
    ImmutableList<HiredEmployee> hiredEmployees;

    /**
     * Creates a batch.
     *
     * @param departments departments in input order
     * @param jobs jobs in input order
     * @param hiredEmployees hired employees in input order
     */
    public ValidatedBatch(List<Department> departments, List<Job> jobs,
            List<HiredEmployee> hiredEmployees) {
        this.departments = ImmutableList.copyOf(departments);
        this.jobs = ImmutableList.copyOf(jobs);
        this.hiredEmployees = ImmutableList.copyOf(hiredEmployees);
    }
}
