package io.github.yok.hirelink.core;

import io.github.yok.hirelink.model.Department;
import io.github.yok.hirelink.model.HireTimestamp;
import io.github.yok.hirelink.model.HiredEmployee;
import io.github.yok.hirelink.model.Job;
import io.github.yok.hirelink.parser.DepartmentRow;
import io.github.yok.hirelink.parser.HiredEmployeeRow;
import io.github.yok.hirelink.parser.JobRow;
import io.github.yok.hirelink.util.IsoTimestamps;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Checks a mixed batch of departments, jobs and hired employees against persisted ids and against
 * each other.
 *
 * <p>
 * Every rule is evaluated and every violation is collected, in input order (departments, jobs,
 * hired employees). A typed {@link ValidatedBatch} is produced only when no violation exists.
 * </p>
 *
 * <p>
 * A hired employee's {@code department_id} and {@code job_id} resolve against the union of the
 * persisted ids and the ids of the same batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BatchValidator {

    /**
     * Validates a batch.
     *
     * @param existingDepartmentIds department ids already stored
     * @param existingJobIds job ids already stored
     * @param newDepartments departments to add
     * @param newJobs jobs to add
     * @param newHiredEmployees hired employees to add
     * @return validated batch, or all violations
     */
    public ValidationResult validate(Set<Integer> existingDepartmentIds,
            Set<Integer> existingJobIds, List<DepartmentRow> newDepartments,
            List<JobRow> newJobs, List<HiredEmployeeRow> newHiredEmployees) {
        List<String> violations = new ArrayList<>();

        // 1) departments
        Set<Integer> batchDepartmentIds = new HashSet<>();
        List<Department> departments = new ArrayList<>();
        for (DepartmentRow row : newDepartments) {
            if (checkMaster("department", "Department", row.getId(), row.getName(),
                    existingDepartmentIds, batchDepartmentIds, violations)) {
                departments.add(new Department(row.getId(), row.getName()));
            }
        }

        // 2) jobs
        Set<Integer> batchJobIds = new HashSet<>();
        List<Job> jobs = new ArrayList<>();
        for (JobRow row : newJobs) {
            if (checkMaster("job", "Job", row.getId(), row.getName(), existingJobIds,
                    batchJobIds, violations)) {
                jobs.add(new Job(row.getId(), row.getName()));
            }
        }

        // 3) hired employees
        Set<Integer> batchEmployeeIds = new HashSet<>();
        List<HiredEmployee> employees = new ArrayList<>();
        for (HiredEmployeeRow row : newHiredEmployees) {
            HiredEmployee employee = checkEmployee(row, existingDepartmentIds, batchDepartmentIds,
                    existingJobIds, batchJobIds, batchEmployeeIds, violations);
            if (employee != null) {
                employees.add(employee);
            }
        }

        if (!violations.isEmpty()) {
            log.debug("Batch rejected: violations={}", violations.size());
            return ValidationResult.failed(violations);
        }
        return ValidationResult.ok(new ValidatedBatch(departments, jobs, employees));
    }

    /**
     * Checks one department or job row.
     *
     * @return {@code true} when the row is valid
     */
    private static boolean checkMaster(String entity, String label, Integer id, String name,
            Set<Integer> existingIds, Set<Integer> batchIds, List<String> violations) {
        int before = violations.size();
        if (id == null) {
            violations.add("Each " + entity + " must have a valid 'id' (integer).");
        }
        if (StringUtils.isEmpty(name)) {
            violations.add("Each " + entity + " must have a valid 'name' (string).");
        }
        if (id != null) {
            if (existingIds.contains(id)) {
                violations.add(label + " ID " + id + " already exists.");
            }
            if (!batchIds.add(id)) {
                violations.add(label + " ID " + id + " is duplicated in the batch.");
            }
        }
        return violations.size() == before;
    }

    /**
     * Checks one hired-employee row.
     *
     * @return typed row, or {@code null} when the row has violations
     */
    private static HiredEmployee checkEmployee(HiredEmployeeRow row,
            Set<Integer> existingDepartmentIds, Set<Integer> batchDepartmentIds,
            Set<Integer> existingJobIds, Set<Integer> batchJobIds, Set<Integer> batchEmployeeIds,
            List<String> violations) {
        int before = violations.size();

        if (row.getId() == null) {
            violations.add("Each employee must have a valid 'id' (integer).");
        } else if (!batchEmployeeIds.add(row.getId())) {
            violations.add("Employee ID " + row.getId() + " is duplicated in the batch.");
        }

        if (StringUtils.isEmpty(row.getName())) {
            violations.add("Each employee must have a valid 'name' (string).");
        }

        Optional<LocalDateTime> hiredAt = Optional.empty();
        if (StringUtils.isEmpty(row.getDatetime())) {
            violations.add("Each employee must have a valid 'datetime' (ISO format string).");
        } else {
            hiredAt = IsoTimestamps.parseLenient(row.getDatetime());
            if (hiredAt.isEmpty()) {
                violations.add("Invalid datetime format: " + row.getDatetime());
            }
        }

        Integer departmentId = row.getDepartmentId();
        if (departmentId == null) {
            violations.add("Each employee must have a valid 'department_id' (integer).");
        } else if (!existingDepartmentIds.contains(departmentId)
                && !batchDepartmentIds.contains(departmentId)) {
            violations.add("Department ID " + departmentId
                    + " does not exist and is not in the new departments list.");
        }

        Integer jobId = row.getJobId();
        if (jobId == null) {
            violations.add("Each employee must have a valid 'job_id' (integer).");
        } else if (!existingJobIds.contains(jobId) && !batchJobIds.contains(jobId)) {
            violations.add(
                    "Job ID " + jobId + " does not exist and is not in the new jobs list.");
        }

        if (violations.size() != before) {
            return null;
        }
        return new HiredEmployee(row.getId(), row.getName(), HireTimestamp.of(hiredAt.get()),
                departmentId, jobId);
    }
}
