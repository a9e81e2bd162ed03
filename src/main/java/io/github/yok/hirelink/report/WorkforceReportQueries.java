package io.github.yok.hirelink.report;

import java.util.List;

/**
 * Read-only aggregate queries over hired employees.
 *
 * @author Yasuharu.Okawauchi
 */
public interface WorkforceReportQueries {

    /**
     * Year reported when the caller gives none.
     */
    int DEFAULT_YEAR = 2021;

    /**
     * Counts hires per (department, job) pair and quarter.
     *
     * @param year calendar year of the hire timestamp
     * @return one entry per pair with at least one hire, sorted by department then job
     */
    List<QuarterlyHires> hiredPerQuarter(int year);

    /**
     * Lists departments whose hire count is strictly above the mean of all departments that hired
     * at least once in the year.
     *
     * @param year calendar year of the hire timestamp
     * @return departments sorted by hire count, highest first
     */
    List<DepartmentHires> departmentsHiringAboveAverage(int year);
}
