package io.github.yok.hirelink.report;

import io.github.yok.hirelink.core.ErrorKind;
import io.github.yok.hirelink.core.WorkforceException;
import io.github.yok.hirelink.db.StoreSession;
import io.github.yok.hirelink.db.StoreSessionFactory;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link WorkforceReportQueries} implemented with portable SQL ({@code EXTRACT}, {@code CASE}).
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcWorkforceReportQueries implements WorkforceReportQueries {

    private static final String HIRED_PER_QUARTER_SQL = "SELECT d.name, j.name,"
            + " SUM(CASE WHEN EXTRACT(MONTH FROM h.datetime) BETWEEN 1 AND 3 THEN 1 ELSE 0 END),"
            + " SUM(CASE WHEN EXTRACT(MONTH FROM h.datetime) BETWEEN 4 AND 6 THEN 1 ELSE 0 END),"
            + " SUM(CASE WHEN EXTRACT(MONTH FROM h.datetime) BETWEEN 7 AND 9 THEN 1 ELSE 0 END),"
            + " SUM(CASE WHEN EXTRACT(MONTH FROM h.datetime) BETWEEN 10 AND 12 THEN 1 ELSE 0 END)"
            + " FROM hired_employees h"
            + " JOIN departments d ON d.id = h.department_id"
            + " JOIN jobs j ON j.id = h.job_id"
            + " WHERE EXTRACT(YEAR FROM h.datetime) = ?"
            + " GROUP BY d.name, j.name"
            + " ORDER BY d.name, j.name";

    private static final String HIRES_PER_DEPARTMENT_SQL = "SELECT d.id, d.name, COUNT(h.id)"
            + " FROM departments d"
            + " JOIN hired_employees h ON h.department_id = d.id"
            + " WHERE EXTRACT(YEAR FROM h.datetime) = ?"
            + " GROUP BY d.id, d.name"
            + " ORDER BY COUNT(h.id) DESC, d.id";

    private final StoreSessionFactory sessionFactory;

    @Override
    public List<QuarterlyHires> hiredPerQuarter(int year) {
        List<QuarterlyHires> result = new ArrayList<>();
        for (Object[] row : query(HIRED_PER_QUARTER_SQL, year)) {
            result.add(new QuarterlyHires((String) row[0], (String) row[1], toInt(row[2]),
                    toInt(row[3]), toInt(row[4]), toInt(row[5])));
        }
        log.info("[report] hired-per-quarter year={} rows={}", year, result.size());
        return result;
    }

    @Override
    public List<DepartmentHires> departmentsHiringAboveAverage(int year) {
        List<DepartmentHires> all = new ArrayList<>();
        for (Object[] row : query(HIRES_PER_DEPARTMENT_SQL, year)) {
            all.add(new DepartmentHires(toInt(row[0]), (String) row[1], toInt(row[2])));
        }
        if (all.isEmpty()) {
            return all;
        }
        double mean = all.stream().mapToInt(DepartmentHires::getHired).average().orElse(0);
        List<DepartmentHires> result =
                all.stream().filter(d -> d.getHired() > mean).collect(Collectors.toList());
        log.info("[report] departments-above-average year={} mean={} rows={}", year, mean,
                result.size());
        return result;
    }

    private List<Object[]> query(String sql, int year) {
        try (StoreSession session = sessionFactory.open()) {
            return session.queryRows(sql, year);
        } catch (SQLException e) {
            throw new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                    "Failed to run the report query.", e);
        }
    }

    private static int toInt(Object value) {
        return (value == null) ? 0 : ((Number) value).intValue();
    }
}
