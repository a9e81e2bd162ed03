package io.github.yok.hirelink.report;

import lombok.Value;

/**
 * Hire count of one department in a year.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class DepartmentHires {

    int id;
    String department;
    int hired;
}
