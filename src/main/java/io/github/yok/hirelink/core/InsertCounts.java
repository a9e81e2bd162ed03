package io.github.yok.hirelink.core;

import lombok.Value;

/**
 * Number of rows inserted per table by one batch.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class InsertCounts {

    int departments;
    int jobs;
    int hiredEmployees;

    /**
     * Returns the user-facing success message.
     *
     * @return message
     */
    public String getMessage() {
        return "Inserted " + departments + " departments, " + jobs + " jobs, " + hiredEmployees
                + " hired employees successfully.";
    }
}
