package io.github.yok.hirelink.core;

import io.github.yok.hirelink.model.WorkforceTable;
import lombok.Value;

/**
 * Result of restoring one table.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RestoreSummary {

    WorkforceTable table;
    int restored;

    /**
     * Returns the user-facing success message.
     *
     * @return message
     */
    public String getMessage() {
        return "Successfully restored " + restored + " records to " + table + ".";
    }
}
