package io.github.yok.hirelink.core;

import com.google.common.collect.ImmutableMap;
import io.github.yok.hirelink.model.WorkforceTable;
import java.util.Map;
import lombok.Value;

/**
 * Result of a historical migration.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class MigrationSummary {

    // Rows appended per table, in migration order
    ImmutableMap<WorkforceTable, Integer> counts;

    /**
     * Creates a summary.
     *
     * @param counts rows appended per table
     */
    public MigrationSummary(Map<WorkforceTable, Integer> counts) {
        this.counts = ImmutableMap.copyOf(counts);
    }

    /**
     * Returns the user-facing success message.
     *
     * @return message
     */
    public String getMessage() {
        return "Historical data migration completed successfully.";
    }
}
