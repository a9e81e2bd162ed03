package io.github.yok.hirelink.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.hirelink.model.WorkforceTable;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Result of a full backup.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class BackupSummary {

    // Rows written per backed-up table, in backup order
    ImmutableMap<WorkforceTable, Integer> counts;
    // Tables skipped because they were empty
    ImmutableList<WorkforceTable> skipped;

    /**
     * Creates a summary.
     *
     * @param counts rows per backed-up table
     * @param skipped empty tables
     */
    public BackupSummary(Map<WorkforceTable, Integer> counts, List<WorkforceTable> skipped) {
        this.counts = ImmutableMap.copyOf(counts);
        this.skipped = ImmutableList.copyOf(skipped);
    }

    /**
     * Returns the user-facing success message.
     *
     * @return message
     */
    public String getMessage() {
        return "Backup created successfully for " + counts.size() + " table(s)"
                + (skipped.isEmpty() ? "." : "; skipped empty " + skipped + ".");
    }
}
