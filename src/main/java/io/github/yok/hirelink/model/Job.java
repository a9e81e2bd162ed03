package io.github.yok.hirelink.model;

import lombok.Value;

/**
 * A job row.
 */
@Value
public class Job implements WorkforceRow {

    int id;
    String name;

    @Override
    public WorkforceTable table() {
        return WorkforceTable.JOBS;
    }

    @Override
    public Object[] toColumnValues() {
        return new Object[] {id, name};
    }
}
