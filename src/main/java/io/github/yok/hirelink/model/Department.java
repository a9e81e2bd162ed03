package io.github.yok.hirelink.model;

import lombok.Value;

/**
 * A department row.
 */
@Value
public class Department implements WorkforceRow {

    int id;
    String name;

    @Override
    public WorkforceTable table() {
        return WorkforceTable.DEPARTMENTS;
    }

    @Override
    public Object[] toColumnValues() {
        return new Object[] {id, name};
    }
}
