package io.github.yok.hirelink.model;

import lombok.Value;

/**
 * A hired-employee row.
 *
 * <p>
 * {@code name}, {@code datetime}, {@code departmentId} and {@code jobId} are nullable: rows
 * arriving through historical migration or restore may lack them. Rows produced by the batch
 * validator always carry every field.
 * </p>
 */
@Value
public class HiredEmployee implements WorkforceRow {

    int id;
    String name;
    HireTimestamp datetime;
    Integer departmentId;
    Integer jobId;

    @Override
    public WorkforceTable table() {
        return WorkforceTable.HIRED_EMPLOYEES;
    }

    @Override
    public Object[] toColumnValues() {
        Object hiredAt = (datetime == null) ? null : datetime.toJdbcValue();
        return new Object[] {id, name, hiredAt, departmentId, jobId};
    }
}
