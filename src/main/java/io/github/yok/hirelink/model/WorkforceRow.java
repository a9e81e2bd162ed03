package io.github.yok.hirelink.model;

/**
 * Common view of a typed row belonging to one of the {@link WorkforceTable}s.
 */
public interface WorkforceRow {

    /**
     * Returns the identifier of the row.
     *
     * @return row id
     */
    int getId();

    /**
     * Returns the table this row belongs to.
     *
     * @return owning table
     */
    WorkforceTable table();

    /**
     * Returns the column values in {@link WorkforceTable#getColumns()} order, typed for JDBC
     * binding.
     *
     * @return column values; {@code null} entries represent SQL NULL
     */
    Object[] toColumnValues();
}
