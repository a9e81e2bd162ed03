package io.github.yok.hirelink.db;

import io.github.yok.hirelink.model.WorkforceTable;
import lombok.Generated;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITableMetaData;
import org.dbunit.dataset.datatype.DataType;

/**
 * Builds DBUnit table metadata for the known tables.
 *
 * <p>
 * DBUnit replaces these column types with the store's own metadata when it executes an
 * operation; they only describe the dataset side.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class WorkforceTableMetaData {

    @Generated
    private WorkforceTableMetaData() {}

    /**
     * Creates the metadata of a table.
     *
     * @param table table
     * @return metadata with {@code id} as primary key
     */
    static ITableMetaData of(WorkforceTable table) {
        Column[] columns = new Column[table.getColumns().size()];
        for (int i = 0; i < columns.length; i++) {
            String name = table.getColumns().get(i);
            columns[i] = new Column(name, dataTypeOf(name),
                    "id".equals(name) ? Column.NO_NULLS : Column.NULLABLE);
        }
        return new DefaultTableMetaData(table.getTableName(), columns, new String[] {"id"});
    }

    private static DataType dataTypeOf(String column) {
        switch (column) {
            case "id":
            case "department_id":
            case "job_id":
                return DataType.INTEGER;
            case "datetime":
                return DataType.TIMESTAMP;
            default:
                return DataType.VARCHAR;
        }
    }
}
