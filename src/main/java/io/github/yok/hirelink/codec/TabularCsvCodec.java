package io.github.yok.hirelink.codec;

import io.github.yok.hirelink.model.Department;
import io.github.yok.hirelink.model.HireTimestamp;
import io.github.yok.hirelink.model.HiredEmployee;
import io.github.yok.hirelink.model.Job;
import io.github.yok.hirelink.model.WorkforceRow;
import io.github.yok.hirelink.model.WorkforceTable;
import io.github.yok.hirelink.util.IsoTimestamps;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * Decodes headerless CSV text into typed rows.
 *
 * <p>
 * Column order is fixed per table ({@link WorkforceTable#getColumns()}). Coercion rules:
 * </p>
 * <ul>
 * <li>Blank cells become {@code null}, except {@code name}: a missing name fails the
 * transformation.</li>
 * <li>{@code id}, {@code department_id} and {@code job_id} are integers; an integral decimal
 * such as {@code 3.0} is accepted. A missing {@code id} or any non-integer value fails the
 * transformation.</li>
 * <li>{@code datetime} must be {@code yyyy-MM-dd'T'HH:mm:ss'Z'}; other values become
 * {@code null}.</li>
 * <li>Short records are padded with {@code null}; records with extra cells fail.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TabularCsvCodec {

    private static final CSVFormat FORMAT =
            CSVFormat.DEFAULT.builder().setIgnoreEmptyLines(true).setTrim(true).get();

    /**
     * Decodes the rows of one table.
     *
     * @param table table whose column layout applies
     * @param csvText CSV text without header
     * @return typed rows in file order
     * @throws CsvTransformException if a record cannot be typed or the text is not valid CSV
     */
    public List<WorkforceRow> decode(WorkforceTable table, String csvText)
            throws CsvTransformException {
        List<WorkforceRow> rows = new ArrayList<>();
        int columnCount = table.getColumns().size();
        try (CSVParser parser = CSVParser.parse(new StringReader(csvText), FORMAT)) {
            for (CSVRecord record : parser) {
                if (record.size() > columnCount) {
                    throw new CsvTransformException(record.getRecordNumber(), "expected at most "
                            + columnCount + " cells but found " + record.size());
                }
                String[] cells = new String[columnCount];
                for (int i = 0; i < record.size(); i++) {
                    cells[i] = StringUtils.trimToNull(record.get(i));
                }
                rows.add(toRow(table, record.getRecordNumber(), cells));
            }
        } catch (IOException | UncheckedIOException e) {
            throw new CsvTransformException("Malformed CSV for " + table, e);
        }
        log.debug("[{}] transformed rows={}", table, rows.size());
        return rows;
    }

    private static WorkforceRow toRow(WorkforceTable table, long recordNumber, String[] cells)
            throws CsvTransformException {
        Integer id = toInteger(recordNumber, "id", cells[0]);
        if (id == null) {
            throw new CsvTransformException(recordNumber, "missing 'id'");
        }
        if (cells[1] == null) {
            throw new CsvTransformException(recordNumber, "missing 'name'");
        }
        switch (table) {
            case DEPARTMENTS:
                return new Department(id, cells[1]);
            case JOBS:
                return new Job(id, cells[1]);
            default:
                HireTimestamp hiredAt =
                        IsoTimestamps.parseStrict(cells[2]).map(HireTimestamp::of).orElse(null);
                return new HiredEmployee(id, cells[1], hiredAt,
                        toInteger(recordNumber, "department_id", cells[3]),
                        toInteger(recordNumber, "job_id", cells[4]));
        }
    }

    private static Integer toInteger(long recordNumber, String column, String cell)
            throws CsvTransformException {
        if (cell == null) {
            return null;
        }
        try {
            return new BigDecimal(cell).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new CsvTransformException(recordNumber,
                    "'" + column + "' is not an integer: " + cell);
        }
    }
}
