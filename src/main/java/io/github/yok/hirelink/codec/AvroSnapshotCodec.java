package io.github.yok.hirelink.codec;

import io.github.yok.hirelink.model.Department;
import io.github.yok.hirelink.model.HireTimestamp;
import io.github.yok.hirelink.model.HiredEmployee;
import io.github.yok.hirelink.model.Job;
import io.github.yok.hirelink.model.WorkforceRow;
import io.github.yok.hirelink.model.WorkforceTable;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.file.DataFileReader;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.file.SeekableByteArrayInput;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;

/**
 * Encodes table snapshots as Avro object container files and decodes them back.
 *
 * <p>
 * Each file embeds its writer schema. Timestamps travel as {@code yyyy-MM-dd'T'HH:mm:ss'Z'}
 * strings; a value that cannot be parsed on the way back is kept as raw text instead of failing
 * the decode.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AvroSnapshotCodec {

    // Namespace of every record schema
    static final String NAMESPACE = "io.github.yok.hirelink";

    private static final Map<WorkforceTable, Schema> SCHEMAS = new EnumMap<>(WorkforceTable.class);

    static {
        SCHEMAS.put(WorkforceTable.DEPARTMENTS, SchemaBuilder.record("Department")
                .namespace(NAMESPACE).fields().requiredInt("id").requiredString("name")
                .endRecord());
        SCHEMAS.put(WorkforceTable.JOBS, SchemaBuilder.record("Job").namespace(NAMESPACE)
                .fields().requiredInt("id").requiredString("name").endRecord());
        SCHEMAS.put(WorkforceTable.HIRED_EMPLOYEES, SchemaBuilder.record("HiredEmployee")
                .namespace(NAMESPACE).fields().requiredInt("id").requiredString("name")
                .optionalString("datetime").optionalInt("department_id").optionalInt("job_id")
                .endRecord());
    }

    /**
     * Returns the record schema of a table.
     *
     * @param table table
     * @return Avro schema
     */
    public static Schema schemaOf(WorkforceTable table) {
        return SCHEMAS.get(table);
    }

    /**
     * Encodes rows of one table.
     *
     * @param table table the rows belong to
     * @param rows rows to encode
     * @return container file bytes
     * @throws IOException if Avro cannot serialize a row
     */
    public byte[] encode(WorkforceTable table, List<? extends WorkforceRow> rows)
            throws IOException {
        Schema schema = schemaOf(table);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DataFileWriter<GenericRecord> writer =
                new DataFileWriter<>(new GenericDatumWriter<GenericRecord>(schema))) {
            writer.create(schema, out);
            for (WorkforceRow row : rows) {
                writer.append(toRecord(schema, row));
            }
        } catch (DataFileWriter.AppendWriteException | AvroRuntimeException e) {
            throw new IOException("Failed to encode rows of " + table, e);
        }
        log.debug("[{}] encoded rows={}, bytes={}", table, rows.size(), out.size());
        return out.toByteArray();
    }

    /**
     * Decodes a container file using the table's schema as reader schema.
     *
     * @param table table the file belongs to
     * @param bytes container file bytes
     * @return decoded rows, in file order
     * @throws IOException if the bytes are not a readable container of that table
     */
    public List<WorkforceRow> decode(WorkforceTable table, byte[] bytes) throws IOException {
        List<WorkforceRow> rows = new ArrayList<>();
        GenericDatumReader<GenericRecord> datumReader =
                new GenericDatumReader<>(null, schemaOf(table));
        try (DataFileReader<GenericRecord> reader =
                new DataFileReader<>(new SeekableByteArrayInput(bytes), datumReader)) {
            for (GenericRecord record : reader) {
                rows.add(fromRecord(table, record));
            }
        } catch (AvroRuntimeException e) {
            throw new IOException("Failed to decode backup of " + table, e);
        }
        log.debug("[{}] decoded rows={}", table, rows.size());
        return rows;
    }

    private static GenericRecord toRecord(Schema schema, WorkforceRow row) {
        GenericData.Record record = new GenericData.Record(schema);
        if (row instanceof HiredEmployee) {
            HiredEmployee e = (HiredEmployee) row;
            record.put("id", e.getId());
            record.put("name", e.getName());
            record.put("datetime", (e.getDatetime() == null) ? null : e.getDatetime().toText());
            record.put("department_id", e.getDepartmentId());
            record.put("job_id", e.getJobId());
        } else if (row instanceof Department) {
            record.put("id", row.getId());
            record.put("name", ((Department) row).getName());
        } else {
            record.put("id", row.getId());
            record.put("name", ((Job) row).getName());
        }
        return record;
    }

    private static WorkforceRow fromRecord(WorkforceTable table, GenericRecord record) {
        int id = (Integer) record.get("id");
        String name = asString(record.get("name"));
        switch (table) {
            case DEPARTMENTS:
                return new Department(id, name);
            case JOBS:
                return new Job(id, name);
            default:
                String datetime = asString(record.get("datetime"));
                return new HiredEmployee(id, name,
                        (datetime == null) ? null : HireTimestamp.fromText(datetime),
                        (Integer) record.get("department_id"), (Integer) record.get("job_id"));
        }
    }

    // Avro hands strings back as Utf8
    private static String asString(Object value) {
        return (value == null) ? null : value.toString();
    }
}
