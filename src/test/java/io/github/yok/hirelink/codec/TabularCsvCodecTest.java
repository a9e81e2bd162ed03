package io.github.yok.hirelink.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.hirelink.model.HireTimestamp;
import io.github.yok.hirelink.model.HiredEmployee;
import io.github.yok.hirelink.model.Job;
import io.github.yok.hirelink.model.WorkforceRow;
import io.github.yok.hirelink.model.WorkforceTable;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class TabularCsvCodecTest {

    private final TabularCsvCodec codec = new TabularCsvCodec();

    @Test
    void decode_正常ケース_従業員CSVを指定する_列ごとに型変換されること() throws Exception {
        String csv = "4535,Marcelo Gonzalez,2021-07-27T16:02:08Z,1,2\n"
                + "4572,Lidia Mendez,2021-07-27T19:04:09Z,1.0,2.0\n";

        List<WorkforceRow> rows = codec.decode(WorkforceTable.HIRED_EMPLOYEES, csv);

        assertEquals(2, rows.size());
        assertEquals(new HiredEmployee(4535, "Marcelo Gonzalez",
                HireTimestamp.of(LocalDateTime.of(2021, 7, 27, 16, 2, 8)), 1, 2), rows.get(0));
        HiredEmployee second = (HiredEmployee) rows.get(1);
        assertEquals(Integer.valueOf(1), second.getDepartmentId());
        assertEquals(Integer.valueOf(2), second.getJobId());
    }

    @Test
    void decode_正常ケース_空セルと不正日時を含む_nullとなること() throws Exception {
        String csv = "2,Ann Lee,2021-07-27 16:02:08,,\n3,Ty Hofer,,8\n";

        List<WorkforceRow> rows = codec.decode(WorkforceTable.HIRED_EMPLOYEES, csv);

        HiredEmployee first = (HiredEmployee) rows.get(0);
        assertEquals("Ann Lee", first.getName());
        assertNull(first.getDatetime());
        assertNull(first.getDepartmentId());
        assertNull(first.getJobId());

        HiredEmployee second = (HiredEmployee) rows.get(1);
        assertEquals(Integer.valueOf(8), second.getDepartmentId());
        assertNull(second.getJobId());
    }

    @Test
    void decode_正常ケース_引用符付きのカンマを含む_1セルとして扱われること() throws Exception {
        List<WorkforceRow> rows =
                codec.decode(WorkforceTable.JOBS, "1,\"Marketing Assistant, Jr\"\n\n2,VP Sales\n");
        assertEquals(List.of(new Job(1, "Marketing Assistant, Jr"), new Job(2, "VP Sales")), rows);
    }

    @Test
    void decode_異常ケース_idが整数でない_レコード番号付きで失敗すること() {
        CsvTransformException e = assertThrows(CsvTransformException.class,
                () -> codec.decode(WorkforceTable.JOBS, "1,Recruiter\nabc,Engineer\n"));
        assertEquals(2, e.getRecordNumber());
        assertTrue(e.getMessage().contains("record 2"));
    }

    @Test
    void decode_異常ケース_外部キーが小数である_失敗すること() {
        assertThrows(CsvTransformException.class, () -> codec
                .decode(WorkforceTable.HIRED_EMPLOYEES, "1,A,2021-01-01T00:00:00Z,1.5,2\n"));
    }

    @Test
    void decode_異常ケース_idが空である_失敗すること() {
        CsvTransformException e = assertThrows(CsvTransformException.class,
                () -> codec.decode(WorkforceTable.DEPARTMENTS, ",Supply Chain\n"));
        assertEquals(1, e.getRecordNumber());
    }

    @Test
    void decode_異常ケース_従業員のnameが空である_レコード番号付きで失敗すること() {
        CsvTransformException e = assertThrows(CsvTransformException.class,
                () -> codec.decode(WorkforceTable.HIRED_EMPLOYEES,
                        "1,Harold Vogt,2021-11-07T02:48:42Z,2,96\n2, ,2021-07-27T16:02:08Z,1,1\n"));
        assertEquals(2, e.getRecordNumber());
        assertEquals("record 2: missing 'name'", e.getMessage());
    }

    @Test
    void decode_異常ケース_職種のnameがない_失敗すること() {
        assertThrows(CsvTransformException.class,
                () -> codec.decode(WorkforceTable.JOBS, "1,Recruiter\n2\n"));
    }

    @Test
    void decode_異常ケース_列数が多すぎる_失敗すること() {
        assertThrows(CsvTransformException.class,
                () -> codec.decode(WorkforceTable.DEPARTMENTS, "1,Sales,extra\n"));
    }

    @Test
    void decode_正常ケース_空文字列を指定する_空リストが返ること() throws Exception {
        assertTrue(codec.decode(WorkforceTable.JOBS, "").isEmpty());
    }
}
