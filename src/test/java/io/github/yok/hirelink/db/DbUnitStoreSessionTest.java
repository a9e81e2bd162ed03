package io.github.yok.hirelink.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.hirelink.config.ConnectionConfig;
import io.github.yok.hirelink.model.Department;
import io.github.yok.hirelink.model.HireTimestamp;
import io.github.yok.hirelink.model.HiredEmployee;
import io.github.yok.hirelink.model.Job;
import io.github.yok.hirelink.model.WorkforceRow;
import io.github.yok.hirelink.model.WorkforceTable;
import io.github.yok.hirelink.support.H2StoreSupport;
import io.github.yok.hirelink.util.SqlStates;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DbUnitStoreSessionTest {

    private ConnectionConfig config;
    private StoreSessionFactory sessionFactory;

    @BeforeEach
    void setUp() {
        config = H2StoreSupport.prepareDatabase();
        sessionFactory = H2StoreSupport.sessionFactory(config);
    }

    @Test
    void bulkInsert_正常ケース_コミットする_全行が永続化されること() throws Exception {
        try (StoreSession session = sessionFactory.open()) {
            session.begin();
            session.bulkInsert(WorkforceTable.DEPARTMENTS,
                    List.of(new Department(1, "Eng"), new Department(2, "Sales")));
            session.bulkInsert(WorkforceTable.HIRED_EMPLOYEES, List.of(new HiredEmployee(1, "A",
                    HireTimestamp.of(LocalDateTime.of(2021, 3, 4, 5, 6, 7)), 1, null)));
            session.commit();
        }

        assertEquals(2, H2StoreSupport.count(config, "departments"));
        try (StoreSession session = sessionFactory.open()) {
            List<WorkforceRow> rows = session.queryAll(WorkforceTable.HIRED_EMPLOYEES);
            assertEquals(List.of(new HiredEmployee(1, "A",
                    HireTimestamp.of(LocalDateTime.of(2021, 3, 4, 5, 6, 7)), 1, null)), rows);
        }
    }

    @Test
    void close_正常ケース_コミットせずに閉じる_ロールバックされること() throws Exception {
        try (StoreSession session = sessionFactory.open()) {
            session.begin();
            session.bulkInsert(WorkforceTable.JOBS, List.of(new Job(1, "SWE")));
        }
        assertEquals(0, H2StoreSupport.count(config, "jobs"));
    }

    @Test
    void bulkInsert_異常ケース_主キーが重複する_SQLState23の例外が原因に含まれること()
            throws Exception {
        H2StoreSupport.execute(config, "INSERT INTO jobs VALUES (1, 'SWE')");
        try (StoreSession session = sessionFactory.open()) {
            session.begin();
            SQLException e = assertThrows(SQLException.class,
                    () -> session.bulkInsert(WorkforceTable.JOBS, List.of(new Job(1, "Dup"))));
            assertTrue(SqlStates.findIntegrityViolation(e).isPresent());
        }
    }

    @Test
    void bulkInsert_正常ケース_空リストを指定する_何も実行されないこと() throws Exception {
        DbUnitStoreSession.OperationExecutor executor =
                mock(DbUnitStoreSession.OperationExecutor.class);
        DbUnitStoreSession session = new DbUnitStoreSession(mock(Connection.class),
                mock(DatabaseConnection.class), mock(DbDialectHandler.class), executor);

        session.bulkInsert(WorkforceTable.JOBS, List.of());

        verify(executor, never()).insert(any(), any());
    }

    @Test
    void bulkInsert_異常ケース_DBUnitが失敗する_SQLExceptionに変換されること() throws Exception {
        DbUnitStoreSession.OperationExecutor executor =
                mock(DbUnitStoreSession.OperationExecutor.class);
        DatabaseUnitException cause = new DatabaseUnitException("type cast");
        doThrow(cause).when(executor).insert(any(), any());
        DbUnitStoreSession session = new DbUnitStoreSession(mock(Connection.class),
                mock(DatabaseConnection.class), mock(DbDialectHandler.class), executor);

        SQLException e = assertThrows(SQLException.class,
                () -> session.bulkInsert(WorkforceTable.JOBS, List.of(new Job(1, "x"))));
        assertInstanceOf(DatabaseUnitException.class, e.getCause());
    }

    @Test
    void queryIds_正常ケース_登録済みIDがすべて返ること() throws Exception {
        H2StoreSupport.execute(config, "INSERT INTO departments VALUES (3, 'a'), (1, 'b')");
        try (StoreSession session = sessionFactory.open()) {
            assertEquals(Set.of(1, 3), session.queryIds(WorkforceTable.DEPARTMENTS));
            assertTrue(session.queryIds(WorkforceTable.JOBS).isEmpty());
        }
    }

    @Test
    void queryAll_正常ケース_ID順に型付き行が返ること() throws Exception {
        H2StoreSupport.execute(config, "INSERT INTO jobs VALUES (2, 'b'), (1, 'a')");
        try (StoreSession session = sessionFactory.open()) {
            assertEquals(List.of(new Job(1, "a"), new Job(2, "b")),
                    session.queryAll(WorkforceTable.JOBS));
        }
    }

    @Test
    void queryRows_正常ケース_パラメータを指定する_該当行が返ること() throws Exception {
        H2StoreSupport.execute(config, "INSERT INTO jobs VALUES (1, 'a'), (2, 'b')");
        try (StoreSession session = sessionFactory.open()) {
            List<Object[]> rows = session.queryRows("SELECT id, name FROM jobs WHERE id > ?", 1);
            assertEquals(1, rows.size());
            assertEquals("b", rows.get(0)[1]);
        }
    }

    @Test
    void truncate_正常ケース_全行が削除されること() throws Exception {
        H2StoreSupport.execute(config, "INSERT INTO departments VALUES (1, 'a'), (2, 'b')");
        try (StoreSession session = sessionFactory.open()) {
            session.begin();
            session.truncate(WorkforceTable.DEPARTMENTS);
            session.commit();
        }
        assertEquals(0, H2StoreSupport.count(config, "departments"));
    }

    @Test
    void truncate_正常ケース_方言のTRUNCATE文が実行されること() throws Exception {
        Connection jdbc = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(jdbc.createStatement()).thenReturn(st);
        DbDialectHandler dialect = mock(DbDialectHandler.class);
        when(dialect.truncateSql("jobs")).thenReturn("TRUNCATE TABLE jobs");
        DbUnitStoreSession session =
                new DbUnitStoreSession(jdbc, mock(DatabaseConnection.class), dialect);

        session.truncate(WorkforceTable.JOBS);

        verify(st).execute("TRUNCATE TABLE jobs");
    }
}
