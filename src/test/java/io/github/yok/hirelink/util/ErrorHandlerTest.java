package io.github.yok.hirelink.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.hirelink.core.ErrorKind;
import io.github.yok.hirelink.core.WorkforceException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.util.List;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void コンストラクタ_正常ケース_リフレクションで生成する_インスタンスが生成されること() throws Exception {
        Constructor<ErrorHandler> constructor = ErrorHandler.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        ErrorHandler instance = constructor.newInstance();
        assertEquals(ErrorHandler.class, instance.getClass());
    }

    @Test
    void report_正常ケース_検証エラーを指定する_違反一覧が標準エラーへ出力され422が返ること() {
        WorkforceException e = WorkforceException.validationFailure(
                List.of("Department ID 99 does not exist and is not in the new departments list.",
                        "Each employee must have a valid 'name' (string)."));
        String err = captureErr(() -> assertEquals(422, ErrorHandler.report(e)));
        assertTrue(err.contains("ERROR: Batch validation failed with 2 violation(s)."));
        assertTrue(err.contains("  - Department ID 99 does not exist"));
        assertTrue(err.contains("  - Each employee must have a valid 'name' (string)."));
    }

    @Test
    void report_正常ケース_基盤障害を指定する_500が返ること() {
        WorkforceException e = new WorkforceException(ErrorKind.INFRASTRUCTURE_FAULT,
                "Failed to create a new backup for the database.", new RuntimeException("io"));
        String err = captureErr(() -> assertEquals(500, ErrorHandler.report(e)));
        assertTrue(err.contains("ERROR: Failed to create a new backup for the database."));
    }

    @Test
    void report_正常ケース_未検出を指定する_404が返ること() {
        WorkforceException e = new WorkforceException(ErrorKind.NOT_FOUND,
                "Backup file for table 'jobs' not found.", "jobs", null);
        String err = captureErr(() -> assertEquals(404, ErrorHandler.report(e)));
        assertTrue(err.contains("Backup file for table 'jobs' not found."));
    }

    @Test
    void usage_正常ケース_引数誤りを指定する_標準エラーへ出力されること() {
        String err = captureErr(() -> ErrorHandler.usage("Invalid year: twenty"));
        assertEquals("ERROR: Invalid year: twenty", err.trim());
    }

    @Test
    void fatal_正常ケース_ラップされた例外を指定する_原因の詳細は標準エラーへ出力されないこと() {
        RuntimeException cause = new RuntimeException("wrapper",
                new IllegalStateException("password authentication failed for user hirelink"));
        String err = captureErr(() -> ErrorHandler.fatal("An unexpected error occurred.", cause));
        assertEquals("ERROR: An unexpected error occurred.", err.trim());
        assertFalse(err.contains("password"));
        assertFalse(err.contains("wrapper"));
    }

    private static String captureErr(Runnable action) {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            action.run();
        } finally {
            System.setErr(originalErr);
        }
        return err.toString();
    }
}
