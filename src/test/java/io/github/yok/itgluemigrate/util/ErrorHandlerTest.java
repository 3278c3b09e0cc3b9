package io.github.yok.itgluemigrate.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorHandler}. */
class ErrorHandlerTest {

    @Test
    void errorAndExit_異常ケース_exit無効時はIllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("Plan file not found", cause));
            assertEquals("Plan file not found", ex.getMessage());
            assertSame(cause, ex.getCause());

            IllegalStateException ex2 = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("Cannot specify both --org and --all"));
            assertEquals("Cannot specify both --org and --all", ex2.getMessage());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_正常ケース_原因付きで標準エラーへ出力し終了コード1を返すこと() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = ErrorHandler.errorAndExit("Fatal error", new RuntimeException("root"));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString(StandardCharsets.UTF_8);
        assertEquals(ErrorHandler.EXIT_FAILURE, code);
        assertTrue(message.contains("ERROR: Fatal error"));
        assertTrue(message.contains("root"));
    }

    @Test
    void errorAndExit_正常ケース_メッセージのみでも終了コード1を返すこと() {
        PrintStream originalErr = System.err;
        try {
            System.setErr(new PrintStream(new ByteArrayOutputStream(), true,
                    StandardCharsets.UTF_8));
            assertEquals(1, ErrorHandler.errorAndExit("No command given."));
        } finally {
            System.setErr(originalErr);
        }
    }
}
