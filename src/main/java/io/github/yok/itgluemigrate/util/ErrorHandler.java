package io.github.yok.itgluemigrate.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that reports a fatal CLI error through SLF4J and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * The methods return the process exit status the caller should finish with; they never call
 * {@link System#exit(int)} themselves. In tests, callers can switch to throwing an
 * {@link IllegalStateException} instead via {@link #disableExitForCurrentThread()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /**
     * Exit status reported for fatal errors and failed migrations.
     */
    public static final int EXIT_FAILURE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {
        // Utility class; do not instantiate.
    }

    /**
     * Switch to "throw exception instead of returning an exit status" for the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message with its root cause and prints {@code ERROR: <message>} to stderr.
     *
     * @param message message to log
     * @param cause root cause
     * @return {@link #EXIT_FAILURE}
     */
    public static int errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
        return EXIT_FAILURE;
    }

    /**
     * Logs the message and prints {@code ERROR: <message>} to stderr.
     *
     * @param message message to log
     * @return {@link #EXIT_FAILURE}
     */
    public static int errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
        return EXIT_FAILURE;
    }
}
