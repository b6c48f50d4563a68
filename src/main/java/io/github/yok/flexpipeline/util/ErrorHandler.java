package io.github.yok.flexpipeline.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal pipeline error: logs it through SLF4J and echoes a one-line message to
 * {@code System.err}.
 *
 * <p>
 * The JVM is never terminated here; the command-line runner simply returns after reporting.
 * Tests can make the current thread throw {@link IllegalStateException} instead, so the report
 * becomes assertable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {
        // Utility class; do not instantiate.
    }

    /**
     * Makes {@code errorAndExit} throw on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores the reporting behavior on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a fatal error with its cause.
     *
     * @param message summary of what failed
     * @param cause underlying exception
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Reports a fatal error without a cause (for example a usage error).
     *
     * @param message summary of what failed
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
