package io.github.yok.prismlink.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal CLI error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error using SLF4J.</li>
 * <li>Writes a concise message to {@code System.err}, naming the resolved resource when the cause
 * is a {@link PrismException} that carries one.</li>
 * <li>Does not terminate the JVM by itself (callers decide how to end the process).</li>
 * <li>In tests, callers can switch behavior to throwing an exception via thread-local flags.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of ending the process" for the current thread (useful for
     * tests).
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
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + describe(cause));
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Renders a one-line description of a failure for terminal output.
     *
     * @param cause failure to describe
     * @return {@code [KIND] message (id=...)} for Prism failures, the plain message otherwise
     */
    static String describe(Throwable cause) {
        if (cause instanceof PrismException) {
            PrismException pe = (PrismException) cause;
            StringBuilder sb = new StringBuilder();
            sb.append('[').append(pe.getKind()).append("] ").append(pe.getMessage());
            if (pe.getResourceId() != null) {
                sb.append(" (id=").append(pe.getResourceId()).append(')');
            }
            return sb.toString();
        }
        return cause.getMessage();
    }
}
