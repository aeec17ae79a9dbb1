package io.github.yok.flexbackup.util;

import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that reports a fatal backup error and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error with its stack trace using SLF4J.</li>
 * <li>Writes {@code ERROR: <message>} followed by the cause chain, one cause per line, to
 * {@code System.err}.</li>
 * <li>Returns the exit code for the caller to use; the JVM is not terminated here.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    /**
     * Exit code reported for a failed run.
     */
    public static final int EXIT_FAILURE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
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
     * Logs the given message and cause at error level and prints the message with its cause chain
     * to {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @return {@link #EXIT_FAILURE}
     * @throws IllegalStateException if reporting is disabled for the current thread
     */
    public static int errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + describeCauses(cause));
        return EXIT_FAILURE;
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     * @return {@link #EXIT_FAILURE}
     * @throws IllegalStateException if reporting is disabled for the current thread
     */
    public static int errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
        return EXIT_FAILURE;
    }

    static String describeCauses(Throwable cause) {
        List<Throwable> chain = ExceptionUtils.getThrowableList(cause);
        return chain.stream().map(t -> "  caused by: " + StringUtils.defaultString(t.getMessage(),
                t.getClass().getSimpleName())).collect(Collectors.joining("\n"));
    }
}
