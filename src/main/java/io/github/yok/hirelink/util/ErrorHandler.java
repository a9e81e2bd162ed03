package io.github.yok.hirelink.util;

import io.github.yok.hirelink.core.WorkforceException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Logs command failures and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Server-side faults are logged with the full stack trace, caller mistakes at warn level. Nothing
 * here terminates the JVM.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private ErrorHandler() {}

    /**
     * Reports an ingestion failure, one line per violation.
     *
     * @param e failure to report
     * @return HTTP-equivalent status of the failure's kind
     */
    public static int report(WorkforceException e) {
        String resource = (e.getResource() == null) ? "-" : e.getResource();
        if (e.getKind().isServerFault()) {
            log.error("[{}] {} {}\n{}", resource, e.getKind(), e.getMessage(),
                    ExceptionUtils.getStackTrace(e));
        } else {
            log.warn("[{}] {} {}", resource, e.getKind(), e.getMessage());
        }
        StringBuilder sb = new StringBuilder("ERROR: ").append(e.getMessage());
        for (String violation : e.getViolations()) {
            sb.append(System.lineSeparator()).append("  - ").append(violation);
        }
        System.err.println(sb);
        return e.getStatus();
    }

    /**
     * Reports a bad command line.
     *
     * @param message what was wrong with the arguments
     */
    public static void usage(String message) {
        log.warn(message);
        System.err.println("ERROR: " + message);
    }

    /**
     * Reports an unexpected failure. The cause goes to the log only.
     *
     * @param message message to log and print
     * @param cause failure
     */
    public static void fatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        System.err.println("ERROR: " + message);
    }
}
