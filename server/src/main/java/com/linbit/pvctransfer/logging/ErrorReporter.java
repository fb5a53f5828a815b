package com.linbit.pvctransfer.logging;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;

import java.util.Random;

import org.slf4j.event.Level;

/**
 * Logging and problem reporting facility used by all components of the transfer library
 */
public interface ErrorReporter
{
    String LOGID = "logid";

    /**
     * Checks whether the reporter would emit messages of the given level
     *
     * @param level the level to check
     * @return true if messages of the given level (or a finer one) are logged
     */
    boolean hasAtLeastLogLevel(Level level);

    /**
     * @return the finest level that is currently logged, or null if logging is disabled
     */
    @Nullable
    Level getCurrentLogLevel();

    /**
     * Changes the log level of the library logger and, optionally, of the root logger
     *
     * @param level root logger level, null to keep the current level
     * @param transferLevel library logger level, null to keep the current level
     */
    void setLogLevel(@Nullable Level level, @Nullable Level transferLevel);

    void logTrace(String format, Object... args);

    void logDebug(String format, Object... args);

    void logInfo(String format, Object... args);

    void logWarning(String format, Object... args);

    void logError(String format, Object... args);

    /**
     * Returns the hexadecimal instance ID of this reporter. Report IDs are prefixed with it.
     */
    String getInstanceId();

    /**
     * Reports an unexpected problem at level ERROR, including the stack trace
     *
     * @return the ID of the report
     */
    String reportError(Throwable errorInfo);

    /**
     * Reports an unexpected problem at the given level, including the stack trace
     *
     * @return the ID of the report
     */
    String reportError(Level logLevel, Throwable errorInfo);

    String reportError(
        Level logLevel,
        Throwable errorInfo,
        // Information about the context in which the problem occurred, e.g. the transfer being reconciled
        @Nullable String contextInfo
    );

    /**
     * Reports an expected problem. The description, cause, correction and details texts of
     * the exception are reported, the stack trace is not.
     *
     * @return the ID of the report
     */
    String reportProblem(
        Level logLevel,
        PvcTransferException errorInfo,
        @Nullable String contextInfo
    );

    static String getNewLogId()
    {
        String zeros = "000000";
        Random rnd = new Random();
        String s = Integer.toString(rnd.nextInt(0X1000000), 16);
        return zeros.substring(s.length()) + s;
    }
}
