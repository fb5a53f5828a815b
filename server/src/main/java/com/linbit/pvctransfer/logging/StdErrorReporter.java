package com.linbit.pvctransfer.logging;

import com.linbit.pvctransfer.ImplementationError;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Standard error report generator
 * Logs to SLF4J. Problem reports are rendered into the log, each one tagged with a unique report ID.
 */
public class StdErrorReporter implements ErrorReporter
{
    public static final String LOGGER_NAME = "pvc-transfer";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern(
        "yyyy-MM-dd HH:mm:ss",
        Locale.ROOT
    );

    private final Logger mainLogger;
    private final String moduleName;
    private final boolean printStackTraces;
    private final String instanceId;
    private final AtomicLong errorNr = new AtomicLong();

    public StdErrorReporter(
        String moduleNameRef,
        boolean printStackTracesRef,
        @Nullable String logLevelRef,
        @Nullable String transferLogLevelRef
    )
    {
        moduleName = moduleNameRef;
        printStackTraces = printStackTracesRef;
        instanceId = String.format("%08X", System.currentTimeMillis() / 1000 & 0xFFFFFFFFL);
        mainLogger = LoggerFactory.getLogger(LOGGER_NAME + "/" + moduleName);

        if (logLevelRef != null || transferLogLevelRef != null)
        {
            try
            {
                Level level = logLevelRef == null ? null : Level.valueOf(logLevelRef.toUpperCase(Locale.ROOT));
                String transferLogLevel = transferLogLevelRef;
                if (transferLogLevel == null)
                {
                    transferLogLevel = logLevelRef;
                }
                setLogLevel(level, Level.valueOf(transferLogLevel.toUpperCase(Locale.ROOT)));
            }
            catch (IllegalArgumentException exc)
            {
                logError("Invalid log level '%s'", logLevelRef);
            }
        }
    }

    @Override
    public String getInstanceId()
    {
        return instanceId;
    }

    @Override
    public boolean hasAtLeastLogLevel(Level levelRef)
    {
        boolean hasRequiredLevel;
        switch (levelRef)
        {
            case DEBUG:
                hasRequiredLevel = mainLogger.isDebugEnabled();
                break;
            case ERROR:
                hasRequiredLevel = mainLogger.isErrorEnabled();
                break;
            case INFO:
                hasRequiredLevel = mainLogger.isInfoEnabled();
                break;
            case TRACE:
                hasRequiredLevel = mainLogger.isTraceEnabled();
                break;
            case WARN:
                hasRequiredLevel = mainLogger.isWarnEnabled();
                break;
            default:
                throw new ImplementationError("Unknown logging level: " + levelRef);
        }
        return hasRequiredLevel;
    }

    @Override
    public @Nullable Level getCurrentLogLevel()
    {
        Level level = null; // no logging, aka OFF
        if (mainLogger.isTraceEnabled())
        {
            level = Level.TRACE;
        }
        else
        if (mainLogger.isDebugEnabled())
        {
            level = Level.DEBUG;
        }
        else
        if (mainLogger.isInfoEnabled())
        {
            level = Level.INFO;
        }
        else
        if (mainLogger.isWarnEnabled())
        {
            level = Level.WARN;
        }
        else
        if (mainLogger.isErrorEnabled())
        {
            level = Level.ERROR;
        }
        return level;
    }

    /**
     * Sets the log-level to the given level if the logger uses Logback as a backend.
     *
     * @param level
     *     The level the root-logger, used for frameworks and libraries, will be set to.<br/>
     *     This does NOT influence the library's own log messages.
     * @param transferLevel
     *     The level the main-logger will be set to.
     */
    @Override
    public void setLogLevel(@Nullable Level level, @Nullable Level transferLevel)
    {
        // Only works with Logback as a backend, other SLF4J bindings are left untouched
        Logger rootLogger = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (rootLogger instanceof ch.qos.logback.classic.Logger)
        {
            if (level != null)
            {
                ((ch.qos.logback.classic.Logger) rootLogger).setLevel(
                    ch.qos.logback.classic.Level.toLevel(level.toString())
                );
            }
            if (transferLevel != null)
            {
                if (mainLogger instanceof ch.qos.logback.classic.Logger)
                {
                    ((ch.qos.logback.classic.Logger) mainLogger).setLevel(
                        ch.qos.logback.classic.Level.toLevel(transferLevel.toString())
                    );
                }
                else
                {
                    logError("MainLogger is not a logback logger but the ROOT logger is!");
                }
            }
        }
    }

    @Override
    public String reportError(Throwable errorInfo)
    {
        return reportError(Level.ERROR, errorInfo, null);
    }

    @Override
    public String reportError(Level logLevel, Throwable errorInfo)
    {
        return reportError(logLevel, errorInfo, null);
    }

    @Override
    public String reportError(Level logLevel, Throwable errorInfo, @Nullable String contextInfo)
    {
        return reportImpl(logLevel, errorInfo, contextInfo, printStackTraces);
    }

    @Override
    public String reportProblem(Level logLevel, PvcTransferException errorInfo, @Nullable String contextInfo)
    {
        return reportImpl(logLevel, errorInfo, contextInfo, false);
    }

    private String reportImpl(
        Level logLevel,
        Throwable errorInfo,
        @Nullable String contextInfo,
        boolean includeStackTrace
    )
    {
        long reportNr = errorNr.getAndIncrement();
        String reportId = String.format("%s-%06d", instanceId, reportNr);

        StringWriter report = new StringWriter();
        PrintWriter output = new PrintWriter(report);
        output.printf("Problem report %s (%s, %s)%n", reportId, moduleName, LocalDateTime.now().format(TIMESTAMP_FORMAT));
        if (contextInfo != null)
        {
            output.printf("Context:     %s%n", contextInfo);
        }

        Throwable curExc = errorInfo;
        while (curExc != null)
        {
            renderException(output, curExc);
            curExc = curExc.getCause();
            if (curExc != null)
            {
                output.println("Caused by:");
            }
        }
        if (includeStackTrace)
        {
            errorInfo.printStackTrace(output);
        }
        output.flush();

        logReport(logLevel, report.toString().trim());
        return reportId;
    }

    private void renderException(PrintWriter output, Throwable exc)
    {
        output.printf("Exception:   %s%n", exc.getClass().getSimpleName());
        String msg = exc.getMessage();
        if (msg != null)
        {
            output.printf("Message:     %s%n", msg);
        }
        if (exc instanceof PvcTransferException)
        {
            PvcTransferException transferExc = (PvcTransferException) exc;
            printText(output, "Description", transferExc.getDescriptionText());
            printText(output, "Cause", transferExc.getCauseText());
            printText(output, "Correction", transferExc.getCorrectionText());
            printText(output, "Details", transferExc.getDetailsText());
        }
        for (Throwable suppressed : exc.getSuppressed())
        {
            output.printf("Suppressed:  %s: %s%n", suppressed.getClass().getSimpleName(), suppressed.getMessage());
        }
    }

    private static void printText(PrintWriter output, String label, @Nullable String text)
    {
        if (text != null)
        {
            output.printf("%-12s %s%n", label + ":", text);
        }
    }

    private void logReport(Level logLevelRef, String logMsg)
    {
        switch (logLevelRef)
        {
            case ERROR:
                logError("%s", logMsg);
                break;
            case WARN:
                logWarning("%s", logMsg);
                break;
            case INFO:
                logInfo("%s", logMsg);
                break;
            case DEBUG:
                logDebug("%s", logMsg);
                break;
            case TRACE:
                logTrace("%s", logMsg);
                break;
            default:
                throw new ImplementationError("Missing case label for enumeration value '" + logLevelRef.name() + "'");
        }
    }

    @Override
    public void logTrace(String format, Object... args)
    {
        if (mainLogger.isTraceEnabled())
        {
            mainLogger.trace(format(format, args));
        }
    }

    @Override
    public void logDebug(String format, Object... args)
    {
        if (mainLogger.isDebugEnabled())
        {
            mainLogger.debug(format(format, args));
        }
    }

    @Override
    public void logInfo(String format, Object... args)
    {
        mainLogger.info(format(format, args));
    }

    @Override
    public void logWarning(String format, Object... args)
    {
        mainLogger.warn(format(format, args));
    }

    @Override
    public void logError(String format, Object... args)
    {
        mainLogger.error(format(format, args));
    }

    private static String format(String formatRef, Object... args)
    {
        return args.length == 0 ? formatRef : String.format(formatRef, args);
    }
}
