package com.linbit.pvctransfer.testutils;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.logging.ErrorReporter;

import org.slf4j.event.Level;

public class EmptyErrorReporter implements ErrorReporter
{
    @Override
    public String getInstanceId()
    {
        // not significant for the tests, just needs to return something
        return "CAFEAFFE";
    }

    @Override
    public boolean hasAtLeastLogLevel(Level level)
    {
        return false;
    }

    @Override
    public Level getCurrentLogLevel()
    {
        return Level.ERROR;
    }

    @Override
    public void setLogLevel(@Nullable Level level, @Nullable Level transferLevel)
    {
        // ignore
    }

    @Override
    public void logTrace(String format, Object... args)
    {
        // ignore
    }

    @Override
    public void logDebug(String format, Object... args)
    {
        // ignore
    }

    @Override
    public void logInfo(String format, Object... args)
    {
        // ignore
    }

    @Override
    public void logWarning(String format, Object... args)
    {
        // ignore
    }

    @Override
    public void logError(String format, Object... args)
    {
        // ignore
    }

    @Override
    public String reportError(Throwable errorInfo)
    {
        return null; // no error report, no logName
    }

    @Override
    public String reportError(Level logLevel, Throwable errorInfo)
    {
        return null;
    }

    @Override
    public String reportError(Level logLevel, Throwable errorInfo, @Nullable String contextInfo)
    {
        return null;
    }

    @Override
    public String reportProblem(Level logLevel, PvcTransferException errorInfo, @Nullable String contextInfo)
    {
        return null;
    }
}
