package com.linbit.pvctransfer.transfer;

import com.linbit.pvctransfer.annotation.Nullable;

/**
 * Point in time state of the mover container of one transfer pod
 */
public final class TransferStatus
{
    public enum State
    {
        PENDING,
        RUNNING,
        COMPLETED
    }

    private static final TransferStatus PENDING = new TransferStatus(State.PENDING, null, false, null, null);

    private final State state;
    private final @Nullable String startedAt;
    private final boolean successful;
    private final @Nullable Integer exitCode;
    private final @Nullable String finishedAt;

    private TransferStatus(
        State stateRef,
        @Nullable String startedAtRef,
        boolean successfulRef,
        @Nullable Integer exitCodeRef,
        @Nullable String finishedAtRef
    )
    {
        state = stateRef;
        startedAt = startedAtRef;
        successful = successfulRef;
        exitCode = exitCodeRef;
        finishedAt = finishedAtRef;
    }

    public static TransferStatus pending()
    {
        return PENDING;
    }

    public static TransferStatus running(@Nullable String startedAt)
    {
        return new TransferStatus(State.RUNNING, startedAt, false, null, null);
    }

    public static TransferStatus completed(int exitCode, @Nullable String finishedAt)
    {
        return new TransferStatus(State.COMPLETED, null, exitCode == 0, exitCode, finishedAt);
    }

    public State getState()
    {
        return state;
    }

    public boolean isCompleted()
    {
        return state == State.COMPLETED;
    }

    public boolean isRunning()
    {
        return state == State.RUNNING;
    }

    /**
     * @return true if the mover terminated with exit code 0
     */
    public boolean isSuccessful()
    {
        return successful;
    }

    public boolean isFailed()
    {
        return state == State.COMPLETED && !successful;
    }

    public @Nullable String getStartedAt()
    {
        return startedAt;
    }

    public @Nullable Integer getExitCode()
    {
        return exitCode;
    }

    public @Nullable String getFinishedAt()
    {
        return finishedAt;
    }

    @Override
    public String toString()
    {
        String ret;
        switch (state)
        {
            case RUNNING:
                ret = "running since " + startedAt;
                break;
            case COMPLETED:
                ret = (successful ? "completed" : "failed with exit code " + exitCode) + " at " + finishedAt;
                break;
            case PENDING:
            default:
                ret = "pending";
                break;
        }
        return ret;
    }
}
