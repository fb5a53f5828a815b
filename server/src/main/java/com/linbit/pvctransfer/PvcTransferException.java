package com.linbit.pvctransfer;

import com.linbit.pvctransfer.annotation.Nullable;

import java.util.List;

/**
 * Base class of all checked exceptions of the transfer library. Besides the message it can carry
 * a description of the problem, its cause, a possible correction and further details that
 * the embedding controller may report to its users.
 */
public class PvcTransferException extends Exception
{
    private static final long serialVersionUID = -2418812447813021876L;

    private @Nullable String excDescription;
    private @Nullable String excCause;
    private @Nullable String excCorrection;
    private @Nullable String excDetails;

    public PvcTransferException(String message)
    {
        super(message);
    }

    public PvcTransferException(String message, @Nullable Throwable cause)
    {
        super(message, cause);
    }

    public PvcTransferException(
        String message,
        @Nullable String descriptionText,
        @Nullable String causeText,
        @Nullable String correctionText,
        @Nullable String detailsText
    )
    {
        this(message, descriptionText, causeText, correctionText, detailsText, null);
    }

    public PvcTransferException(
        String message,
        @Nullable String descriptionText,
        @Nullable String causeText,
        @Nullable String correctionText,
        @Nullable String detailsText,
        @Nullable Throwable cause
    )
    {
        super(message, cause);
        excDescription = descriptionText;
        excCause = causeText;
        excCorrection = correctionText;
        excDetails = detailsText;
    }

    /**
     * Combines the failures of a loop over independent items, e.g. one reconciliation per volume.
     *
     * @return null if the list is empty, the only element if the list contains exactly one
     *     exception, otherwise a new exception with all elements attached as suppressed exceptions
     */
    public static @Nullable PvcTransferException aggregate(String message, List<PvcTransferException> excList)
    {
        PvcTransferException ret;
        if (excList.isEmpty())
        {
            ret = null;
        }
        else
        if (excList.size() == 1)
        {
            ret = excList.get(0);
        }
        else
        {
            StringBuilder details = new StringBuilder();
            for (PvcTransferException exc : excList)
            {
                details.append(exc.getMessage()).append('\n');
            }
            ret = new PvcTransferException(
                message + " (" + excList.size() + " errors)",
                message,
                null,
                null,
                details.toString()
            );
            ret.addSuppressedThrowables(excList.toArray(new Throwable[0]));
        }
        return ret;
    }

    /**
     * Adds the given array of throwables to the Exception's list of suppressed throwable.
     * This method includes all necessary null-checks
     *
     * @param suppressedExceptions
     *
     * @return itself
     */
    public PvcTransferException addSuppressedThrowables(
        @Nullable Throwable... suppressedExceptions
    )
    {
        if (suppressedExceptions != null)
        {
            for (Throwable exc : suppressedExceptions)
            {
                if (exc != null)
                {
                    addSuppressed(exc);
                }
            }
        }
        return this;
    }

    public void setDescriptionText(@Nullable String text)
    {
        excDescription = text;
    }

    public void setCauseText(@Nullable String text)
    {
        excCause = text;
    }

    public void setCorrectionText(@Nullable String text)
    {
        excCorrection = text;
    }

    public void setDetailsText(@Nullable String text)
    {
        excDetails = text;
    }

    /**
     * Returns a text that describes the problem for which the exception was generated
     *
     * @return Problem description, or null if no such information is available
     */
    public @Nullable String getDescriptionText()
    {
        return excDescription;
    }

    /**
     * Returns the text that describes what caused the problem
     *
     * @return Problem cause description, or null if no such information is available
     */
    public @Nullable String getCauseText()
    {
        return excCause;
    }

    /**
     * Returns the text that describes possible or recommended resolutions to the problem
     *
     * @return Correction instructions, or null if no such information is available
     */
    public @Nullable String getCorrectionText()
    {
        return excCorrection;
    }

    public @Nullable String getDetailsText()
    {
        return excDetails;
    }
}
