package com.linbit.pvctransfer;

import com.linbit.pvctransfer.annotation.Nullable;

/**
 * Thrown for states that can only be reached through a programming error, e.g. a JCA algorithm
 * that every compliant JRE has to provide is missing.
 */
public class ImplementationError extends Error
{
    private static final long serialVersionUID = 3384510271540811893L;

    public ImplementationError(String message)
    {
        super(message);
    }

    public ImplementationError(Throwable cause)
    {
        super(cause);
    }

    public ImplementationError(String message, @Nullable Throwable cause)
    {
        super(message, cause);
    }
}
