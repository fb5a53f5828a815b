package com.linbit.pvctransfer;

/**
 * Signals invalid input of the caller, e.g. an empty volume set, volumes of several namespaces,
 * an empty password or an unsupported credential type. Such errors are never retried.
 */
public class InvalidConfigurationException extends PvcTransferException
{
    private static final long serialVersionUID = 6195532408865412317L;

    public InvalidConfigurationException(String message)
    {
        super(message);
    }

    public InvalidConfigurationException(String message, String correctionText)
    {
        super(message, message, null, correctionText, null);
    }
}
