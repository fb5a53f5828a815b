package com.linbit.pvctransfer.transport;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.annotation.Nullable;

import java.util.Locale;

public enum CredentialType
{
    TLS,
    PSK;

    public static CredentialType parse(@Nullable String str) throws InvalidConfigurationException
    {
        CredentialType ret;
        try
        {
            if (str == null)
            {
                throw new IllegalArgumentException();
            }
            ret = valueOf(str.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException exc)
        {
            throw new InvalidConfigurationException(
                "Unsupported credential type '" + str + "'",
                "Use TLS or PSK"
            );
        }
        return ret;
    }
}
