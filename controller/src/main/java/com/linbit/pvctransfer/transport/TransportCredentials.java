package com.linbit.pvctransfer.transport;

import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.k8s.ObjectKey;

/**
 * Kind of the transport credentials, and optionally a secret supplied by the caller. Without a secret
 * reference the transport generates and owns its credentials.
 */
public class TransportCredentials
{
    private final CredentialType type;
    private final @Nullable ObjectKey secretRef;

    public TransportCredentials(CredentialType typeRef, @Nullable ObjectKey secretRefRef)
    {
        type = typeRef;
        secretRef = secretRefRef;
    }

    public static TransportCredentials tls()
    {
        return new TransportCredentials(CredentialType.TLS, null);
    }

    public static TransportCredentials psk()
    {
        return new TransportCredentials(CredentialType.PSK, null);
    }

    public CredentialType getType()
    {
        return type;
    }

    public @Nullable ObjectKey getSecretRef()
    {
        return secretRef;
    }
}
