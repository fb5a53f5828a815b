package com.linbit.pvctransfer.transport;

public enum TransportType
{
    STUNNEL("stunnel"),
    NULL("null");

    private final String name;

    TransportType(String nameRef)
    {
        name = nameRef;
    }

    public String getName()
    {
        return name;
    }
}
