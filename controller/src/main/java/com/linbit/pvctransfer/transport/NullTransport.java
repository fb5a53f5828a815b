package com.linbit.pvctransfer.transport;

import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.endpoint.Endpoint;
import com.linbit.pvctransfer.k8s.ObjectKey;

import java.util.Collections;
import java.util.List;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Volume;

/**
 * Unencrypted transport. The mover connects to the endpoint directly and the server side daemon
 * accepts connections from any source.
 */
public class NullTransport implements Transport
{
    private static final String LOCALHOST = "localhost";

    private final String namespace;
    private final String identitySuffix;
    private final String hostname;
    private final int listenPort;
    private final int connectPort;

    private NullTransport(
        String namespaceRef,
        String identitySuffixRef,
        String hostnameRef,
        int listenPortRef,
        int connectPortRef
    )
    {
        namespace = namespaceRef;
        identitySuffix = identitySuffixRef;
        hostname = hostnameRef;
        listenPort = listenPortRef;
        connectPort = connectPortRef;
    }

    /**
     * The daemon listens on the backend port of the endpoint
     */
    public static NullTransport forServer(String namespace, String identitySuffix, Endpoint endpoint)
    {
        return new NullTransport(
            namespace,
            identitySuffix,
            LOCALHOST,
            endpoint.getBackendPort(),
            endpoint.getBackendPort()
        );
    }

    /**
     * The mover connects to the given address of the remote endpoint
     */
    public static NullTransport forClient(String namespace, String identitySuffix, String hostname, int port)
    {
        return new NullTransport(namespace, identitySuffix, hostname, port, port);
    }

    @Override
    public String getNamespace()
    {
        return namespace;
    }

    @Override
    public String getIdentitySuffix()
    {
        return identitySuffix;
    }

    @Override
    public int getListenPort()
    {
        return listenPort;
    }

    @Override
    public int getConnectPort()
    {
        return connectPort;
    }

    @Override
    public String getHostname()
    {
        return hostname;
    }

    @Override
    public TransportType getType()
    {
        return TransportType.NULL;
    }

    @Override
    public @Nullable ObjectKey getCredentials()
    {
        return null;
    }

    @Override
    public List<Container> getContainers()
    {
        return Collections.emptyList();
    }

    @Override
    public List<Volume> getVolumes()
    {
        return Collections.emptyList();
    }

    @Override
    public void markForCleanup(String key, String value)
    {
        // owns no objects
    }
}
