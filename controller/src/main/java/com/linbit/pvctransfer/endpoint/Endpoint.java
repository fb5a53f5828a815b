package com.linbit.pvctransfer.endpoint;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.k8s.ObjectKey;

/**
 * A reachable address of the transfer server. The transport terminates its server side tunnel on the
 * backend port, clients connect to the hostname and the ingress port.
 */
public interface Endpoint
{
    ObjectKey getObjectKey();

    /**
     * @return the port the server side pod listens on
     */
    int getBackendPort();

    /**
     * @return the port clients connect to
     */
    int getIngressPort();

    String getHostname();

    /**
     * Checks whether the endpoint is ready to accept connections. Implementations may refresh
     * hostname and ingress port from the current state of their objects.
     */
    boolean isHealthy() throws PvcTransferException;

    void markForCleanup(String key, String value) throws PvcTransferException;
}
