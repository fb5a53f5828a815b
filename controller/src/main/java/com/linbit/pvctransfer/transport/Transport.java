package com.linbit.pvctransfer.transport;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.k8s.ObjectKey;

import java.util.List;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Volume;

/**
 * The channel between a transfer client and a transfer server. A transfer adds the containers and
 * volumes of its transport to its own pods.
 *
 * On the server side the transport accepts connections on {@link #getListenPort()} and forwards them to
 * the mover daemon on {@link #getConnectPort()}. On the client side the mover connects to
 * {@link #getHostname()} and {@link #getListenPort()}.
 */
public interface Transport
{
    String getNamespace();

    String getIdentitySuffix();

    int getListenPort();

    int getConnectPort();

    String getHostname();

    TransportType getType();

    /**
     * @return the secret holding the transport credentials, or null if the transport has none
     */
    @Nullable
    ObjectKey getCredentials();

    List<Container> getContainers();

    List<Volume> getVolumes();

    void markForCleanup(String key, String value) throws PvcTransferException;
}
