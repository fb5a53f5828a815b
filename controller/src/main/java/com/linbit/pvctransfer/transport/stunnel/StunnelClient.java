package com.linbit.pvctransfer.transport.stunnel;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.k8s.CleanupMarker;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.transport.CredentialType;
import com.linbit.pvctransfer.transport.Transport;
import com.linbit.pvctransfer.transport.TransportType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Volume;

/**
 * Client end of the tunnel. Listens on a local port for the mover and forwards to the server end,
 * optionally through an HTTP proxy.
 */
public class StunnelClient implements Transport
{
    private final ObjectReconciler reconciler;
    private final String namespace;
    private final String identitySuffix;
    private final int listenPort;
    private final int connectPort;
    private final String serverHostname;
    private final ObjectKey configKey;
    private final ObjectKey credentialsKey;
    private final boolean ownsCredentials;
    private final List<Container> containers;
    private final List<Volume> volumes;

    StunnelClient(
        ObjectReconciler reconcilerRef,
        String namespaceRef,
        String identitySuffixRef,
        int listenPortRef,
        String serverHostnameRef,
        int connectPortRef,
        ObjectKey configKeyRef,
        ObjectKey credentialsKeyRef,
        boolean ownsCredentialsRef,
        String image,
        CredentialType credentialType
    )
    {
        reconciler = reconcilerRef;
        namespace = namespaceRef;
        identitySuffix = identitySuffixRef;
        listenPort = listenPortRef;
        serverHostname = serverHostnameRef;
        connectPort = connectPortRef;
        configKey = configKeyRef;
        credentialsKey = credentialsKeyRef;
        ownsCredentials = ownsCredentialsRef;
        volumes = Collections.unmodifiableList(
            StunnelPodSpec.volumes(configKeyRef.getName(), credentialsKeyRef.getName(), credentialType, "client")
        );
        containers = Collections.singletonList(
            new ContainerBuilder()
                .withName(StunnelPodSpec.CONTAINER_NAME)
                .withImage(image)
                .withCommand(Arrays.asList(StunnelPodSpec.STUNNEL_BIN, StunnelPodSpec.CONFIG_PATH))
                .withPorts(StunnelPodSpec.port(listenPortRef))
                .withVolumeMounts(StunnelPodSpec.volumeMounts())
                .build()
        );
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

    /**
     * @return the port of the server end of the tunnel
     */
    @Override
    public int getConnectPort()
    {
        return connectPort;
    }

    /**
     * @return the address the mover connects to, which is the local end of the tunnel
     */
    @Override
    public String getHostname()
    {
        return "localhost";
    }

    public String getServerHostname()
    {
        return serverHostname;
    }

    @Override
    public TransportType getType()
    {
        return TransportType.STUNNEL;
    }

    @Override
    public ObjectKey getCredentials()
    {
        return credentialsKey;
    }

    public ObjectKey getConfigKey()
    {
        return configKey;
    }

    @Override
    public List<Container> getContainers()
    {
        return containers;
    }

    @Override
    public List<Volume> getVolumes()
    {
        return volumes;
    }

    @Override
    public void markForCleanup(String key, String value) throws PvcTransferException
    {
        CleanupMarker marker = new CleanupMarker(reconciler).add(ConfigMap.class, configKey);
        if (ownsCredentials)
        {
            marker.add(Secret.class, credentialsKey);
        }
        marker.mark(key, value);
    }
}
