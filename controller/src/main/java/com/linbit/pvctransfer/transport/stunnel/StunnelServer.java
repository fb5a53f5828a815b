package com.linbit.pvctransfer.transport.stunnel;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.k8s.CleanupMarker;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.transport.CredentialType;
import com.linbit.pvctransfer.transport.Transport;
import com.linbit.pvctransfer.transport.TransportType;
import com.linbit.pvctransfer.utils.ShellUtils;

import java.util.Collections;
import java.util.List;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Volume;

/**
 * Server end of the tunnel. Accepts TLS or PSK connections on the backend port of the endpoint and
 * forwards them to the mover daemon on the local connect port.
 */
public class StunnelServer implements Transport
{
    // consecutive failed checks of the connect port before the tunnel gives up
    static final int MAX_CONNECT_RETRIES = 10;

    private final ObjectReconciler reconciler;
    private final String namespace;
    private final String identitySuffix;
    private final int listenPort;
    private final int connectPort;
    private final ObjectKey configKey;
    private final ObjectKey credentialsKey;
    private final boolean ownsCredentials;
    private final List<Container> containers;
    private final List<Volume> volumes;

    StunnelServer(
        ObjectReconciler reconcilerRef,
        String namespaceRef,
        String identitySuffixRef,
        int listenPortRef,
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
        connectPort = connectPortRef;
        configKey = configKeyRef;
        credentialsKey = credentialsKeyRef;
        ownsCredentials = ownsCredentialsRef;
        volumes = Collections.unmodifiableList(
            StunnelPodSpec.volumes(configKeyRef.getName(), credentialsKeyRef.getName(), credentialType, "server")
        );
        containers = Collections.singletonList(
            new ContainerBuilder()
                .withName(StunnelPodSpec.CONTAINER_NAME)
                .withImage(image)
                .withCommand(ShellUtils.bashCommand(serverScript(connectPortRef)))
                .withPorts(StunnelPodSpec.port(listenPortRef))
                .withVolumeMounts(StunnelPodSpec.volumeMounts())
                .build()
        );
    }

    /**
     * Starts the daemonizing stunnel and keeps the container alive until the mover daemon has been
     * unreachable for more than {@value #MAX_CONNECT_RETRIES} consecutive seconds
     */
    static String serverScript(int connectPort)
    {
        return StunnelPodSpec.STUNNEL_BIN + " " + StunnelPodSpec.CONFIG_PATH + "\n" +
            "RETRY=0\n" +
            "while true; do\n" +
            "    if nc -z localhost " + connectPort + "; then\n" +
            "        RETRY=0\n" +
            "    else\n" +
            "        RETRY=$((RETRY+1))\n" +
            "    fi\n" +
            "    if [ $RETRY -gt " + MAX_CONNECT_RETRIES + " ]; then\n" +
            "        exit 0\n" +
            "    fi\n" +
            "    sleep 1\n" +
            "done\n";
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
        return "localhost";
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
