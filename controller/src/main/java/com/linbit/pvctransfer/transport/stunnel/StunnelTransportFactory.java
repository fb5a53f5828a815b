package com.linbit.pvctransfer.transport.stunnel;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.cfg.TransferConfig;
import com.linbit.pvctransfer.endpoint.Endpoint;
import com.linbit.pvctransfer.k8s.MetadataUtils;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.logging.ErrorReporter;
import com.linbit.pvctransfer.naming.ResourceNames;
import com.linbit.pvctransfer.pvc.PvcList;
import com.linbit.pvctransfer.transport.CredentialType;
import com.linbit.pvctransfer.transport.TransportOptions;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.Collections;
import java.util.regex.Pattern;

import io.fabric8.kubernetes.api.model.ConfigMap;

/**
 * Sets up both ends of a stunnel tunnel. Every call reconciles the config map and the credential
 * secret of the tunnel and returns a handle describing the containers and volumes to splice into
 * the pods of a transfer.
 */
@Singleton
public class StunnelTransportFactory
{
    private static final Pattern CA_VERIFY_LEVEL_PATTERN = Pattern.compile("^[0-4]$");
    private static final Pattern PROXY_SCHEME_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");

    private final ObjectReconciler reconciler;
    private final ErrorReporter errorReporter;
    private final StunnelCredentialReconciler credentialReconciler;
    private final TransferConfig transferCfg;

    @Inject
    public StunnelTransportFactory(
        ObjectReconciler reconcilerRef,
        ErrorReporter errorReporterRef,
        StunnelCredentialReconciler credentialReconcilerRef,
        TransferConfig transferCfgRef
    )
    {
        reconciler = reconcilerRef;
        errorReporter = errorReporterRef;
        credentialReconciler = credentialReconcilerRef;
        transferCfg = transferCfgRef;
    }

    public StunnelServer createServer(PvcList pvcList, Endpoint endpoint, TransportOptions options)
        throws PvcTransferException
    {
        return createServer(pvcList.getSingleNamespace(), ResourceNames.identitySuffix(pvcList), endpoint, options);
    }

    /**
     * The server end accepts on the backend port of the endpoint and connects to the mover daemon on the
     * configured connect port
     */
    public StunnelServer createServer(
        String namespace,
        String identitySuffix,
        Endpoint endpoint,
        TransportOptions options
    )
        throws PvcTransferException
    {
        checkOptions(options);
        CredentialType credentialType = options.getCredentials().getType();
        int listenPort = endpoint.getBackendPort();
        int connectPort = transferCfg.getStunnelConnectPort();

        ObjectKey configKey = new ObjectKey(
            namespace,
            ResourceNames.build(
                ResourceNames.SERVER_STUNNEL_CONFIG,
                identitySuffix,
                transferCfg.getResourceNameLimit()
            )
        );
        reconcileConfig(
            configKey,
            options,
            StunnelConfigRenderer.renderServer(
                listenPort,
                connectPort,
                credentialType,
                options.isNoVerifyCa(),
                options.getCaVerifyLevel()
            )
        );
        ObjectKey credentialsKey = credentialReconciler.reconcile(namespace, identitySuffix, options);

        errorReporter.logDebug(
            "Stunnel server %s accepts on %d and connects to %d",
            configKey,
            listenPort,
            connectPort
        );
        return new StunnelServer(
            reconciler,
            namespace,
            identitySuffix,
            listenPort,
            connectPort,
            configKey,
            credentialsKey,
            options.getCredentials().getSecretRef() == null,
            getImage(options),
            credentialType
        );
    }

    public StunnelClient createClient(PvcList pvcList, String hostname, int port, TransportOptions options)
        throws PvcTransferException
    {
        return createClient(
            pvcList.getSingleNamespace(),
            ResourceNames.identitySuffix(pvcList),
            hostname,
            port,
            options
        );
    }

    /**
     * The client end listens on the configured local port and connects to the server end at the given
     * hostname and port, optionally through the configured HTTP proxy
     */
    public StunnelClient createClient(
        String namespace,
        String identitySuffix,
        String hostname,
        int port,
        TransportOptions options
    )
        throws PvcTransferException
    {
        checkOptions(options);
        if (hostname == null || hostname.isEmpty())
        {
            throw new InvalidConfigurationException("The stunnel client needs the hostname of the server end");
        }
        CredentialType credentialType = options.getCredentials().getType();
        int listenPort = transferCfg.getStunnelListenPort();

        ObjectKey configKey = new ObjectKey(
            namespace,
            ResourceNames.build(
                ResourceNames.CLIENT_STUNNEL_CONFIG,
                identitySuffix,
                transferCfg.getResourceNameLimit()
            )
        );
        reconcileConfig(
            configKey,
            options,
            StunnelConfigRenderer.renderClient(
                listenPort,
                hostname,
                port,
                proxyHost(options.getProxyUrl()),
                options.getProxyUsername(),
                options.getProxyPassword(),
                credentialType,
                options.isNoVerifyCa(),
                options.getCaVerifyLevel()
            )
        );
        ObjectKey credentialsKey = credentialReconciler.reconcile(namespace, identitySuffix, options);

        errorReporter.logDebug(
            "Stunnel client %s listens on %d and connects to %s:%d",
            configKey,
            listenPort,
            hostname,
            port
        );
        return new StunnelClient(
            reconciler,
            namespace,
            identitySuffix,
            listenPort,
            hostname,
            port,
            configKey,
            credentialsKey,
            options.getCredentials().getSecretRef() == null,
            getImage(options),
            credentialType
        );
    }

    private void reconcileConfig(ObjectKey configKey, TransportOptions options, String stunnelConf)
        throws PvcTransferException
    {
        reconciler.createOrUpdate(
            ConfigMap.class,
            configKey,
            (configMap, exists) ->
            {
                MetadataUtils.applyMetadata(configMap, options.getLabels(), null, options.getOwnerRefs());
                configMap.setData(Collections.singletonMap(StunnelPodSpec.CONFIG_KEY, stunnelConf));
            }
        );
    }

    private String getImage(TransportOptions options)
    {
        String image = options.getImage();
        return image == null || image.isEmpty() ? transferCfg.getStunnelImage() : image;
    }

    private static void checkOptions(TransportOptions options) throws InvalidConfigurationException
    {
        String level = options.getCaVerifyLevel();
        if (level == null || !CA_VERIFY_LEVEL_PATTERN.matcher(level).matches())
        {
            throw new InvalidConfigurationException(
                "Invalid CA verification level '" + level + "'",
                "stunnel accepts the verification levels 0 to 4"
            );
        }
    }

    /**
     * Reduces a proxy URL like {@code http://proxy.example.com:3128/} to the {@code host:port} form stunnel
     * expects
     */
    static @Nullable String proxyHost(@Nullable String proxyUrl)
    {
        String ret = null;
        if (proxyUrl != null && !proxyUrl.trim().isEmpty())
        {
            String host = PROXY_SCHEME_PATTERN.matcher(proxyUrl.trim()).replaceFirst("");
            while (host.endsWith("/"))
            {
                host = host.substring(0, host.length() - 1);
            }
            ret = host;
        }
        return ret;
    }
}
