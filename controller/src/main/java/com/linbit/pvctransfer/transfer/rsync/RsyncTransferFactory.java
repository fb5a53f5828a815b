package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.cfg.TransferConfig;
import com.linbit.pvctransfer.endpoint.Endpoint;
import com.linbit.pvctransfer.endpoint.ServiceEndpoint;
import com.linbit.pvctransfer.endpoint.ServiceEndpointFactory;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.logging.ErrorReporter;
import com.linbit.pvctransfer.naming.ResourceNames;
import com.linbit.pvctransfer.pvc.PvcList;
import com.linbit.pvctransfer.transfer.TransferOptions;
import com.linbit.pvctransfer.transport.Transport;
import com.linbit.pvctransfer.transport.TransportOptions;
import com.linbit.pvctransfer.transport.stunnel.StunnelClient;
import com.linbit.pvctransfer.transport.stunnel.StunnelServer;
import com.linbit.pvctransfer.transport.stunnel.StunnelTransportFactory;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Creates or updates the rsync server and client of a volume set.
 *
 * Every call reconciles all owned objects and returns a handle. Calling again with the same volume
 * set addresses the same objects.
 */
@Singleton
public class RsyncTransferFactory
{
    private final ObjectReconciler reconciler;
    private final ErrorReporter errorReporter;
    private final TransferConfig transferCfg;
    private final StunnelTransportFactory stunnelFactory;
    private final ServiceEndpointFactory endpointFactory;

    @Inject
    public RsyncTransferFactory(
        ObjectReconciler reconcilerRef,
        ErrorReporter errorReporterRef,
        TransferConfig transferCfgRef,
        StunnelTransportFactory stunnelFactoryRef,
        ServiceEndpointFactory endpointFactoryRef
    )
    {
        reconciler = reconcilerRef;
        errorReporter = errorReporterRef;
        transferCfg = transferCfgRef;
        stunnelFactory = stunnelFactoryRef;
        endpointFactory = endpointFactoryRef;
    }

    /**
     * @param endpoint the endpoint in front of the server, marked for cleanup together with the server.
     *     May be null if the caller manages the endpoint itself.
     */
    public RsyncTransferServer createServer(
        PvcList pvcList,
        Transport transport,
        @Nullable Endpoint endpoint,
        TransferOptions options
    )
        throws PvcTransferException
    {
        String namespace = checkInput(pvcList, transport, options);
        RsyncTransferServer server = new RsyncTransferServer(
            reconciler,
            errorReporter,
            pvcList,
            namespace,
            ResourceNames.identitySuffix(pvcList),
            transferCfg.getResourceNameLimit(),
            transport,
            endpoint,
            options,
            getUsername(options),
            getImage(options),
            getSccName(options),
            transferCfg.getTunnelSentinelTimeoutSec()
        );
        server.reconcile();
        return server;
    }

    /**
     * Sets up a service endpoint of the given type, a stunnel server behind it and the rsync server
     */
    public RsyncTransferServer createServerWithStunnel(
        PvcList pvcList,
        String serviceType,
        TransferOptions options,
        TransportOptions transportOptions
    )
        throws PvcTransferException
    {
        String namespace = pvcList.getSingleNamespace();
        checkOptions(options);
        String identitySuffix = ResourceNames.identitySuffix(pvcList);
        int tunnelPort = transferCfg.getStunnelListenPort();
        ServiceEndpoint endpoint = endpointFactory.create(
            new ObjectKey(
                namespace,
                ResourceNames.build(ResourceNames.RSYNC_ENDPOINT, identitySuffix, transferCfg.getResourceNameLimit())
            ),
            tunnelPort,
            tunnelPort,
            serviceType,
            options.getLabels(),
            null,
            options.getOwnerRefs()
        );
        StunnelServer transport = stunnelFactory.createServer(namespace, identitySuffix, endpoint, transportOptions);
        return createServer(pvcList, transport, endpoint, options);
    }

    public RsyncTransferClient createClient(PvcList pvcList, Transport transport, TransferOptions options)
        throws PvcTransferException
    {
        return createClient(pvcList, transport, options, CommandOptions.withDefaults());
    }

    public RsyncTransferClient createClient(
        PvcList pvcList,
        Transport transport,
        TransferOptions options,
        CommandOptions commandOptions
    )
        throws PvcTransferException
    {
        String namespace = checkInput(pvcList, transport, options);
        RsyncTransferClient client = new RsyncTransferClient(
            reconciler,
            errorReporter,
            pvcList,
            namespace,
            ResourceNames.identitySuffix(pvcList),
            transferCfg.getResourceNameLimit(),
            transport,
            options,
            commandOptions,
            getUsername(options),
            getImage(options),
            getSccName(options),
            new RsyncTransferClient.ClientTimings(
                transferCfg.getClientConnectTimeoutSec(),
                transferCfg.getClientAttempts(),
                transferCfg.getClientInitialBackoffSec(),
                transferCfg.getTunnelSentinelTimeoutSec()
            )
        );
        client.reconcile();
        return client;
    }

    /**
     * Sets up a stunnel client connecting to the server end at the given address and the rsync clients
     * using it
     */
    public RsyncTransferClient createClientWithStunnel(
        PvcList pvcList,
        String serverHostname,
        int serverPort,
        TransferOptions options,
        TransportOptions transportOptions,
        CommandOptions commandOptions
    )
        throws PvcTransferException
    {
        pvcList.getSingleNamespace();
        checkOptions(options);
        commandOptions.toArgs();
        StunnelClient transport = stunnelFactory.createClient(pvcList, serverHostname, serverPort, transportOptions);
        return createClient(pvcList, transport, options, commandOptions);
    }

    private static String checkInput(PvcList pvcList, Transport transport, TransferOptions options)
        throws InvalidConfigurationException
    {
        String namespace = pvcList.getSingleNamespace();
        if (!namespace.equals(transport.getNamespace()))
        {
            throw new InvalidConfigurationException(
                "Transport of namespace " + transport.getNamespace() + " cannot serve volumes of namespace " +
                    namespace
            );
        }
        checkOptions(options);
        return namespace;
    }

    /**
     * Checks the caller input that does not depend on the transport. Runs before anything is written.
     */
    private static void checkOptions(TransferOptions options) throws InvalidConfigurationException
    {
        String password = options.getPassword();
        if (password != null && password.isEmpty())
        {
            throw new InvalidConfigurationException(
                "The rsync password is empty",
                "Set a password or leave it unset to disable rsync authentication"
            );
        }
        options.getPodOptions().validate();
    }

    private String getUsername(TransferOptions options)
    {
        String username = options.getUsername();
        return username == null || username.isEmpty() ? transferCfg.getRsyncUser() : username;
    }

    private String getImage(TransferOptions options)
    {
        String image = options.getPodOptions().getImage();
        return image == null || image.isEmpty() ? transferCfg.getTransferImage() : image;
    }

    private String getSccName(TransferOptions options)
    {
        String sccName = options.getPodOptions().getSccName();
        return sccName == null || sccName.isEmpty() ? transferCfg.getSccName() : sccName;
    }
}
