package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.endpoint.Endpoint;
import com.linbit.pvctransfer.k8s.CleanupMarker;
import com.linbit.pvctransfer.k8s.MetadataUtils;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.logging.ErrorReporter;
import com.linbit.pvctransfer.naming.ResourceNames;
import com.linbit.pvctransfer.pvc.Pvc;
import com.linbit.pvctransfer.pvc.PvcList;
import com.linbit.pvctransfer.transfer.PodUtils;
import com.linbit.pvctransfer.transfer.TransferOptions;
import com.linbit.pvctransfer.transfer.TransferServer;
import com.linbit.pvctransfer.transfer.TransferStatus;
import com.linbit.pvctransfer.transport.Transport;
import com.linbit.pvctransfer.transport.TransportType;
import com.linbit.pvctransfer.utils.ShellUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.ContainerPortBuilder;
import io.fabric8.kubernetes.api.model.KeyToPath;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;

/**
 * The rsync daemon pod receiving every volume of one namespace
 */
public class RsyncTransferServer implements TransferServer
{
    static final String CONFIG_KEY = "rsyncd.conf";
    static final String CONFIG_PATH = "/etc/rsyncd.conf";
    static final String CREDENTIALS_KEY = "credentials";
    static final String CONFIG_VOLUME = "rsync-config";
    static final String SECRET_VOLUME = "rsync-secret";
    static final String LOG_VOLUME = "rsyncd-logs";
    static final String COMMUNICATION_VOLUME = "rsync-communication";
    private static final int SECRET_FILE_MODE = 0600;

    private final ObjectReconciler reconciler;
    private final ErrorReporter errorReporter;
    private final PvcList pvcList;
    private final String namespace;
    private final Transport transport;
    private final @Nullable Endpoint endpoint;
    private final TransferOptions options;
    private final String username;
    private final String moverImage;
    private final String sccName;
    private final int listenPort;
    private final int completionTimeoutSec;

    private final ObjectKey configKey;
    private final ObjectKey secretKey;
    private final ObjectKey podKey;
    private final RsyncRbac rbac;

    RsyncTransferServer(
        ObjectReconciler reconcilerRef,
        ErrorReporter errorReporterRef,
        PvcList pvcListRef,
        String namespaceRef,
        String identitySuffix,
        int nameLimit,
        Transport transportRef,
        @Nullable Endpoint endpointRef,
        TransferOptions optionsRef,
        String usernameRef,
        String moverImageRef,
        String sccNameRef,
        int completionTimeoutSecRef
    )
    {
        reconciler = reconcilerRef;
        errorReporter = errorReporterRef;
        pvcList = pvcListRef;
        namespace = namespaceRef;
        transport = transportRef;
        endpoint = endpointRef;
        options = optionsRef;
        username = usernameRef;
        moverImage = moverImageRef;
        sccName = sccNameRef;
        completionTimeoutSec = completionTimeoutSecRef;
        listenPort = transportRef.getConnectPort();

        configKey = new ObjectKey(namespaceRef, ResourceNames.build(ResourceNames.RSYNC_CONFIG, identitySuffix, nameLimit));
        secretKey = new ObjectKey(namespaceRef, ResourceNames.build(ResourceNames.RSYNC_SECRET, identitySuffix, nameLimit));
        podKey = new ObjectKey(namespaceRef, ResourceNames.build(ResourceNames.RSYNC_SERVER, identitySuffix, nameLimit));
        rbac = new RsyncRbac(namespaceRef, identitySuffix, nameLimit);
    }

    void reconcile() throws PvcTransferException
    {
        reconcileConfigMap();
        if (isAuthEnabled())
        {
            reconcileSecret();
        }
        rbac.reconcile(reconciler, options.getLabels(), options.getOwnerRefs(), sccName);
        reconcilePod();
        errorReporter.logInfo("Rsync server %s reconciled for %d volume(s)", podKey, pvcList.size());
    }

    private boolean isAuthEnabled()
    {
        return options.getPassword() != null;
    }

    private void reconcileConfigMap() throws PvcTransferException
    {
        String rsyncConf = RsyncConfigRenderer.renderServer(
            username,
            isAuthEnabled(),
            transport.getType() == TransportType.STUNNEL,
            pvcList
        );
        reconciler.createOrUpdate(
            ConfigMap.class,
            configKey,
            (configMap, exists) ->
            {
                MetadataUtils.applyMetadata(configMap, options.getLabels(), null, options.getOwnerRefs());
                configMap.setData(Collections.singletonMap(CONFIG_KEY, rsyncConf));
            }
        );
    }

    private void reconcileSecret() throws PvcTransferException
    {
        String credentials = username + ":" + options.getPassword();
        reconciler.createOrUpdate(
            Secret.class,
            secretKey,
            (secret, exists) ->
            {
                MetadataUtils.applyMetadata(secret, options.getLabels(), null, options.getOwnerRefs());
                secret.setData(
                    Collections.singletonMap(
                        CREDENTIALS_KEY,
                        Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8))
                    )
                );
            }
        );
    }

    private void reconcilePod() throws PvcTransferException
    {
        PodSpec podSpec = buildPodSpec();
        reconciler.createOrUpdate(
            Pod.class,
            podKey,
            (pod, exists) ->
            {
                MetadataUtils.applyMetadata(pod, options.getLabels(), null, options.getOwnerRefs());
                if (!exists)
                {
                    pod.setSpec(podSpec);
                }
            }
        );
    }

    PodSpec buildPodSpec()
    {
        List<VolumeMount> mounts = new ArrayList<>();
        mounts.add(
            new VolumeMountBuilder().withName(CONFIG_VOLUME).withMountPath(CONFIG_PATH).withSubPath(CONFIG_KEY).build()
        );
        if (isAuthEnabled())
        {
            mounts.add(new VolumeMountBuilder().withName(SECRET_VOLUME).withMountPath(RsyncScripts.SECRET_DIR).build());
        }
        mounts.add(new VolumeMountBuilder().withName(LOG_VOLUME).withMountPath(RsyncScripts.LOG_DIR).build());
        mounts.add(
            new VolumeMountBuilder()
                .withName(COMMUNICATION_VOLUME)
                .withMountPath(RsyncScripts.COMMUNICATION_DIR)
                .build()
        );
        for (Pvc pvc : pvcList.getPvcs())
        {
            mounts.add(
                new VolumeMountBuilder()
                    .withName(pvc.getLabelSafeName())
                    .withMountPath(RsyncScripts.mountPath(pvc))
                    .build()
            );
        }

        List<Container> containers = new ArrayList<>();
        containers.add(
            new ContainerBuilder()
                .withName(RsyncPodSpec.MOVER_CONTAINER)
                .withImage(moverImage)
                .withCommand(
                    ShellUtils.bashCommand(
                        RsyncScripts.serverScript(listenPort, pvcList.getPvcs(), completionTimeoutSec)
                    )
                )
                .withPorts(
                    new ContainerPortBuilder()
                        .withName("rsyncd")
                        .withProtocol("TCP")
                        .withContainerPort(listenPort)
                        .build()
                )
                .withVolumeMounts(mounts)
                .build()
        );
        containers.addAll(transport.getContainers());

        List<Volume> volumes = new ArrayList<>();
        for (Pvc pvc : pvcList.getPvcs())
        {
            volumes.add(
                new VolumeBuilder()
                    .withName(pvc.getLabelSafeName())
                    .withNewPersistentVolumeClaim()
                        .withClaimName(pvc.getName())
                    .endPersistentVolumeClaim()
                    .build()
            );
        }
        volumes.add(
            new VolumeBuilder()
                .withName(CONFIG_VOLUME)
                .withNewConfigMap()
                    .withName(configKey.getName())
                .endConfigMap()
                .build()
        );
        if (isAuthEnabled())
        {
            volumes.add(
                new VolumeBuilder()
                    .withName(SECRET_VOLUME)
                    .withNewSecret()
                        .withSecretName(secretKey.getName())
                        .withDefaultMode(SECRET_FILE_MODE)
                        .withItems(new KeyToPath(CREDENTIALS_KEY, null, "rsyncd.secrets"))
                    .endSecret()
                    .build()
            );
        }
        volumes.add(new VolumeBuilder().withName(LOG_VOLUME).withNewEmptyDir().endEmptyDir().build());
        volumes.add(new VolumeBuilder().withName(COMMUNICATION_VOLUME).withNewEmptyDir().endEmptyDir().build());
        volumes.addAll(transport.getVolumes());

        PodSpec podSpec = new PodSpecBuilder()
            .withContainers(containers)
            .withVolumes(volumes)
            .withRestartPolicy(RsyncPodSpec.RESTART_POLICY_NEVER)
            .withServiceAccountName(rbac.getServiceAccountName())
            .build();
        RsyncPodSpec.apply(podSpec, options.getPodOptions(), moverImage);
        return podSpec;
    }

    public ObjectKey getPodKey()
    {
        return podKey;
    }

    public ObjectKey getConfigKey()
    {
        return configKey;
    }

    @Override
    public @Nullable Endpoint getEndpoint()
    {
        return endpoint;
    }

    @Override
    public Transport getTransport()
    {
        return transport;
    }

    @Override
    public int getListenPort()
    {
        return listenPort;
    }

    @Override
    public PvcList getPvcs()
    {
        return pvcList;
    }

    @Override
    public boolean isHealthy() throws PvcTransferException
    {
        Pod pod = reconciler.getClient().get(Pod.class, podKey);
        return PodUtils.areContainersReady(pod, 1 + transport.getContainers().size(), errorReporter);
    }

    @Override
    public TransferStatus getStatus() throws PvcTransferException
    {
        Pod pod = reconciler.getClient().get(Pod.class, podKey);
        return PodUtils.getStatus(pod, RsyncPodSpec.MOVER_CONTAINER);
    }

    @Override
    public boolean isCompleted() throws PvcTransferException
    {
        return getStatus().isCompleted();
    }

    /**
     * Marks the endpoint, the transport and the objects of the daemon
     */
    @Override
    public void markForCleanup(String key, String value) throws PvcTransferException
    {
        List<PvcTransferException> failures = new ArrayList<>();
        if (endpoint != null)
        {
            try
            {
                endpoint.markForCleanup(key, value);
            }
            catch (PvcTransferException exc)
            {
                failures.add(exc);
            }
        }
        try
        {
            transport.markForCleanup(key, value);
        }
        catch (PvcTransferException exc)
        {
            failures.add(exc);
        }
        CleanupMarker marker = new CleanupMarker(reconciler)
            .add(ConfigMap.class, configKey)
            .add(Secret.class, secretKey)
            .add(Pod.class, podKey);
        try
        {
            rbac.addTo(marker).mark(key, value);
        }
        catch (PvcTransferException exc)
        {
            failures.add(exc);
        }
        PvcTransferException failure = PvcTransferException.aggregate(
            "Failed to mark rsync server " + podKey + " for cleanup",
            failures
        );
        if (failure != null)
        {
            throw failure;
        }
    }
}
