package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.ImplementationError;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.k8s.CleanupMarker;
import com.linbit.pvctransfer.k8s.MetadataUtils;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.logging.ErrorReporter;
import com.linbit.pvctransfer.naming.ResourceNames;
import com.linbit.pvctransfer.pvc.Pvc;
import com.linbit.pvctransfer.pvc.PvcList;
import com.linbit.pvctransfer.transfer.PodUtils;
import com.linbit.pvctransfer.transfer.TransferClient;
import com.linbit.pvctransfer.transfer.TransferOptions;
import com.linbit.pvctransfer.transfer.TransferStatus;
import com.linbit.pvctransfer.transport.Transport;
import com.linbit.pvctransfer.transport.TransportType;
import com.linbit.pvctransfer.utils.ShellUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;

/**
 * One rsync client pod per volume, each pushing its volume to the daemon of the paired server
 */
public class RsyncTransferClient implements TransferClient
{
    static final String PASSWORD_KEY = "password";
    static final String PVC_VOLUME = "mnt";
    static final String COMMUNICATION_VOLUME = "rsync-communication";
    static final String PVC_ANNOTATION = "pvc";
    private static final String TUNNEL_CONTAINER = "stunnel";
    private static final String STORAGE_MEDIUM_MEMORY = "Memory";

    private final ObjectReconciler reconciler;
    private final ErrorReporter errorReporter;
    private final PvcList pvcList;
    private final String namespace;
    private final String identitySuffix;
    private final int nameLimit;
    private final Transport transport;
    private final TransferOptions options;
    private final CommandOptions commandOptions;
    private final String username;
    private final String moverImage;
    private final String sccName;
    private final ClientTimings timings;

    private final ObjectKey passwordKey;
    private final RsyncRbac rbac;

    RsyncTransferClient(
        ObjectReconciler reconcilerRef,
        ErrorReporter errorReporterRef,
        PvcList pvcListRef,
        String namespaceRef,
        String identitySuffixRef,
        int nameLimitRef,
        Transport transportRef,
        TransferOptions optionsRef,
        CommandOptions commandOptionsRef,
        String usernameRef,
        String moverImageRef,
        String sccNameRef,
        ClientTimings timingsRef
    )
    {
        reconciler = reconcilerRef;
        errorReporter = errorReporterRef;
        pvcList = pvcListRef;
        namespace = namespaceRef;
        identitySuffix = identitySuffixRef;
        nameLimit = nameLimitRef;
        transport = transportRef;
        options = optionsRef;
        commandOptions = commandOptionsRef;
        username = usernameRef;
        moverImage = moverImageRef;
        sccName = sccNameRef;
        timings = timingsRef;

        passwordKey = new ObjectKey(
            namespaceRef,
            ResourceNames.build(ResourceNames.RSYNC_PASSWORD, identitySuffixRef, nameLimitRef)
        );
        rbac = new RsyncRbac(namespaceRef, identitySuffixRef, nameLimitRef);
    }

    /**
     * A failure on one volume does not stop the pods of the other volumes from being reconciled
     */
    void reconcile() throws PvcTransferException
    {
        List<String> rsyncArgs = commandOptions.toArgs();
        rbac.reconcile(reconciler, options.getLabels(), options.getOwnerRefs(), sccName);
        if (isAuthEnabled())
        {
            reconcilePassword();
        }

        List<PvcTransferException> failures = new ArrayList<>();
        for (Pvc pvc : pvcList.getPvcs())
        {
            try
            {
                reconcilePod(pvc, rsyncArgs);
            }
            catch (PvcTransferException exc)
            {
                failures.add(exc);
            }
        }
        PvcTransferException failure = PvcTransferException.aggregate(
            "Failed to reconcile rsync client pods in namespace " + namespace,
            failures
        );
        if (failure != null)
        {
            errorReporter.logError("%s", failure.getMessage());
            throw failure;
        }
        errorReporter.logInfo("Rsync clients %s reconciled for %d volume(s)", identitySuffix, pvcList.size());
    }

    private boolean isAuthEnabled()
    {
        return options.getPassword() != null;
    }

    private void reconcilePassword() throws PvcTransferException
    {
        String password = options.getPassword();
        reconciler.createOrUpdate(
            Secret.class,
            passwordKey,
            (secret, exists) ->
            {
                MetadataUtils.applyMetadata(secret, options.getLabels(), null, options.getOwnerRefs());
                secret.setData(
                    Collections.singletonMap(
                        PASSWORD_KEY,
                        Base64.getEncoder().encodeToString(password.getBytes(StandardCharsets.UTF_8))
                    )
                );
            }
        );
    }

    private void reconcilePod(Pvc pvc, List<String> rsyncArgs) throws PvcTransferException
    {
        PodSpec podSpec = buildPodSpec(pvc, rsyncArgs);
        Map<String, String> annotations = Collections.singletonMap(PVC_ANNOTATION, pvc.getName());
        reconciler.createOrUpdate(
            Pod.class,
            getPodKey(pvc),
            (pod, exists) ->
            {
                MetadataUtils.applyMetadata(pod, options.getLabels(), annotations, options.getOwnerRefs());
                if (!exists)
                {
                    pod.setSpec(podSpec);
                }
            }
        );
    }

    PodSpec buildPodSpec(Pvc pvc, List<String> rsyncArgs)
    {
        String script = RsyncScripts.clientScript(
            pvc,
            username,
            transport.getHostname(),
            transport.getListenPort(),
            rsyncArgs,
            timings.connectTimeoutSec,
            timings.attempts,
            timings.initialBackoffSec
        );
        ContainerBuilder mover = new ContainerBuilder()
            .withName(RsyncPodSpec.MOVER_CONTAINER)
            .withImage(moverImage)
            .withCommand(ShellUtils.bashCommand(script))
            .withVolumeMounts(
                new VolumeMountBuilder().withName(PVC_VOLUME).withMountPath(RsyncScripts.mountPath(pvc)).build(),
                new VolumeMountBuilder()
                    .withName(COMMUNICATION_VOLUME)
                    .withMountPath(RsyncScripts.COMMUNICATION_DIR)
                    .build()
            );
        if (isAuthEnabled())
        {
            mover.withEnv(passwordEnv());
        }

        List<Container> containers = new ArrayList<>();
        containers.add(mover.build());
        containers.addAll(transportContainers());

        List<Volume> volumes = new ArrayList<>();
        volumes.add(
            new VolumeBuilder()
                .withName(PVC_VOLUME)
                .withNewPersistentVolumeClaim()
                    .withClaimName(pvc.getName())
                .endPersistentVolumeClaim()
                .build()
        );
        volumes.add(
            new VolumeBuilder()
                .withName(COMMUNICATION_VOLUME)
                .withNewEmptyDir()
                    .withMedium(STORAGE_MEDIUM_MEMORY)
                .endEmptyDir()
                .build()
        );
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

    private EnvVar passwordEnv()
    {
        return new EnvVarBuilder()
            .withName(RsyncScripts.PASSWORD_ENV)
            .withNewValueFrom()
                .withNewSecretKeyRef()
                    .withName(passwordKey.getName())
                    .withKey(PASSWORD_KEY)
                    .withOptional(true)
                .endSecretKeyRef()
            .endValueFrom()
            .build();
    }

    /**
     * The tunnel sidecar has to exit once the mover is done, otherwise the pod never completes
     */
    private List<Container> transportContainers()
    {
        List<Container> ret = new ArrayList<>();
        boolean tunnelFound = false;
        for (Container container : transport.getContainers())
        {
            if (transport.getType() == TransportType.STUNNEL && TUNNEL_CONTAINER.equals(container.getName()))
            {
                List<String> tunnelCommand = container.getCommand();
                ret.add(
                    new ContainerBuilder(container)
                        .withCommand(
                            ShellUtils.bashCommand(
                                RsyncScripts.tunnelSidecarScript(tunnelCommand, timings.sentinelTimeoutSec)
                            )
                        )
                        .addNewVolumeMount()
                            .withName(COMMUNICATION_VOLUME)
                            .withMountPath(RsyncScripts.COMMUNICATION_DIR)
                        .endVolumeMount()
                        .build()
                );
                tunnelFound = true;
            }
            else
            {
                ret.add(container);
            }
        }
        if (transport.getType() == TransportType.STUNNEL && !tunnelFound)
        {
            throw new ImplementationError("Stunnel transport without a container named " + TUNNEL_CONTAINER);
        }
        return ret;
    }

    public ObjectKey getPodKey(Pvc pvc)
    {
        return new ObjectKey(
            namespace,
            ResourceNames.build(ResourceNames.RSYNC_CLIENT, identitySuffix + "-" + pvc.getLabelSafeName(), nameLimit)
        );
    }

    @Override
    public Transport getTransport()
    {
        return transport;
    }

    @Override
    public PvcList getPvcs()
    {
        return pvcList;
    }

    @Override
    public TransferStatus getStatus(Pvc pvc) throws PvcTransferException
    {
        Pod pod = reconciler.getClient().get(Pod.class, getPodKey(pvc));
        return PodUtils.getStatus(pod, RsyncPodSpec.MOVER_CONTAINER);
    }

    @Override
    public Map<String, TransferStatus> getStatuses() throws PvcTransferException
    {
        Map<String, TransferStatus> ret = new TreeMap<>();
        for (Pvc pvc : pvcList.getPvcs())
        {
            ret.put(pvc.getLabelSafeName(), getStatus(pvc));
        }
        return ret;
    }

    @Override
    public boolean isCompleted() throws PvcTransferException
    {
        boolean completed = true;
        for (TransferStatus status : getStatuses().values())
        {
            if (!status.isCompleted())
            {
                completed = false;
                break;
            }
        }
        return completed;
    }

    @Override
    public void markForCleanup(String key, String value) throws PvcTransferException
    {
        List<PvcTransferException> failures = new ArrayList<>();
        try
        {
            transport.markForCleanup(key, value);
        }
        catch (PvcTransferException exc)
        {
            failures.add(exc);
        }
        CleanupMarker marker = new CleanupMarker(reconciler).add(Secret.class, passwordKey);
        for (Pvc pvc : pvcList.getPvcs())
        {
            marker.add(Pod.class, getPodKey(pvc));
        }
        try
        {
            rbac.addTo(marker).mark(key, value);
        }
        catch (PvcTransferException exc)
        {
            failures.add(exc);
        }
        PvcTransferException failure = PvcTransferException.aggregate(
            "Failed to mark rsync clients " + identitySuffix + " for cleanup",
            failures
        );
        if (failure != null)
        {
            throw failure;
        }
    }

    /**
     * Bounds of the client startup script
     */
    static class ClientTimings
    {
        final int connectTimeoutSec;
        final int attempts;
        final int initialBackoffSec;
        final int sentinelTimeoutSec;

        ClientTimings(int connectTimeoutSecRef, int attemptsRef, int initialBackoffSecRef, int sentinelTimeoutSecRef)
        {
            connectTimeoutSec = connectTimeoutSecRef;
            attempts = attemptsRef;
            initialBackoffSec = initialBackoffSecRef;
            sentinelTimeoutSec = sentinelTimeoutSecRef;
        }
    }
}
