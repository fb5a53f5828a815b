package com.linbit.pvctransfer.transfer;

import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.logging.ErrorReporter;

import java.util.Collections;
import java.util.List;

import io.fabric8.kubernetes.api.model.ContainerState;
import io.fabric8.kubernetes.api.model.ContainerStateTerminated;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;

/**
 * Reads health and completion of transfer pods from their container statuses
 */
public class PodUtils
{
    private PodUtils()
    {
    }

    /**
     * @return true if the pod reports exactly the expected number of container statuses and all of
     *     them are ready
     */
    public static boolean areContainersReady(@Nullable Pod pod, int expectedContainers, ErrorReporter errorReporter)
    {
        boolean ready = false;
        if (pod == null)
        {
            errorReporter.logDebug("Transfer pod does not exist yet");
        }
        else
        {
            List<ContainerStatus> statuses = getContainerStatuses(pod);
            if (statuses.size() != expectedContainers)
            {
                errorReporter.logDebug(
                    "Expected %d container statuses, found %d for pod %s",
                    expectedContainers,
                    statuses.size(),
                    pod.getMetadata().getName()
                );
            }
            else
            {
                ready = true;
                for (ContainerStatus status : statuses)
                {
                    if (!Boolean.TRUE.equals(status.getReady()))
                    {
                        errorReporter.logDebug(
                            "Container %s of pod %s is not ready",
                            status.getName(),
                            pod.getMetadata().getName()
                        );
                        ready = false;
                        break;
                    }
                }
            }
        }
        return ready;
    }

    /**
     * @return the status of the named container, {@link TransferStatus#pending()} if the pod or the
     *     container status does not exist yet
     */
    public static TransferStatus getStatus(@Nullable Pod pod, String containerName)
    {
        TransferStatus ret = TransferStatus.pending();
        if (pod != null)
        {
            for (ContainerStatus status : getContainerStatuses(pod))
            {
                if (containerName.equals(status.getName()) && status.getState() != null)
                {
                    ContainerState state = status.getState();
                    ContainerStateTerminated terminated = state.getTerminated();
                    if (terminated != null)
                    {
                        int exitCode = terminated.getExitCode() == null ? -1 : terminated.getExitCode();
                        ret = TransferStatus.completed(exitCode, terminated.getFinishedAt());
                    }
                    else
                    if (state.getRunning() != null)
                    {
                        ret = TransferStatus.running(state.getRunning().getStartedAt());
                    }
                    break;
                }
            }
        }
        return ret;
    }

    private static List<ContainerStatus> getContainerStatuses(Pod pod)
    {
        List<ContainerStatus> ret = Collections.emptyList();
        if (pod.getStatus() != null && pod.getStatus().getContainerStatuses() != null)
        {
            ret = pod.getStatus().getContainerStatuses();
        }
        return ret;
    }
}
