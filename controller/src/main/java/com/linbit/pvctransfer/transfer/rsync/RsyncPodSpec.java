package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.transfer.PodOptions;

import java.util.Map;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.PodSpec;

/**
 * Applies the caller supplied {@link PodOptions} to a mover pod
 */
final class RsyncPodSpec
{
    static final String MOVER_CONTAINER = "rsync";
    static final String RESTART_POLICY_NEVER = "Never";

    private RsyncPodSpec()
    {
    }

    /**
     * Node placement and security settings apply to the whole pod. The image only applies to the mover
     * container, transport containers keep their own image.
     */
    static void apply(PodSpec podSpec, PodOptions options, String moverImage)
    {
        Map<String, String> nodeSelector = options.getNodeSelector();
        if (!nodeSelector.isEmpty())
        {
            podSpec.setNodeSelector(new TreeMap<>(nodeSelector));
        }
        podSpec.setNodeName(options.getNodeName());
        podSpec.setSecurityContext(options.getPodSecurityContext());
        for (Container container : podSpec.getContainers())
        {
            if (MOVER_CONTAINER.equals(container.getName()))
            {
                container.setImage(moverImage);
            }
            container.setSecurityContext(options.getContainerSecurityContext());
            container.setResources(options.getResources());
        }
    }
}
