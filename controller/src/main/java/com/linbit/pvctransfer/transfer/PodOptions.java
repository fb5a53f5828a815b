package com.linbit.pvctransfer.transfer;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.annotation.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.PodSecurityContext;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.SecurityContext;

/**
 * Scheduling and security settings for the transfer pods
 */
public class PodOptions
{
    private @Nullable String sccName;
    private @Nullable PodSecurityContext podSecurityContext;
    private @Nullable SecurityContext containerSecurityContext;
    private @Nullable String nodeName;
    private Map<String, String> nodeSelector = new TreeMap<>();
    private @Nullable ResourceRequirements resources;
    private @Nullable String image;

    /**
     * @return the security context constraint the mover service account may use, or null for the
     *     configured default
     */
    public @Nullable String getSccName()
    {
        return sccName;
    }

    public PodOptions setSccName(@Nullable String sccNameRef)
    {
        sccName = sccNameRef;
        return this;
    }

    /**
     * The pod security context decides which GID the mover runs with. Use supplemental groups for
     * shared storage and the fs group for block storage.
     */
    public @Nullable PodSecurityContext getPodSecurityContext()
    {
        return podSecurityContext;
    }

    public PodOptions setPodSecurityContext(@Nullable PodSecurityContext podSecurityContextRef)
    {
        podSecurityContext = podSecurityContextRef;
        return this;
    }

    public @Nullable SecurityContext getContainerSecurityContext()
    {
        return containerSecurityContext;
    }

    public PodOptions setContainerSecurityContext(@Nullable SecurityContext containerSecurityContextRef)
    {
        containerSecurityContext = containerSecurityContextRef;
        return this;
    }

    /**
     * Client pods usually need a node name, the volume may be bound to a node of a specific region
     */
    public @Nullable String getNodeName()
    {
        return nodeName;
    }

    public PodOptions setNodeName(@Nullable String nodeNameRef)
    {
        nodeName = nodeNameRef;
        return this;
    }

    public Map<String, String> getNodeSelector()
    {
        return Collections.unmodifiableMap(nodeSelector);
    }

    public PodOptions setNodeSelector(Map<String, String> nodeSelectorRef)
    {
        nodeSelector = new TreeMap<>(nodeSelectorRef);
        return this;
    }

    public @Nullable ResourceRequirements getResources()
    {
        return resources;
    }

    public PodOptions setResources(@Nullable ResourceRequirements resourcesRef)
    {
        resources = resourcesRef;
        return this;
    }

    /**
     * @return the mover image, or null for the configured default
     */
    public @Nullable String getImage()
    {
        return image;
    }

    public PodOptions setImage(@Nullable String imageRef)
    {
        image = imageRef;
        return this;
    }

    public void validate() throws InvalidConfigurationException
    {
        if (containerSecurityContext != null)
        {
            Long runAsUser = containerSecurityContext.getRunAsUser();
            if (runAsUser != null && runAsUser != 0L)
            {
                throw new InvalidConfigurationException(
                    "Running the transfer pods as non-root user " + runAsUser + " is not supported",
                    "Remove runAsUser from the container security context or set it to 0"
                );
            }
        }
    }
}
