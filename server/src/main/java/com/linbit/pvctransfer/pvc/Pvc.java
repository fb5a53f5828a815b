package com.linbit.pvctransfer.pvc;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;

/**
 * One volume of a transfer
 */
public interface Pvc
{
    PersistentVolumeClaim getClaim();

    /**
     * @return a name derived from the claim name that is usable as label value, DNS label and
     *     rsync module name
     */
    String getLabelSafeName();

    default String getNamespace()
    {
        return getClaim().getMetadata().getNamespace();
    }

    default String getName()
    {
        return getClaim().getMetadata().getName();
    }
}
