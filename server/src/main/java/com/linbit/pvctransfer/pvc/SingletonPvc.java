package com.linbit.pvctransfer.pvc;

import java.util.Objects;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;

/**
 * The only volume of a single-volume transfer. Its rsync module is always called {@value #LABEL_SAFE_NAME}.
 */
public class SingletonPvc implements Pvc
{
    public static final String LABEL_SAFE_NAME = "data";

    private final PersistentVolumeClaim claim;

    public SingletonPvc(PersistentVolumeClaim claimRef)
    {
        claim = Objects.requireNonNull(claimRef);
    }

    @Override
    public PersistentVolumeClaim getClaim()
    {
        return claim;
    }

    @Override
    public String getLabelSafeName()
    {
        return LABEL_SAFE_NAME;
    }

    @Override
    public String toString()
    {
        return getNamespace() + "/" + getName();
    }
}
