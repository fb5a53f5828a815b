package com.linbit.pvctransfer.pvc;

import com.linbit.pvctransfer.utils.ByteUtils;

import java.util.Objects;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;

public class PvcImpl implements Pvc
{
    private final PersistentVolumeClaim claim;
    private final String labelSafeName;

    public PvcImpl(PersistentVolumeClaim claimRef)
    {
        claim = Objects.requireNonNull(claimRef);
        labelSafeName = ByteUtils.md5Hex(claimRef.getMetadata().getName());
    }

    @Override
    public PersistentVolumeClaim getClaim()
    {
        return claim;
    }

    @Override
    public String getLabelSafeName()
    {
        return labelSafeName;
    }

    @Override
    public String toString()
    {
        return getNamespace() + "/" + getName();
    }
}
