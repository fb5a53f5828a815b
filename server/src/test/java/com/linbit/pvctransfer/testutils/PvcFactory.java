package com.linbit.pvctransfer.testutils;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;

public class PvcFactory
{
    private PvcFactory()
    {
    }

    public static PersistentVolumeClaim claim(String namespace, String name)
    {
        return new PersistentVolumeClaimBuilder()
            .withNewMetadata()
                .withNamespace(namespace)
                .withName(name)
            .endMetadata()
            .build();
    }
}
