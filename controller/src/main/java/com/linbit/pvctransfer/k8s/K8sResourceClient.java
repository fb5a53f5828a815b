package com.linbit.pvctransfer.k8s;

import com.linbit.pvctransfer.annotation.Nullable;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Minimal access to the namespaced objects of the cluster
 */
public interface K8sResourceClient
{
    /**
     * @return the object or null if it does not exist
     */
    @Nullable
    <T extends HasMetadata> T get(Class<T> type, ObjectKey key) throws StoreException;

    <T extends HasMetadata> T create(T obj) throws StoreException;

    /**
     * Replaces the object. The update is conditional on the resource version of the given object.
     */
    <T extends HasMetadata> T update(T obj) throws StoreException;
}
