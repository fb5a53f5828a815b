package com.linbit.pvctransfer.k8s;

import com.linbit.pvctransfer.annotation.Nullable;

import javax.inject.Inject;
import javax.inject.Singleton;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

@Singleton
public class Fabric8ResourceClient implements K8sResourceClient
{
    private final KubernetesClient k8sClient;

    @Inject
    public Fabric8ResourceClient(KubernetesClient k8sClientRef)
    {
        k8sClient = k8sClientRef;
    }

    @Override
    public @Nullable <T extends HasMetadata> T get(Class<T> type, ObjectKey key) throws StoreException
    {
        try
        {
            return k8sClient.resources(type).inNamespace(key.getNamespace()).withName(key.getName()).get();
        }
        catch (KubernetesClientException exc)
        {
            throw new StoreException("Failed to get " + type.getSimpleName() + " " + key, exc);
        }
    }

    @Override
    public <T extends HasMetadata> T create(T obj) throws StoreException
    {
        try
        {
            return k8sClient.resource(obj).create();
        }
        catch (KubernetesClientException exc)
        {
            throw new StoreException("Failed to create " + obj.getKind() + " " + ObjectKey.of(obj), exc);
        }
    }

    @Override
    public <T extends HasMetadata> T update(T obj) throws StoreException
    {
        try
        {
            return k8sClient.resource(obj).update();
        }
        catch (KubernetesClientException exc)
        {
            throw new StoreException("Failed to update " + obj.getKind() + " " + ObjectKey.of(obj), exc);
        }
    }
}
