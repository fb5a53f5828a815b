package com.linbit.pvctransfer.core;

import com.linbit.pvctransfer.k8s.Fabric8ResourceClient;
import com.linbit.pvctransfer.k8s.K8sResourceClient;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

/**
 * Wires the object store adapter. Install together with the
 * {@link com.linbit.pvctransfer.logging.LoggingModule} and the
 * {@link com.linbit.pvctransfer.cfg.TransferConfigModule}; the factories
 * ({@link com.linbit.pvctransfer.transfer.rsync.RsyncTransferFactory},
 * {@link com.linbit.pvctransfer.transport.stunnel.StunnelTransportFactory},
 * {@link com.linbit.pvctransfer.endpoint.ServiceEndpointFactory}) are just-in-time singletons.
 */
public class PvcTransferModule extends AbstractModule
{
    @Override
    protected void configure()
    {
        bind(K8sResourceClient.class).to(Fabric8ResourceClient.class);
    }

    /**
     * Uses the in-cluster service account or the local kube config, whichever is available
     */
    @Provides
    @Singleton
    public KubernetesClient provideKubernetesClient()
    {
        return new KubernetesClientBuilder().build();
    }
}
