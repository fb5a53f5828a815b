package com.linbit.pvctransfer.core;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.cfg.TransferConfig;
import com.linbit.pvctransfer.cfg.TransferConfigModule;
import com.linbit.pvctransfer.k8s.K8sResourceClient;
import com.linbit.pvctransfer.logging.LoggingModule;
import com.linbit.pvctransfer.pvc.PvcList;
import com.linbit.pvctransfer.testutils.EmptyErrorReporter;
import com.linbit.pvctransfer.testutils.InMemoryResourceClient;
import com.linbit.pvctransfer.transfer.TransferOptions;
import com.linbit.pvctransfer.transfer.rsync.RsyncTransferFactory;
import com.linbit.pvctransfer.transfer.rsync.RsyncTransferServer;
import com.linbit.pvctransfer.transport.TransportOptions;

import java.util.Collections;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;
import io.fabric8.kubernetes.api.model.Pod;
import org.junit.Test;

import static com.linbit.pvctransfer.testutils.K8sTestObjects.claim;
import static org.assertj.core.api.Assertions.assertThat;

public class PvcTransferModuleTest
{
    @Test
    public void factoriesAreWired() throws PvcTransferException
    {
        InMemoryResourceClient store = new InMemoryResourceClient();
        TransferConfig transferCfg = new TransferConfig();
        transferCfg.setTransferImage("registry.example.com/mover:2");
        Injector injector = Guice.createInjector(
            new LoggingModule(new EmptyErrorReporter()),
            new TransferConfigModule(transferCfg),
            Modules.override(new PvcTransferModule()).with(
                new AbstractModule()
                {
                    @Override
                    protected void configure()
                    {
                        bind(K8sResourceClient.class).toInstance(store);
                    }
                }
            )
        );

        RsyncTransferFactory factory = injector.getInstance(RsyncTransferFactory.class);
        assertThat(injector.getInstance(RsyncTransferFactory.class)).isSameAs(factory);

        RsyncTransferServer server = factory.createServerWithStunnel(
            PvcList.of(claim("ns", "data")),
            "ClusterIP",
            new TransferOptions().setLabels(Collections.singletonMap("app", "transfer")),
            new TransportOptions()
        );

        Pod pod = store.get(Pod.class, server.getPodKey());
        assertThat(pod.getSpec().getContainers().get(0).getImage()).isEqualTo("registry.example.com/mover:2");
    }
}
