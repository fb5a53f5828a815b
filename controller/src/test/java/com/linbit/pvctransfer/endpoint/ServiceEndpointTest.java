package com.linbit.pvctransfer.endpoint;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.testutils.EmptyErrorReporter;
import com.linbit.pvctransfer.testutils.InMemoryResourceClient;

import java.util.Collections;
import java.util.Map;

import io.fabric8.kubernetes.api.model.LoadBalancerIngressBuilder;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceStatusBuilder;
import org.junit.Before;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ServiceEndpointTest
{
    private static final ObjectKey KEY = new ObjectKey("ns", "rsync-endpoint-0123456789");
    private static final Map<String, String> LABELS = Collections.singletonMap("app", "rsync-server");

    private InMemoryResourceClient store;
    private ServiceEndpointFactory factory;

    @Before
    public void setUp()
    {
        store = new InMemoryResourceClient();
        factory = new ServiceEndpointFactory(new ObjectReconciler(store, new EmptyErrorReporter()), new EmptyErrorReporter());
    }

    @Test
    public void createsService() throws PvcTransferException
    {
        ServiceEndpoint endpoint = factory.create(KEY, 6443, 443, "ClusterIP", LABELS, null, null);

        Service svc = store.get(Service.class, KEY);
        assertThat(svc.getSpec().getType()).isEqualTo("ClusterIP");
        assertThat(svc.getSpec().getSelector()).isEqualTo(LABELS);
        assertThat(svc.getSpec().getPorts()).hasSize(1);
        assertThat(svc.getSpec().getPorts().get(0).getPort()).isEqualTo(443);
        assertThat(svc.getSpec().getPorts().get(0).getTargetPort().getIntVal()).isEqualTo(6443);
        assertThat(endpoint.getHostname()).isEqualTo("rsync-endpoint-0123456789.ns.svc");
    }

    @Test
    public void reconcilingTwiceWritesOnce() throws PvcTransferException
    {
        factory.create(KEY, 6443, 443, "ClusterIP", LABELS, null, null);
        factory.create(KEY, 6443, 443, "ClusterIP", LABELS, null, null);

        assertThat(store.getWriteLog()).containsExactly("create Service " + KEY);
    }

    @Test
    public void serviceTypeIsOnlySetOnCreation() throws PvcTransferException
    {
        factory.create(KEY, 6443, 443, "ClusterIP", LABELS, null, null);
        factory.create(KEY, 6443, 443, "NodePort", LABELS, null, null);

        assertThat(store.get(Service.class, KEY).getSpec().getType()).isEqualTo("ClusterIP");
    }

    @Test
    public void unsupportedTypeIsRejected()
    {
        assertThatThrownBy(() -> factory.create(KEY, 6443, 443, "ExternalName", LABELS, null, null))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThat(store.count()).isZero();
    }

    @Test
    public void labelsAreRequired()
    {
        assertThatThrownBy(() -> factory.create(KEY, 6443, 443, "ClusterIP", Collections.emptyMap(), null, null))
            .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    public void loadBalancerIsHealthyOnceIngressIsAssigned() throws PvcTransferException
    {
        ServiceEndpoint endpoint = factory.create(KEY, 6443, 443, "LoadBalancer", LABELS, null, null);
        assertThat(endpoint.isHealthy()).isFalse();

        Service svc = store.get(Service.class, KEY);
        svc.setStatus(
            new ServiceStatusBuilder()
                .withNewLoadBalancer()
                    .withIngress(new LoadBalancerIngressBuilder().withHostname("lb.example.com").build())
                .endLoadBalancer()
                .build()
        );
        store.put(svc);

        assertThat(endpoint.isHealthy()).isTrue();
        assertThat(endpoint.getHostname()).isEqualTo("lb.example.com");
    }

    @Test
    public void markForCleanupLabelsService() throws PvcTransferException
    {
        ServiceEndpoint endpoint = factory.create(KEY, 6443, 443, "ClusterIP", LABELS, null, null);

        endpoint.markForCleanup("migration-complete", "true");

        assertThat(store.get(Service.class, KEY).getMetadata().getLabels())
            .containsEntry("migration-complete", "true")
            .containsEntry("app", "rsync-server");
    }
}
