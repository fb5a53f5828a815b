package com.linbit.pvctransfer.k8s;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.testutils.EmptyErrorReporter;
import com.linbit.pvctransfer.testutils.InMemoryResourceClient;

import java.util.Collections;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ObjectReconcilerTest
{
    private static final ObjectKey CM_KEY = new ObjectKey("ns", "cm");
    private static final ObjectKey POD_KEY = new ObjectKey("ns", "pod");

    private InMemoryResourceClient store;
    private ObjectReconciler reconciler;

    @Before
    public void setUp()
    {
        store = new InMemoryResourceClient();
        reconciler = new ObjectReconciler(store, new EmptyErrorReporter());
    }

    @Test
    public void createThenUnchanged() throws PvcTransferException
    {
        ObjectMutator<ConfigMap> mutator = (cm, exists) ->
        {
            MetadataUtils.applyMetadata(cm, Collections.singletonMap("app", "transfer"), null, null);
            cm.setData(Collections.singletonMap("key", "value"));
        };

        assertThat(reconciler.createOrUpdate(ConfigMap.class, CM_KEY, mutator)).isEqualTo(OperationResult.CREATED);
        String version = store.get(ConfigMap.class, CM_KEY).getMetadata().getResourceVersion();

        assertThat(reconciler.createOrUpdate(ConfigMap.class, CM_KEY, mutator)).isEqualTo(OperationResult.UNCHANGED);
        assertThat(store.get(ConfigMap.class, CM_KEY).getMetadata().getResourceVersion()).isEqualTo(version);
        assertThat(store.getWriteLog()).containsExactly("create ConfigMap ns/cm");
    }

    @Test
    public void changedDataIsUpdated() throws PvcTransferException
    {
        reconciler.createOrUpdate(ConfigMap.class, CM_KEY, (cm, exists) -> cm.setData(Collections.singletonMap("k", "1")));

        OperationResult result = reconciler.createOrUpdate(
            ConfigMap.class,
            CM_KEY,
            (cm, exists) -> cm.setData(Collections.singletonMap("k", "2"))
        );

        assertThat(result).isEqualTo(OperationResult.UPDATED);
        assertThat(store.get(ConfigMap.class, CM_KEY).getData()).containsEntry("k", "2");
    }

    @Test
    public void mutatorIsToldWhetherObjectExists() throws PvcTransferException
    {
        boolean[] seen = new boolean[2];
        reconciler.createOrUpdate(ConfigMap.class, CM_KEY, (cm, exists) -> seen[0] = exists);
        reconciler.createOrUpdate(ConfigMap.class, CM_KEY, (cm, exists) -> seen[1] = exists);

        assertThat(seen[0]).isFalse();
        assertThat(seen[1]).isTrue();
    }

    @Test
    public void existingPodSpecIsLeftUntouched() throws PvcTransferException
    {
        reconciler.createOrUpdate(Pod.class, POD_KEY, (pod, exists) -> podMutator(pod, exists, "image:v1", "a"));

        OperationResult result = reconciler.createOrUpdate(
            Pod.class,
            POD_KEY,
            (pod, exists) -> podMutator(pod, exists, "image:v2", "b")
        );

        assertThat(result).isEqualTo(OperationResult.UPDATED);
        Pod pod = store.get(Pod.class, POD_KEY);
        assertThat(pod.getSpec().getContainers().get(0).getImage()).isEqualTo("image:v1");
        assertThat(pod.getMetadata().getLabels()).containsEntry("run", "b");
    }

    private static void podMutator(Pod pod, boolean exists, String image, String label)
    {
        MetadataUtils.applyMetadata(pod, Collections.singletonMap("run", label), null, null);
        if (!exists)
        {
            pod.setSpec(
                new PodSpecBuilder()
                    .addNewContainer()
                        .withName("rsync")
                        .withImage(image)
                    .endContainer()
                    .build()
            );
        }
    }

    @Test
    public void markForCleanupOnlyAddsLabel() throws PvcTransferException
    {
        reconciler.createOrUpdate(ConfigMap.class, CM_KEY, (cm, exists) -> cm.setData(Collections.singletonMap("k", "v")));

        reconciler.markForCleanup(ConfigMap.class, CM_KEY, "migration-complete", "true");

        ConfigMap cm = store.get(ConfigMap.class, CM_KEY);
        assertThat(cm.getMetadata().getLabels()).containsEntry("migration-complete", "true");
        assertThat(cm.getData()).containsEntry("k", "v");
    }

    @Test
    public void markForCleanupSkipsMissingObjects() throws PvcTransferException
    {
        OperationResult result = reconciler.markForCleanup(ConfigMap.class, CM_KEY, "done", "true");

        assertThat(result).isEqualTo(OperationResult.NOT_FOUND);
        assertThat(store.count()).isZero();
    }

    @Test
    public void staleUpdateIsReportedAsConflict() throws PvcTransferException
    {
        reconciler.createOrUpdate(ConfigMap.class, CM_KEY, (cm, exists) -> cm.setData(Collections.singletonMap("k", "1")));

        assertThatThrownBy(
            () -> reconciler.createOrUpdate(
                ConfigMap.class,
                CM_KEY,
                (cm, exists) ->
                {
                    // a concurrent writer updates the object between our read and our write
                    ConfigMap concurrent = store.get(ConfigMap.class, CM_KEY);
                    concurrent.setData(Collections.singletonMap("k", "other"));
                    store.update(concurrent);
                    cm.setData(Collections.singletonMap("k", "2"));
                }
            )
        )
            .isInstanceOfSatisfying(StoreException.class, exc -> assertThat(exc.isConflict()).isTrue());
    }

    @Test
    public void storeFailureIsPropagated() throws StoreException
    {
        K8sResourceClient failingClient = Mockito.mock(K8sResourceClient.class);
        Mockito.when(failingClient.get(Mockito.eq(ConfigMap.class), Mockito.any()))
            .thenThrow(new StoreException("boom", new KubernetesClientException("boom", 500, null)));
        ObjectReconciler failing = new ObjectReconciler(failingClient, new EmptyErrorReporter());

        assertThatThrownBy(() -> failing.createOrUpdate(ConfigMap.class, CM_KEY, (cm, exists) -> { }))
            .isInstanceOfSatisfying(StoreException.class, exc -> assertThat(exc.getCode()).isEqualTo(500));
    }
}
