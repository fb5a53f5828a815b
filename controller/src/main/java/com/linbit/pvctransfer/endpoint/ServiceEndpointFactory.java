package com.linbit.pvctransfer.endpoint;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.logging.ErrorReporter;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.List;
import java.util.Map;

import io.fabric8.kubernetes.api.model.OwnerReference;

@Singleton
public class ServiceEndpointFactory
{
    private final ObjectReconciler reconciler;
    private final ErrorReporter errorReporter;

    @Inject
    public ServiceEndpointFactory(ObjectReconciler reconcilerRef, ErrorReporter errorReporterRef)
    {
        reconciler = reconcilerRef;
        errorReporter = errorReporterRef;
    }

    /**
     * Creates or updates the service and returns the endpoint.
     *
     * @param labels the labels of the service, also used as its pod selector. Must not be empty.
     */
    public ServiceEndpoint create(
        ObjectKey key,
        int backendPort,
        int ingressPort,
        String serviceType,
        Map<String, String> labels,
        @Nullable Map<String, String> annotations,
        @Nullable List<OwnerReference> ownerRefs
    )
        throws PvcTransferException
    {
        ServiceType type = ServiceType.fromK8sName(serviceType);
        if (labels == null || labels.isEmpty())
        {
            throw new InvalidConfigurationException(
                "Service endpoint " + key + " needs labels to select the server pod"
            );
        }
        ServiceEndpoint endpoint = new ServiceEndpoint(
            reconciler,
            errorReporter,
            key,
            type,
            backendPort,
            ingressPort,
            labels,
            annotations,
            ownerRefs
        );
        endpoint.reconcile();
        return endpoint;
    }
}
