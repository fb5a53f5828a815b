package com.linbit.pvctransfer.endpoint;

import com.linbit.pvctransfer.ImplementationError;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.k8s.MetadataUtils;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.k8s.StoreException;
import com.linbit.pvctransfer.logging.ErrorReporter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.LoadBalancerIngress;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServicePortBuilder;
import io.fabric8.kubernetes.api.model.ServiceSpec;

/**
 * Exposes the transfer server through a Service. The service selects the pods that carry the
 * endpoint's labels.
 */
public class ServiceEndpoint implements Endpoint
{
    private static final String PROTOCOL_TCP = "TCP";

    private final ObjectReconciler reconciler;
    private final ErrorReporter errorReporter;
    private final ObjectKey objKey;
    private final ServiceType serviceType;
    private final int backendPort;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final List<OwnerReference> ownerRefs;

    private int ingressPort;
    private String hostname;

    ServiceEndpoint(
        ObjectReconciler reconcilerRef,
        ErrorReporter errorReporterRef,
        ObjectKey objKeyRef,
        ServiceType serviceTypeRef,
        int backendPortRef,
        int ingressPortRef,
        Map<String, String> labelsRef,
        @Nullable Map<String, String> annotationsRef,
        @Nullable List<OwnerReference> ownerRefsRef
    )
    {
        reconciler = reconcilerRef;
        errorReporter = errorReporterRef;
        objKey = objKeyRef;
        serviceType = serviceTypeRef;
        backendPort = backendPortRef;
        ingressPort = ingressPortRef;
        labels = Collections.unmodifiableMap(new TreeMap<>(labelsRef));
        annotations = annotationsRef == null ?
            Collections.emptyMap() :
            Collections.unmodifiableMap(new TreeMap<>(annotationsRef));
        ownerRefs = ownerRefsRef == null ? Collections.emptyList() : ownerRefsRef;
        hostname = objKeyRef.getName() + "." + objKeyRef.getNamespace() + ".svc";
    }

    void reconcile() throws PvcTransferException
    {
        reconciler.createOrUpdate(
            Service.class,
            objKey,
            (svc, exists) ->
            {
                MetadataUtils.applyMetadata(svc, labels, annotations, ownerRefs);
                ServiceSpec spec = svc.getSpec();
                if (spec == null)
                {
                    spec = new ServiceSpec();
                    svc.setSpec(spec);
                }
                ServicePort port = new ServicePortBuilder()
                    .withName(objKey.getName())
                    .withProtocol(PROTOCOL_TCP)
                    .withPort(ingressPort)
                    .withTargetPort(new IntOrString(backendPort))
                    .build();
                if (exists && spec.getPorts() != null && spec.getPorts().size() == 1)
                {
                    // keep the node port the cluster allocated
                    port.setNodePort(spec.getPorts().get(0).getNodePort());
                }
                spec.setPorts(Collections.singletonList(port));
                spec.setSelector(new TreeMap<>(labels));
                if (!exists)
                {
                    spec.setType(serviceType.getK8sName());
                }
            }
        );
    }

    @Override
    public ObjectKey getObjectKey()
    {
        return objKey;
    }

    @Override
    public int getBackendPort()
    {
        return backendPort;
    }

    @Override
    public int getIngressPort()
    {
        return ingressPort;
    }

    @Override
    public String getHostname()
    {
        return hostname;
    }

    public ServiceType getServiceType()
    {
        return serviceType;
    }

    public Map<String, String> getLabels()
    {
        return labels;
    }

    @Override
    public boolean isHealthy() throws PvcTransferException
    {
        Service svc = reconciler.getClient().get(Service.class, objKey);
        if (svc == null)
        {
            throw new StoreException("Service " + objKey + " does not exist", StoreException.HTTP_NOT_FOUND);
        }
        boolean healthy = false;
        ServiceSpec spec = svc.getSpec();
        switch (serviceType)
        {
            case LOAD_BALANCER:
                List<LoadBalancerIngress> ingressList = svc.getStatus() == null ||
                    svc.getStatus().getLoadBalancer() == null ?
                    null :
                    svc.getStatus().getLoadBalancer().getIngress();
                if (ingressList != null && !ingressList.isEmpty())
                {
                    LoadBalancerIngress ingress = ingressList.get(0);
                    if (isSet(ingress.getHostname()))
                    {
                        hostname = ingress.getHostname();
                    }
                    if (isSet(ingress.getIp()))
                    {
                        hostname = ingress.getIp();
                    }
                    healthy = true;
                }
                break;
            case CLUSTER_IP:
                if (spec != null && isSet(spec.getClusterIP()))
                {
                    hostname = spec.getClusterIP();
                }
                healthy = true;
                break;
            case NODE_PORT:
                if (spec != null && isSet(spec.getClusterIP()))
                {
                    hostname = spec.getClusterIP();
                    if (spec.getPorts() != null && !spec.getPorts().isEmpty())
                    {
                        Integer nodePort = spec.getPorts().get(0).getNodePort();
                        if (nodePort != null && nodePort != 0)
                        {
                            ingressPort = nodePort;
                        }
                    }
                }
                healthy = true;
                break;
            default:
                throw new ImplementationError("Unhandled service type " + serviceType);
        }
        if (!healthy)
        {
            errorReporter.logInfo("Endpoint %s is not healthy yet", objKey);
        }
        return healthy;
    }

    @Override
    public void markForCleanup(String key, String value) throws PvcTransferException
    {
        errorReporter.logInfo("Marking service endpoint %s for cleanup", objKey);
        reconciler.markForCleanup(Service.class, objKey, key, value);
    }

    private static boolean isSet(@Nullable String str)
    {
        return str != null && !str.isEmpty();
    }
}
