package com.linbit.pvctransfer.endpoint;

import com.linbit.pvctransfer.InvalidConfigurationException;

public enum ServiceType
{
    CLUSTER_IP("ClusterIP"),
    NODE_PORT("NodePort"),
    LOAD_BALANCER("LoadBalancer");

    private final String k8sName;

    ServiceType(String k8sNameRef)
    {
        k8sName = k8sNameRef;
    }

    public String getK8sName()
    {
        return k8sName;
    }

    public static ServiceType fromK8sName(String k8sName) throws InvalidConfigurationException
    {
        ServiceType ret = null;
        for (ServiceType type : values())
        {
            if (type.k8sName.equals(k8sName))
            {
                ret = type;
                break;
            }
        }
        if (ret == null)
        {
            throw new InvalidConfigurationException(
                "Unsupported service type " + k8sName,
                "Use one of ClusterIP, NodePort or LoadBalancer"
            );
        }
        return ret;
    }
}
