package com.linbit.pvctransfer.k8s;

import java.util.Objects;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Namespace and name of a namespaced Kubernetes object
 */
public final class ObjectKey implements Comparable<ObjectKey>
{
    private final String namespace;
    private final String name;

    public ObjectKey(String namespaceRef, String nameRef)
    {
        namespace = Objects.requireNonNull(namespaceRef);
        name = Objects.requireNonNull(nameRef);
    }

    public static ObjectKey of(HasMetadata obj)
    {
        return new ObjectKey(obj.getMetadata().getNamespace(), obj.getMetadata().getName());
    }

    public String getNamespace()
    {
        return namespace;
    }

    public String getName()
    {
        return name;
    }

    @Override
    public int compareTo(ObjectKey other)
    {
        int cmp = namespace.compareTo(other.namespace);
        if (cmp == 0)
        {
            cmp = name.compareTo(other.name);
        }
        return cmp;
    }

    @Override
    public boolean equals(Object obj)
    {
        boolean eq = obj == this;
        if (!eq && obj instanceof ObjectKey)
        {
            ObjectKey other = (ObjectKey) obj;
            eq = namespace.equals(other.namespace) && name.equals(other.name);
        }
        return eq;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(namespace, name);
    }

    @Override
    public String toString()
    {
        return namespace + "/" + name;
    }
}
