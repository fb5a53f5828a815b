package com.linbit.pvctransfer.k8s;

import com.linbit.pvctransfer.PvcTransferException;

/**
 * Applies the desired state to an object.
 *
 * @param <T> the object type
 */
@FunctionalInterface
public interface ObjectMutator<T>
{
    /**
     * @param obj the object to modify, a copy of the stored object or a new object that only has a name and a namespace
     * @param exists whether the object is already stored
     */
    void mutate(T obj, boolean exists) throws PvcTransferException;
}
