package com.linbit.pvctransfer.k8s;

import com.linbit.pvctransfer.ImplementationError;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.logging.ErrorReporter;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.lang.reflect.InvocationTargetException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import org.slf4j.event.Level;

/**
 * Get-or-create-then-mutate and mark-for-cleanup on top of a {@link K8sResourceClient}.
 *
 * Writes are conditional on the resource version that was read. A concurrent writer makes the
 * write fail with a {@link StoreException} for which {@link StoreException#isConflict()} is true.
 * Such failures are not retried here.
 */
@Singleton
public class ObjectReconciler
{
    private final K8sResourceClient k8sClient;
    private final ErrorReporter errorReporter;
    private final ObjectMapper objectMapper;

    @Inject
    public ObjectReconciler(K8sResourceClient k8sClientRef, ErrorReporter errorReporterRef)
    {
        k8sClient = k8sClientRef;
        errorReporter = errorReporterRef;
        objectMapper = new ObjectMapper();
    }

    public K8sResourceClient getClient()
    {
        return k8sClient;
    }

    /**
     * Fetches the object, lets the mutator apply the desired state and creates the object if it
     * did not exist, or updates it if the mutator changed it.
     */
    public <T extends HasMetadata> OperationResult createOrUpdate(
        Class<T> type,
        ObjectKey key,
        ObjectMutator<T> mutator
    )
        throws PvcTransferException
    {
        OperationResult result;
        try
        {
            T existing = k8sClient.get(type, key);
            if (existing == null)
            {
                T obj = newInstance(type, key);
                mutator.mutate(obj, false);
                k8sClient.create(obj);
                result = OperationResult.CREATED;
            }
            else
            {
                JsonNode before = objectMapper.valueToTree(existing);
                T obj = copy(type, before);
                mutator.mutate(obj, true);
                if (before.equals(objectMapper.valueToTree(obj)))
                {
                    result = OperationResult.UNCHANGED;
                }
                else
                {
                    k8sClient.update(obj);
                    result = OperationResult.UPDATED;
                }
            }
        }
        catch (StoreException exc)
        {
            errorReporter.reportError(Level.WARN, exc, type.getSimpleName() + " " + key);
            throw exc;
        }
        errorReporter.logDebug("%s %s: %s", type.getSimpleName(), key, result);
        return result;
    }

    /**
     * Like {@link #createOrUpdate(Class, ObjectKey, ObjectMutator)}, but objects that do not exist are skipped
     */
    public <T extends HasMetadata> OperationResult updateIfExists(
        Class<T> type,
        ObjectKey key,
        ObjectMutator<T> mutator
    )
        throws PvcTransferException
    {
        OperationResult result;
        @Nullable T existing;
        try
        {
            existing = k8sClient.get(type, key);
        }
        catch (StoreException exc)
        {
            errorReporter.reportError(Level.WARN, exc, type.getSimpleName() + " " + key);
            throw exc;
        }
        if (existing == null)
        {
            errorReporter.logDebug("%s %s does not exist, skipped", type.getSimpleName(), key);
            result = OperationResult.NOT_FOUND;
        }
        else
        {
            result = createOrUpdate(type, key, mutator);
        }
        return result;
    }

    /**
     * Sets the given label on the object. The object is never deleted. Objects that do not exist are skipped.
     */
    public <T extends HasMetadata> OperationResult markForCleanup(
        Class<T> type,
        ObjectKey key,
        String labelKey,
        String labelValue
    )
        throws PvcTransferException
    {
        return updateIfExists(type, key, (obj, exists) -> MetadataUtils.setLabel(obj, labelKey, labelValue));
    }

    private <T extends HasMetadata> T copy(Class<T> type, JsonNode tree)
    {
        try
        {
            return objectMapper.treeToValue(tree, type);
        }
        catch (JsonProcessingException exc)
        {
            throw new ImplementationError("Unable to copy " + type.getSimpleName(), exc);
        }
    }

    private static <T extends HasMetadata> T newInstance(Class<T> type, ObjectKey key)
    {
        T obj;
        try
        {
            obj = type.getDeclaredConstructor().newInstance();
        }
        catch (InstantiationException | IllegalAccessException | InvocationTargetException |
            NoSuchMethodException exc)
        {
            throw new ImplementationError("Unable to instantiate " + type.getSimpleName(), exc);
        }
        ObjectMeta meta = new ObjectMeta();
        meta.setNamespace(key.getNamespace());
        meta.setName(key.getName());
        obj.setMetadata(meta);
        return obj;
    }
}
