package com.linbit.pvctransfer.k8s;

import com.linbit.pvctransfer.PvcTransferException;

import java.util.ArrayList;
import java.util.List;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Labels a set of owned objects for later garbage collection. A failure on one object does not
 * stop the others from being labeled, all failures are reported together.
 */
public class CleanupMarker
{
    private final ObjectReconciler reconciler;
    private final List<Entry<?>> entries = new ArrayList<>();

    public CleanupMarker(ObjectReconciler reconcilerRef)
    {
        reconciler = reconcilerRef;
    }

    public <T extends HasMetadata> CleanupMarker add(Class<T> type, ObjectKey key)
    {
        entries.add(new Entry<>(type, key));
        return this;
    }

    public void mark(String labelKey, String labelValue) throws PvcTransferException
    {
        List<PvcTransferException> failures = new ArrayList<>();
        for (Entry<?> entry : entries)
        {
            try
            {
                reconciler.markForCleanup(entry.type, entry.key, labelKey, labelValue);
            }
            catch (PvcTransferException exc)
            {
                failures.add(exc);
            }
        }
        PvcTransferException failure = PvcTransferException.aggregate(
            "Failed to mark objects for cleanup",
            failures
        );
        if (failure != null)
        {
            throw failure;
        }
    }

    private static class Entry<T extends HasMetadata>
    {
        private final Class<T> type;
        private final ObjectKey key;

        Entry(Class<T> typeRef, ObjectKey keyRef)
        {
            type = typeRef;
            key = keyRef;
        }
    }
}
