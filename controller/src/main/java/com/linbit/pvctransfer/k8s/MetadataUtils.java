package com.linbit.pvctransfer.k8s;

import com.linbit.pvctransfer.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.OwnerReference;

/**
 * Merges the caller supplied labels, annotations and owner references into object metadata.
 * Existing entries the caller does not know about are kept.
 */
public class MetadataUtils
{
    private MetadataUtils()
    {
    }

    public static void applyMetadata(
        HasMetadata obj,
        @Nullable Map<String, String> labels,
        @Nullable Map<String, String> annotations,
        @Nullable List<OwnerReference> ownerRefs
    )
    {
        ObjectMeta meta = obj.getMetadata();
        if (labels != null && !labels.isEmpty())
        {
            meta.setLabels(merge(meta.getLabels(), labels));
        }
        if (annotations != null && !annotations.isEmpty())
        {
            meta.setAnnotations(merge(meta.getAnnotations(), annotations));
        }
        if (ownerRefs != null && !ownerRefs.isEmpty())
        {
            meta.setOwnerReferences(mergeOwners(meta.getOwnerReferences(), ownerRefs));
        }
    }

    public static void setLabel(HasMetadata obj, String key, String value)
    {
        Map<String, String> label = new TreeMap<>();
        label.put(key, value);
        obj.getMetadata().setLabels(merge(obj.getMetadata().getLabels(), label));
    }

    private static Map<String, String> merge(@Nullable Map<String, String> current, Map<String, String> desired)
    {
        Map<String, String> ret = new TreeMap<>();
        if (current != null)
        {
            ret.putAll(current);
        }
        ret.putAll(desired);
        return ret;
    }

    private static List<OwnerReference> mergeOwners(
        @Nullable List<OwnerReference> current,
        List<OwnerReference> desired
    )
    {
        List<OwnerReference> ret = new ArrayList<>();
        if (current != null)
        {
            for (OwnerReference ref : current)
            {
                boolean replaced = false;
                for (OwnerReference desiredRef : desired)
                {
                    if (desiredRef.getUid() != null && desiredRef.getUid().equals(ref.getUid()))
                    {
                        replaced = true;
                        break;
                    }
                }
                if (!replaced)
                {
                    ret.add(ref);
                }
            }
        }
        ret.addAll(desired);
        return ret;
    }
}
