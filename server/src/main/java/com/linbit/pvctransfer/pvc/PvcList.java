package com.linbit.pvctransfer.pvc;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;

/**
 * Immutable, sorted set of volumes. Entries are ordered by {@code namespace-name}.
 */
public final class PvcList
{
    private static final PvcList EMPTY = new PvcList(Collections.emptyList());

    private final List<Pvc> pvcs;

    private PvcList(List<Pvc> pvcsRef)
    {
        List<Pvc> sorted = new ArrayList<>(pvcsRef);
        sorted.sort(Comparator.comparing(pvc -> pvc.getNamespace() + "-" + pvc.getName()));
        pvcs = Collections.unmodifiableList(sorted);
    }

    /**
     * Creates a list of the given claims. {@code null} entries are skipped.
     */
    public static PvcList of(@Nullable PersistentVolumeClaim... claims)
    {
        List<Pvc> pvcs = new ArrayList<>();
        if (claims != null)
        {
            for (PersistentVolumeClaim claim : claims)
            {
                if (claim != null)
                {
                    pvcs.add(new PvcImpl(claim));
                }
            }
        }
        return new PvcList(pvcs);
    }

    public static PvcList of(List<PersistentVolumeClaim> claims)
    {
        return of(claims.toArray(new PersistentVolumeClaim[0]));
    }

    public static PvcList ofPvcs(List<? extends Pvc> pvcs)
    {
        return new PvcList(new ArrayList<>(pvcs));
    }

    /**
     * Creates a list that contains only the given claim, using the fixed module name of {@link SingletonPvc}
     */
    public static PvcList singleton(@Nullable PersistentVolumeClaim claim)
    {
        return claim == null ? EMPTY : new PvcList(Arrays.asList(new SingletonPvc(claim)));
    }

    /**
     * @return the distinct namespaces in the order of the sorted entries
     */
    public List<String> getNamespaces()
    {
        Set<String> namespaces = new LinkedHashSet<>();
        for (Pvc pvc : pvcs)
        {
            namespaces.add(pvc.getNamespace());
        }
        return new ArrayList<>(namespaces);
    }

    public PvcList inNamespace(String namespace)
    {
        return new PvcList(
            pvcs.stream()
                .filter(pvc -> namespace.equals(pvc.getNamespace()))
                .collect(Collectors.toList())
        );
    }

    public List<Pvc> getPvcs()
    {
        return pvcs;
    }

    public List<PersistentVolumeClaim> getClaims()
    {
        return pvcs.stream().map(Pvc::getClaim).collect(Collectors.toList());
    }

    public boolean isEmpty()
    {
        return pvcs.isEmpty();
    }

    public int size()
    {
        return pvcs.size();
    }

    /**
     * Returns the namespace all volumes of this list belong to
     *
     * @throws InvalidConfigurationException if the list is empty or spans several namespaces
     */
    public String getSingleNamespace() throws InvalidConfigurationException
    {
        List<String> namespaces = getNamespaces();
        if (namespaces.isEmpty())
        {
            throw new InvalidConfigurationException(
                "No volume claims given",
                "Pass at least one persistent volume claim"
            );
        }
        if (namespaces.size() > 1)
        {
            throw new InvalidConfigurationException(
                "Volume claims of multiple namespaces given: " + namespaces,
                "Reconcile the volume claims of each namespace separately"
            );
        }
        return namespaces.get(0);
    }

    @Override
    public String toString()
    {
        return pvcs.toString();
    }
}
