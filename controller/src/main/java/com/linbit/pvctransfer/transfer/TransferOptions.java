package com.linbit.pvctransfer.transfer;

import com.linbit.pvctransfer.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.OwnerReference;

/**
 * Settings of one side of a transfer
 */
public class TransferOptions
{
    private Map<String, String> labels = new TreeMap<>();
    private List<OwnerReference> ownerRefs = new ArrayList<>();
    private @Nullable String username;
    private @Nullable String password;
    private PodOptions podOptions = new PodOptions();

    public Map<String, String> getLabels()
    {
        return Collections.unmodifiableMap(labels);
    }

    public TransferOptions setLabels(Map<String, String> labelsRef)
    {
        labels = new TreeMap<>(labelsRef);
        return this;
    }

    public List<OwnerReference> getOwnerRefs()
    {
        return Collections.unmodifiableList(ownerRefs);
    }

    public TransferOptions setOwnerRefs(List<OwnerReference> ownerRefsRef)
    {
        ownerRefs = new ArrayList<>(ownerRefsRef);
        return this;
    }

    /**
     * @return the rsync user, or null for the configured default
     */
    public @Nullable String getUsername()
    {
        return username;
    }

    public TransferOptions setUsername(@Nullable String usernameRef)
    {
        username = usernameRef;
        return this;
    }

    /**
     * @return the rsync password, or null to run the daemon without authentication
     */
    public @Nullable String getPassword()
    {
        return password;
    }

    public TransferOptions setPassword(@Nullable String passwordRef)
    {
        password = passwordRef;
        return this;
    }

    public PodOptions getPodOptions()
    {
        return podOptions;
    }

    public TransferOptions setPodOptions(PodOptions podOptionsRef)
    {
        podOptions = podOptionsRef;
        return this;
    }
}
