package com.linbit.pvctransfer.transport;

import com.linbit.pvctransfer.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.OwnerReference;

public class TransportOptions
{
    public static final String DEFAULT_CA_VERIFY_LEVEL = "2";

    private Map<String, String> labels = new TreeMap<>();
    private List<OwnerReference> ownerRefs = new ArrayList<>();
    private @Nullable String image;

    private @Nullable String proxyUrl;
    private @Nullable String proxyUsername;
    private @Nullable String proxyPassword;

    private TransportCredentials credentials = TransportCredentials.tls();
    private boolean noVerifyCa;
    private String caVerifyLevel = DEFAULT_CA_VERIFY_LEVEL;

    public Map<String, String> getLabels()
    {
        return Collections.unmodifiableMap(labels);
    }

    public TransportOptions setLabels(Map<String, String> labelsRef)
    {
        labels = new TreeMap<>(labelsRef);
        return this;
    }

    public List<OwnerReference> getOwnerRefs()
    {
        return Collections.unmodifiableList(ownerRefs);
    }

    public TransportOptions setOwnerRefs(List<OwnerReference> ownerRefsRef)
    {
        ownerRefs = new ArrayList<>(ownerRefsRef);
        return this;
    }

    /**
     * @return the image override, or null to use the configured stunnel image
     */
    public @Nullable String getImage()
    {
        return image;
    }

    public TransportOptions setImage(@Nullable String imageRef)
    {
        image = imageRef;
        return this;
    }

    public @Nullable String getProxyUrl()
    {
        return proxyUrl;
    }

    public TransportOptions setProxyUrl(@Nullable String proxyUrlRef)
    {
        proxyUrl = proxyUrlRef;
        return this;
    }

    public @Nullable String getProxyUsername()
    {
        return proxyUsername;
    }

    public TransportOptions setProxyUsername(@Nullable String proxyUsernameRef)
    {
        proxyUsername = proxyUsernameRef;
        return this;
    }

    public @Nullable String getProxyPassword()
    {
        return proxyPassword;
    }

    public TransportOptions setProxyPassword(@Nullable String proxyPasswordRef)
    {
        proxyPassword = proxyPasswordRef;
        return this;
    }

    public TransportCredentials getCredentials()
    {
        return credentials;
    }

    public TransportOptions setCredentials(TransportCredentials credentialsRef)
    {
        credentials = credentialsRef;
        return this;
    }

    public boolean isNoVerifyCa()
    {
        return noVerifyCa;
    }

    public TransportOptions setNoVerifyCa(boolean noVerifyCaRef)
    {
        noVerifyCa = noVerifyCaRef;
        return this;
    }

    public String getCaVerifyLevel()
    {
        return caVerifyLevel;
    }

    public TransportOptions setCaVerifyLevel(String caVerifyLevelRef)
    {
        caVerifyLevel = caVerifyLevelRef;
        return this;
    }
}
