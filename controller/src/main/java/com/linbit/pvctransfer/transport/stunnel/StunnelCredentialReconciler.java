package com.linbit.pvctransfer.transport.stunnel;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.cfg.TransferConfig;
import com.linbit.pvctransfer.k8s.MetadataUtils;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.k8s.OperationResult;
import com.linbit.pvctransfer.logging.ErrorReporter;
import com.linbit.pvctransfer.modularcrypto.CertificateBundle;
import com.linbit.pvctransfer.modularcrypto.CertificateBundleGenerator;
import com.linbit.pvctransfer.modularcrypto.PskSecretGenerator;
import com.linbit.pvctransfer.naming.ResourceNames;
import com.linbit.pvctransfer.transport.CredentialType;
import com.linbit.pvctransfer.transport.TransportOptions;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

import io.fabric8.kubernetes.api.model.Secret;

/**
 * Makes sure a valid credential secret exists for a tunnel.
 *
 * A secret supplied by the caller is only validated. Otherwise the secret
 * {@code stunnel-credentials-<suffix>} is owned by the tunnel: it is created if it does not exist
 * and its whole content is regenerated if it is not valid for the configured credential type.
 */
@Singleton
public class StunnelCredentialReconciler
{
    private static final String SECRET_TYPE_OPAQUE = "Opaque";
    private static final Pattern BASE64_PATTERN = Pattern.compile("^(?:[A-Za-z0-9+/]{4})*(?:[A-Za-z0-9+/]{2}==|[A-Za-z0-9+/]{3}=)?$");

    private final ObjectReconciler reconciler;
    private final ErrorReporter errorReporter;
    private final CertificateBundleGenerator certGenerator;
    private final PskSecretGenerator pskGenerator;
    private final TransferConfig transferCfg;

    @Inject
    public StunnelCredentialReconciler(
        ObjectReconciler reconcilerRef,
        ErrorReporter errorReporterRef,
        CertificateBundleGenerator certGeneratorRef,
        PskSecretGenerator pskGeneratorRef,
        TransferConfig transferCfgRef
    )
    {
        reconciler = reconcilerRef;
        errorReporter = errorReporterRef;
        certGenerator = certGeneratorRef;
        pskGenerator = pskGeneratorRef;
        transferCfg = transferCfgRef;
    }

    /**
     * @return the key of the secret the tunnel has to mount
     */
    public ObjectKey reconcile(String namespace, String identitySuffix, TransportOptions options)
        throws PvcTransferException
    {
        ObjectKey ret;
        CredentialType type = options.getCredentials().getType();
        ObjectKey secretRef = options.getCredentials().getSecretRef();
        if (secretRef != null)
        {
            checkExternalSecret(namespace, secretRef, type);
            ret = secretRef;
        }
        else
        {
            ret = new ObjectKey(
                namespace,
                ResourceNames.build(
                    ResourceNames.STUNNEL_CREDENTIALS,
                    identitySuffix,
                    transferCfg.getResourceNameLimit()
                )
            );
            OperationResult result = reconciler.createOrUpdate(
                Secret.class,
                ret,
                (secret, exists) ->
                {
                    MetadataUtils.applyMetadata(secret, options.getLabels(), null, options.getOwnerRefs());
                    if (!exists)
                    {
                        secret.setType(SECRET_TYPE_OPAQUE);
                    }
                    if (!isValid(type, decode(secret.getData())))
                    {
                        errorReporter.logInfo(
                            "Generating new %s credentials in secret %s",
                            type.name(),
                            ObjectKey.of(secret)
                        );
                        secret.setData(encode(generate(type)));
                    }
                }
            );
            errorReporter.logDebug("Stunnel credentials %s: %s", ret, result);
        }
        return ret;
    }

    private void checkExternalSecret(String namespace, ObjectKey secretRef, CredentialType type)
        throws PvcTransferException
    {
        if (!namespace.equals(secretRef.getNamespace()))
        {
            throw new InvalidConfigurationException(
                "Credential secret " + secretRef + " is not in namespace " + namespace,
                "Copy the credential secret into the namespace of the volumes"
            );
        }
        Secret secret = reconciler.getClient().get(Secret.class, secretRef);
        if (secret == null)
        {
            throw new InvalidConfigurationException(
                "Credential secret " + secretRef + " does not exist",
                "Create the secret or omit the secret reference to let the tunnel generate its credentials"
            );
        }
        if (!isValid(type, decode(secret.getData())))
        {
            throw new InvalidConfigurationException(
                "Credential secret " + secretRef + " does not contain valid " + type.name() + " credentials",
                type == CredentialType.TLS ?
                    "The secret must contain " + CertificateBundle.REQUIRED_KEYS + " issued by the same CA" :
                    "The secret must contain the key '" + PskSecretGenerator.PSK_KEY + "'"
            );
        }
    }

    static boolean isValid(CredentialType type, Map<String, byte[]> data)
    {
        boolean valid;
        switch (type)
        {
            case PSK:
                valid = PskSecretGenerator.isValid(data);
                break;
            case TLS:
            default:
                valid = CertificateBundle.isValid(data);
                break;
        }
        return valid;
    }

    private Map<String, byte[]> generate(CredentialType type)
    {
        Map<String, byte[]> data;
        switch (type)
        {
            case PSK:
                data = new TreeMap<>();
                data.put(
                    PskSecretGenerator.PSK_KEY,
                    pskGenerator.generate(transferCfg.getPskIdentity()).getBytes(StandardCharsets.US_ASCII)
                );
                break;
            case TLS:
            default:
                data = certGenerator.generate().toSecretData();
                break;
        }
        return data;
    }

    static Map<String, byte[]> decode(@Nullable Map<String, String> secretData)
    {
        Map<String, byte[]> ret = new TreeMap<>();
        if (secretData != null)
        {
            for (Map.Entry<String, String> entry : secretData.entrySet())
            {
                String value = entry.getValue();
                if (value != null && isBase64(value))
                {
                    ret.put(entry.getKey(), Base64.getDecoder().decode(value));
                }
            }
        }
        return ret;
    }

    private static boolean isBase64(String value)
    {
        return BASE64_PATTERN.matcher(value).matches();
    }

    static Map<String, String> encode(Map<String, byte[]> data)
    {
        Map<String, String> ret = new TreeMap<>();
        for (Map.Entry<String, byte[]> entry : data.entrySet())
        {
            ret.put(entry.getKey(), Base64.getEncoder().encodeToString(entry.getValue()));
        }
        return ret;
    }
}
