package com.linbit.pvctransfer.modularcrypto;

import com.linbit.pvctransfer.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * PEM encoded CA, server and client certificates and keys. A bundle is never modified, an invalid
 * bundle is replaced as a whole.
 */
public final class CertificateBundle
{
    public static final String CA_CRT = "ca.crt";
    public static final String CA_KEY = "ca.key";
    public static final String SERVER_CRT = "server.crt";
    public static final String SERVER_KEY = "server.key";
    public static final String CLIENT_CRT = "client.crt";
    public static final String CLIENT_KEY = "client.key";

    /**
     * Entries a credential object must contain to be usable. The CA key is only needed for issuing
     * certificates, which is never done after generation.
     */
    public static final List<String> REQUIRED_KEYS = Collections.unmodifiableList(
        Arrays.asList(CA_CRT, SERVER_CRT, SERVER_KEY, CLIENT_CRT, CLIENT_KEY)
    );

    private final String caCrt;
    private final String caKey;
    private final String serverCrt;
    private final String serverKey;
    private final String clientCrt;
    private final String clientKey;

    CertificateBundle(
        String caCrtRef,
        String caKeyRef,
        String serverCrtRef,
        String serverKeyRef,
        String clientCrtRef,
        String clientKeyRef
    )
    {
        caCrt = caCrtRef;
        caKey = caKeyRef;
        serverCrt = serverCrtRef;
        serverKey = serverKeyRef;
        clientCrt = clientCrtRef;
        clientKey = clientKeyRef;
    }

    /**
     * Checks the content of a credential object.
     *
     * @return true if all {@link #REQUIRED_KEYS} are present and both the server and the client certificate
     *     verify against the CA certificate of the same object
     */
    public static boolean isValid(@Nullable Map<String, byte[]> data)
    {
        boolean valid = data != null;
        if (valid)
        {
            for (String key : REQUIRED_KEYS)
            {
                byte[] value = data.get(key);
                if (value == null || value.length == 0)
                {
                    valid = false;
                    break;
                }
            }
        }
        if (valid)
        {
            byte[] ca = data.get(CA_CRT);
            valid = CertificateVerifier.verify(ca, data.get(SERVER_CRT)) &&
                CertificateVerifier.verify(ca, data.get(CLIENT_CRT));
        }
        return valid;
    }

    public Map<String, byte[]> toSecretData()
    {
        Map<String, byte[]> data = new TreeMap<>();
        data.put(CA_CRT, bytes(caCrt));
        data.put(CA_KEY, bytes(caKey));
        data.put(SERVER_CRT, bytes(serverCrt));
        data.put(SERVER_KEY, bytes(serverKey));
        data.put(CLIENT_CRT, bytes(clientCrt));
        data.put(CLIENT_KEY, bytes(clientKey));
        return data;
    }

    private static byte[] bytes(String pem)
    {
        return pem.getBytes(StandardCharsets.US_ASCII);
    }

    public String getCaCrt()
    {
        return caCrt;
    }

    public String getCaKey()
    {
        return caKey;
    }

    public String getServerCrt()
    {
        return serverCrt;
    }

    public String getServerKey()
    {
        return serverKey;
    }

    public String getClientCrt()
    {
        return clientCrt;
    }

    public String getClientKey()
    {
        return clientKey;
    }
}
