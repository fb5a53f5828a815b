package com.linbit.pvctransfer.modularcrypto;

import com.linbit.pvctransfer.annotation.Nullable;

import java.io.ByteArrayInputStream;
import java.security.GeneralSecurityException;
import java.security.cert.CertPath;
import java.security.cert.CertPathValidator;
import java.security.cert.CertificateFactory;
import java.security.cert.PKIXParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.util.Collections;

/**
 * PKIX path validation of a single certificate against a single trusted CA. Intermediate CAs
 * are not accepted and revocation is not checked.
 */
public class CertificateVerifier
{
    private static final String CERT_TYPE = "X.509";
    private static final String PATH_ALGORITHM = "PKIX";

    private CertificateVerifier()
    {
    }

    /**
     * @return true if the certificate was issued by the given CA and is currently valid. Unparsable
     *     input yields false.
     */
    public static boolean verify(@Nullable byte[] caPem, @Nullable byte[] crtPem)
    {
        boolean verified = false;
        if (caPem != null && crtPem != null)
        {
            try
            {
                CertificateFactory certFactory = CertificateFactory.getInstance(CERT_TYPE);
                X509Certificate caCrt = (X509Certificate) certFactory.generateCertificate(
                    new ByteArrayInputStream(caPem)
                );
                X509Certificate crt = (X509Certificate) certFactory.generateCertificate(
                    new ByteArrayInputStream(crtPem)
                );

                PKIXParameters params = new PKIXParameters(Collections.singleton(new TrustAnchor(caCrt, null)));
                params.setRevocationEnabled(false);
                CertPath path = certFactory.generateCertPath(Collections.singletonList(crt));
                CertPathValidator.getInstance(PATH_ALGORITHM).validate(path, params);
                verified = true;
            }
            catch (GeneralSecurityException | IllegalArgumentException | ClassCastException exc)
            {
                verified = false;
            }
        }
        return verified;
    }
}
