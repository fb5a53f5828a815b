package com.linbit.pvctransfer.modularcrypto;

import com.linbit.pvctransfer.ImplementationError;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

/**
 * Generates a self signed CA and one server and one client certificate issued by that CA.
 */
@Singleton
public class CertificateBundleGenerator
{
    // NIST SP 800-131A minimum for RSA
    public static final int RSA_KEY_SIZE = 2048;
    public static final int VALIDITY_YEARS = 10;

    public static final BigInteger CA_SERIAL = BigInteger.valueOf(2021);
    public static final BigInteger SERVER_SERIAL = BigInteger.valueOf(2022);
    public static final BigInteger CLIENT_SERIAL = BigInteger.valueOf(2023);

    public static final String ORGANIZATION = "pvc-transfer";
    public static final String CA_COMMON_NAME = "ca.pvc-transfer";
    public static final String SERVER_COMMON_NAME = "server.pvc-transfer";
    public static final String CLIENT_COMMON_NAME = "client.pvc-transfer";

    private static final String KEY_ALGORITHM = "RSA";
    private static final String SIGNATURE_ALGORITHM = "SHA256WithRSA";
    private static final Duration CLOCK_SKEW = Duration.ofMinutes(5);

    private final SecureRandom rnd;

    @Inject
    public CertificateBundleGenerator()
    {
        this(new SecureRandom());
    }

    CertificateBundleGenerator(SecureRandom rndRef)
    {
        rnd = rndRef;
    }

    public CertificateBundle generate()
    {
        CertificateBundle bundle;
        try
        {
            ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
            Date notBefore = Date.from(now.minus(CLOCK_SKEW).toInstant());
            Date notAfter = Date.from(now.plusYears(VALIDITY_YEARS).toInstant());

            X500Name caName = name(CA_COMMON_NAME);
            KeyPair caKeys = generateKeyPair();
            X509v3CertificateBuilder caBuilder = new JcaX509v3CertificateBuilder(
                caName,
                CA_SERIAL,
                notBefore,
                notAfter,
                caName,
                caKeys.getPublic()
            )
                .addExtension(Extension.basicConstraints, true, new BasicConstraints(true))
                .addExtension(
                    Extension.keyUsage,
                    true,
                    new KeyUsage(KeyUsage.keyCertSign | KeyUsage.digitalSignature)
                )
                .addExtension(Extension.extendedKeyUsage, false, extendedKeyUsage());
            X509Certificate caCrt = sign(caBuilder, caKeys.getPrivate());

            KeyPair serverKeys = generateKeyPair();
            X509Certificate serverCrt = issueLeaf(
                caName,
                caKeys.getPrivate(),
                SERVER_SERIAL,
                SERVER_COMMON_NAME,
                serverKeys,
                notBefore,
                notAfter
            );

            KeyPair clientKeys = generateKeyPair();
            X509Certificate clientCrt = issueLeaf(
                caName,
                caKeys.getPrivate(),
                CLIENT_SERIAL,
                CLIENT_COMMON_NAME,
                clientKeys,
                notBefore,
                notAfter
            );

            bundle = new CertificateBundle(
                toPem(caCrt),
                toPem(caKeys.getPrivate()),
                toPem(serverCrt),
                toPem(serverKeys.getPrivate()),
                toPem(clientCrt),
                toPem(clientKeys.getPrivate())
            );
        }
        catch (GeneralSecurityException | OperatorCreationException | IOException exc)
        {
            throw new ImplementationError("Unable to generate the certificate bundle", exc);
        }
        return bundle;
    }

    private X509Certificate issueLeaf(
        X500Name issuer,
        PrivateKey issuerKey,
        BigInteger serial,
        String commonName,
        KeyPair leafKeys,
        Date notBefore,
        Date notAfter
    )
        throws IOException, GeneralSecurityException, OperatorCreationException
    {
        X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
            issuer,
            serial,
            notBefore,
            notAfter,
            name(commonName),
            leafKeys.getPublic()
        )
            .addExtension(Extension.basicConstraints, true, new BasicConstraints(false))
            .addExtension(
                Extension.keyUsage,
                true,
                new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment)
            )
            .addExtension(Extension.extendedKeyUsage, false, extendedKeyUsage());
        return sign(builder, issuerKey);
    }

    private KeyPair generateKeyPair() throws GeneralSecurityException
    {
        KeyPairGenerator keyGen = KeyPairGenerator.getInstance(KEY_ALGORITHM);
        keyGen.initialize(RSA_KEY_SIZE, rnd);
        return keyGen.generateKeyPair();
    }

    private static X509Certificate sign(X509v3CertificateBuilder builder, PrivateKey signingKey)
        throws GeneralSecurityException, OperatorCreationException
    {
        ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(signingKey);
        return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    }

    private static ExtendedKeyUsage extendedKeyUsage()
    {
        return new ExtendedKeyUsage(new KeyPurposeId[] {KeyPurposeId.id_kp_clientAuth, KeyPurposeId.id_kp_serverAuth});
    }

    private static X500Name name(String commonName)
    {
        return new X500NameBuilder(BCStyle.INSTANCE)
            .addRDN(BCStyle.O, ORGANIZATION)
            .addRDN(BCStyle.CN, commonName)
            .build();
    }

    private static String toPem(Object obj) throws IOException
    {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter pemWriter = new JcaPEMWriter(out))
        {
            pemWriter.writeObject(obj);
        }
        return out.toString();
    }
}
