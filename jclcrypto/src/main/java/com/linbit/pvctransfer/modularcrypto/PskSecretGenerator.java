package com.linbit.pvctransfer.modularcrypto;

import com.linbit.pvctransfer.annotation.Nullable;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;

/**
 * Generates the content of a stunnel PSK secrets file: {@code identity:base64(random bytes)}
 */
@Singleton
public class PskSecretGenerator
{
    public static final String PSK_KEY = "key";

    // 24 random bytes are encoded into a 32 character secret
    public static final int PSK_SECRET_SIZE = 24;

    private final SecureRandom rnd;

    @Inject
    public PskSecretGenerator()
    {
        this(new SecureRandom());
    }

    PskSecretGenerator(SecureRandom rndRef)
    {
        rnd = rndRef;
    }

    public String generate(String identity)
    {
        return identity + ":" + generateSecretString(PSK_SECRET_SIZE);
    }

    /**
     * @param size The number of bytes of random data to translate into a String (not the length of the String)
     * @return A Base64 encoded String of <code>size</code> random bytes.
     */
    public String generateSecretString(final int size)
    {
        byte[] randomBytes = new byte[size];
        rnd.nextBytes(randomBytes);
        return Base64.getEncoder().encodeToString(randomBytes);
    }

    /**
     * @return true if the credential object contains a non-empty {@value #PSK_KEY} entry
     */
    public static boolean isValid(@Nullable Map<String, byte[]> data)
    {
        boolean valid = false;
        if (data != null)
        {
            byte[] psk = data.get(PSK_KEY);
            valid = psk != null && psk.length > 0;
        }
        return valid;
    }
}
