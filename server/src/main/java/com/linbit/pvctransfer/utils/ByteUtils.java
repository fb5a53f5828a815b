package com.linbit.pvctransfer.utils;

import com.linbit.pvctransfer.ImplementationError;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class ByteUtils
{
    private static final String MD_MD5 = "MD5";
    private static final byte[] HEX_ARRAY = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);

    private ByteUtils()
    {
    }

    /**
     * MD5 is only used to derive short, stable identifiers from names. It is not used for any security purpose.
     */
    public static byte[] checksumMd5(byte[] content)
    {
        byte[] ret;
        try
        {
            MessageDigest md = MessageDigest.getInstance(MD_MD5);
            ret = md.digest(content);
        }
        catch (NoSuchAlgorithmException exc)
        {
            throw new ImplementationError(exc);
        }
        return ret;
    }

    public static String md5Hex(String content)
    {
        return bytesToHex(checksumMd5(content.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * @return the lower case hexadecimal representation of the given bytes
     */
    public static String bytesToHex(byte[] bytes)
    {
        if (bytes.length > Integer.MAX_VALUE >>> 1)
        {
            throw new IllegalArgumentException(
                "Input data size of " + bytes.length + " bytes is too large for " +
                "method bytesToHex"
            );
        }
        byte[] hexChars = new byte[bytes.length * 2];
        for (int idx = 0; idx < bytes.length; idx++)
        {
            int value = bytes[idx] & 0xFF;
            hexChars[idx * 2] = HEX_ARRAY[value >>> 4];
            hexChars[idx * 2 + 1] = HEX_ARRAY[value & 0x0F];
        }
        return new String(hexChars, StandardCharsets.US_ASCII);
    }
}
