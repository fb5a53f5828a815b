package com.linbit.pvctransfer.utils;

import java.util.Arrays;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ShellUtilsTest
{
    @Test
    public void quoting()
    {
        assertThat(ShellUtils.shellQuote("")).isEqualTo("''");
        assertThat(ShellUtils.shellQuote("/mnt/ns/abc")).isEqualTo("/mnt/ns/abc");
        assertThat(ShellUtils.shellQuote("a b")).isEqualTo("'a b'");
        assertThat(ShellUtils.shellQuote("it's")).isEqualTo("'it'\"'\"'s'");
    }

    @Test
    public void joinQuoted()
    {
        assertThat(ShellUtils.joinShellQuote(Arrays.asList("rsync", "--info=COPY2,DEL2", "a b")))
            .isEqualTo("rsync --info=COPY2,DEL2 'a b'");
    }

    @Test
    public void bash()
    {
        assertThat(ShellUtils.bashCommand("exit 0")).containsExactly("/bin/bash", "-c", "exit 0");
    }

    @Test
    public void md5Hex()
    {
        assertThat(ByteUtils.md5Hex("")).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
        assertThat(ByteUtils.bytesToHex(new byte[] {0x0A, (byte) 0xFF})).isEqualTo("0aff");
    }
}
