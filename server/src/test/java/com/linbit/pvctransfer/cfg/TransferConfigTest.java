package com.linbit.pvctransfer.cfg;

import com.linbit.pvctransfer.InvalidConfigurationException;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.assertj.core.api.Assertions.assertThat;

public class TransferConfigTest
{
    @Rule
    public TemporaryFolder tmpFolder = new TemporaryFolder();

    @Test
    public void defaults() throws Exception
    {
        TransferConfig cfg = new TransferConfig(null, Collections.emptyMap());

        assertThat(cfg.getTransferImage()).isEqualTo(TransferConfig.DEFAULT_TRANSFER_IMAGE);
        assertThat(cfg.getSccName()).isEqualTo("pvc-transfer-mover");
        assertThat(cfg.getStunnelConnectPort()).isEqualTo(8080);
        assertThat(cfg.getStunnelListenPort()).isEqualTo(6443);
        assertThat(cfg.getClientConnectTimeoutSec()).isEqualTo(120);
        assertThat(cfg.getClientAttempts()).isEqualTo(5);
        assertThat(cfg.getClientInitialBackoffSec()).isEqualTo(2);
        assertThat(cfg.getResourceNameLimit()).isEqualTo(62);
    }

    @Test
    public void tomlThenEnv() throws Exception
    {
        File dir = tmpFolder.newFolder("cfg");
        Files.write(
            dir.toPath().resolve(TransferConfig.CONFIG_FILE_NAME),
            (
                "[images]\n" +
                "transfer = \"example.com/mover:1\"\n" +
                "[stunnel]\n" +
                "connect_port = 9000\n" +
                "listen_port = 7443\n" +
                "[client]\n" +
                "attempts = 3\n"
            ).getBytes(StandardCharsets.UTF_8)
        );
        Map<String, String> env = new HashMap<>();
        env.put(TransferEnvParser.STUNNEL_LISTEN_PORT, "7444");
        env.put(TransferEnvParser.SCC_NAME, "custom-scc");
        env.put(TransferEnvParser.PSK_IDENTITY, " ");

        TransferConfig cfg = new TransferConfig(dir.toPath(), env);

        assertThat(cfg.getTransferImage()).isEqualTo("example.com/mover:1");
        assertThat(cfg.getStunnelConnectPort()).isEqualTo(9000);
        assertThat(cfg.getStunnelListenPort()).isEqualTo(7444);
        assertThat(cfg.getClientAttempts()).isEqualTo(3);
        assertThat(cfg.getSccName()).isEqualTo("custom-scc");
        assertThat(cfg.getPskIdentity()).isEqualTo(TransferConfig.DEFAULT_PSK_IDENTITY);
    }

    @Test(expected = InvalidConfigurationException.class)
    public void invalidNumberInEnv() throws Exception
    {
        new TransferConfig(null, Collections.singletonMap(TransferEnvParser.CLIENT_ATTEMPTS, "many"));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void invalidPort() throws Exception
    {
        new TransferConfig(null, Collections.singletonMap(TransferEnvParser.STUNNEL_CONNECT_PORT, "70000"));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void brokenTomlFile() throws Exception
    {
        File dir = tmpFolder.newFolder("broken");
        Files.write(
            dir.toPath().resolve(TransferConfig.CONFIG_FILE_NAME),
            "[stunnel\nconnect_port = ".getBytes(StandardCharsets.UTF_8)
        );
        new TransferConfig(dir.toPath(), Collections.emptyMap());
    }
}
