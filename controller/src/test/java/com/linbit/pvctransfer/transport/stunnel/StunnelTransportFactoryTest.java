package com.linbit.pvctransfer.transport.stunnel;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.cfg.TransferConfig;
import com.linbit.pvctransfer.endpoint.Endpoint;
import com.linbit.pvctransfer.k8s.ObjectKey;
import com.linbit.pvctransfer.k8s.ObjectReconciler;
import com.linbit.pvctransfer.modularcrypto.CertificateBundle;
import com.linbit.pvctransfer.modularcrypto.CertificateBundleGenerator;
import com.linbit.pvctransfer.modularcrypto.PskSecretGenerator;
import com.linbit.pvctransfer.testutils.EmptyErrorReporter;
import com.linbit.pvctransfer.testutils.InMemoryResourceClient;
import com.linbit.pvctransfer.transport.CredentialType;
import com.linbit.pvctransfer.transport.TransportCredentials;
import com.linbit.pvctransfer.transport.TransportOptions;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.Map;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StunnelTransportFactoryTest
{
    private static final String NS = "ns";
    private static final String SUFFIX = "0123456789";
    private static final ObjectKey SERVER_CONFIG = new ObjectKey(NS, "server-stunnel-config-" + SUFFIX);
    private static final ObjectKey CLIENT_CONFIG = new ObjectKey(NS, "client-stunnel-config-" + SUFFIX);
    private static final ObjectKey CREDENTIALS = new ObjectKey(NS, "stunnel-credentials-" + SUFFIX);

    private InMemoryResourceClient store;
    private StunnelTransportFactory factory;
    private Endpoint endpoint;
    private TransportOptions options;

    @Before
    public void setUp()
    {
        store = new InMemoryResourceClient();
        EmptyErrorReporter errorReporter = new EmptyErrorReporter();
        ObjectReconciler reconciler = new ObjectReconciler(store, errorReporter);
        TransferConfig transferCfg = new TransferConfig();
        factory = new StunnelTransportFactory(
            reconciler,
            errorReporter,
            new StunnelCredentialReconciler(
                reconciler,
                errorReporter,
                new CertificateBundleGenerator(),
                new PskSecretGenerator(),
                transferCfg
            ),
            transferCfg
        );
        endpoint = Mockito.mock(Endpoint.class);
        Mockito.when(endpoint.getBackendPort()).thenReturn(6443);
        options = new TransportOptions().setLabels(Collections.singletonMap("app", "transfer"));
    }

    @Test
    public void serverReconcilesConfigAndCredentials() throws PvcTransferException
    {
        StunnelServer server = factory.createServer(NS, SUFFIX, endpoint, options);

        assertThat(server.getListenPort()).isEqualTo(6443);
        assertThat(server.getConnectPort()).isEqualTo(TransferConfig.DEFAULT_STUNNEL_CONNECT_PORT);
        assertThat(server.getHostname()).isEqualTo("localhost");
        assertThat(server.getCredentials()).isEqualTo(CREDENTIALS);
        assertThat(server.getContainers()).hasSize(1);
        assertThat(server.getContainers().get(0).getName()).isEqualTo("stunnel");
        assertThat(server.getVolumes()).extracting("name").containsExactly("stunnel-config", "stunnel-certs");

        ConfigMap config = store.get(ConfigMap.class, SERVER_CONFIG);
        assertThat(config.getMetadata().getLabels()).containsEntry("app", "transfer");
        assertThat(config.getData().get("stunnel.conf"))
            .contains("accept = 6443")
            .contains("connect = " + TransferConfig.DEFAULT_STUNNEL_CONNECT_PORT);

        Secret secret = store.get(Secret.class, CREDENTIALS);
        assertThat(secret.getType()).isEqualTo("Opaque");
        assertThat(CertificateBundle.isValid(StunnelCredentialReconciler.decode(secret.getData()))).isTrue();
    }

    @Test
    public void validCredentialsAreReused() throws PvcTransferException
    {
        factory.createServer(NS, SUFFIX, endpoint, options);
        Map<String, String> firstData = store.get(Secret.class, CREDENTIALS).getData();
        store.clearWriteLog();

        factory.createServer(NS, SUFFIX, endpoint, options);

        assertThat(store.get(Secret.class, CREDENTIALS).getData()).isEqualTo(firstData);
        assertThat(store.getWriteLog()).isEmpty();
    }

    @Test
    public void invalidCredentialsAreRegenerated() throws PvcTransferException
    {
        store.put(
            new SecretBuilder()
                .withNewMetadata()
                    .withNamespace(NS)
                    .withName(CREDENTIALS.getName())
                .endMetadata()
                .addToData("ca.crt", base64("not a certificate"))
                .build()
        );

        factory.createServer(NS, SUFFIX, endpoint, options);

        Secret secret = store.get(Secret.class, CREDENTIALS);
        assertThat(CertificateBundle.isValid(StunnelCredentialReconciler.decode(secret.getData()))).isTrue();
    }

    @Test
    public void pskCredentials() throws PvcTransferException
    {
        options.setCredentials(TransportCredentials.psk());

        StunnelServer server = factory.createServer(NS, SUFFIX, endpoint, options);

        Map<String, byte[]> data = StunnelCredentialReconciler.decode(store.get(Secret.class, CREDENTIALS).getData());
        assertThat(PskSecretGenerator.isValid(data)).isTrue();
        assertThat(new String(data.get("key"), StandardCharsets.US_ASCII))
            .startsWith(TransferConfig.DEFAULT_PSK_IDENTITY + ":");
        assertThat(store.get(ConfigMap.class, SERVER_CONFIG).getData().get("stunnel.conf")).contains("ciphers = PSK");
        assertThat(server.getVolumes().get(1).getSecret().getItems()).extracting("key").containsExactly("key");
    }

    @Test
    public void externalSecretIsUsedButNotOwned() throws PvcTransferException
    {
        ObjectKey external = new ObjectKey(NS, "my-certs");
        store.put(
            new SecretBuilder()
                .withNewMetadata()
                    .withNamespace(NS)
                    .withName(external.getName())
                .endMetadata()
                .withData(StunnelCredentialReconciler.encode(new CertificateBundleGenerator().generate().toSecretData()))
                .build()
        );
        options.setCredentials(new TransportCredentials(CredentialType.TLS, external));

        StunnelServer server = factory.createServer(NS, SUFFIX, endpoint, options);
        server.markForCleanup("migration-complete", "true");

        assertThat(server.getCredentials()).isEqualTo(external);
        assertThat(store.get(Secret.class, CREDENTIALS)).isNull();
        assertThat(store.get(Secret.class, external).getMetadata().getLabels()).isNullOrEmpty();
        assertThat(store.get(ConfigMap.class, SERVER_CONFIG).getMetadata().getLabels())
            .containsEntry("migration-complete", "true");
    }

    @Test
    public void externalSecretOfOtherNamespaceIsRejected()
    {
        options.setCredentials(new TransportCredentials(CredentialType.TLS, new ObjectKey("other", "certs")));

        assertThatThrownBy(() -> factory.createServer(NS, SUFFIX, endpoint, options))
            .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    public void missingExternalSecretIsRejected()
    {
        options.setCredentials(new TransportCredentials(CredentialType.TLS, new ObjectKey(NS, "certs")));

        assertThatThrownBy(() -> factory.createServer(NS, SUFFIX, endpoint, options))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    public void invalidCaVerifyLevelIsRejected()
    {
        options.setCaVerifyLevel("5");

        assertThatThrownBy(() -> factory.createServer(NS, SUFFIX, endpoint, options))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThat(store.count()).isZero();
    }

    @Test
    public void clientConnectsThroughProxy() throws PvcTransferException
    {
        options.setProxyUrl("http://proxy.example.com:3128/").setProxyUsername("user");

        StunnelClient client = factory.createClient(NS, SUFFIX, "server.example.com", 443, options);

        assertThat(client.getHostname()).isEqualTo("localhost");
        assertThat(client.getListenPort()).isEqualTo(TransferConfig.DEFAULT_STUNNEL_LISTEN_PORT);
        assertThat(client.getConnectPort()).isEqualTo(443);
        assertThat(client.getServerHostname()).isEqualTo("server.example.com");
        assertThat(store.get(ConfigMap.class, CLIENT_CONFIG).getData().get("stunnel.conf"))
            .contains("connect = proxy.example.com:3128")
            .contains("protocolHost = server.example.com:443")
            .contains("protocolUsername = user");
    }

    @Test
    public void cleanupMarksConfigAndOwnedCredentials() throws PvcTransferException
    {
        StunnelClient client = factory.createClient(NS, SUFFIX, "server", 443, options);
        int objectCount = store.count();

        client.markForCleanup("migration-complete", "true");

        assertThat(store.count()).isEqualTo(objectCount);
        assertThat(store.get(ConfigMap.class, CLIENT_CONFIG).getMetadata().getLabels())
            .containsEntry("migration-complete", "true");
        assertThat(store.get(Secret.class, CREDENTIALS).getMetadata().getLabels())
            .containsEntry("migration-complete", "true");
    }

    @Test
    public void proxyUrlIsReducedToHostAndPort()
    {
        assertThat(StunnelTransportFactory.proxyHost("http://proxy:3128/")).isEqualTo("proxy:3128");
        assertThat(StunnelTransportFactory.proxyHost("https://proxy:3128")).isEqualTo("proxy:3128");
        assertThat(StunnelTransportFactory.proxyHost("proxy:3128")).isEqualTo("proxy:3128");
        assertThat(StunnelTransportFactory.proxyHost("")).isNull();
        assertThat(StunnelTransportFactory.proxyHost(null)).isNull();
    }

    private static String base64(String value)
    {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
