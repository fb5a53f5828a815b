package com.linbit.pvctransfer.transport.stunnel;

import com.linbit.pvctransfer.transport.CredentialType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.fabric8.kubernetes.api.model.ContainerPort;
import io.fabric8.kubernetes.api.model.ContainerPortBuilder;
import io.fabric8.kubernetes.api.model.KeyToPath;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;

/**
 * Pod fragments shared by both ends of the tunnel
 */
final class StunnelPodSpec
{
    static final String CONTAINER_NAME = "stunnel";
    static final String CONFIG_KEY = "stunnel.conf";
    static final String CONFIG_PATH = "/etc/stunnel/stunnel.conf";
    static final String CONFIG_VOLUME = "stunnel-config";
    static final String CERTS_VOLUME = "stunnel-certs";
    static final String STUNNEL_BIN = "/bin/stunnel";

    private StunnelPodSpec()
    {
    }

    static List<Volume> volumes(String configMapName, String secretName, CredentialType type, String role)
    {
        List<KeyToPath> items = new ArrayList<>();
        if (type == CredentialType.PSK)
        {
            items.add(new KeyToPath("key", null, "key"));
        }
        else
        {
            items.add(new KeyToPath("ca.crt", null, "ca.crt"));
            items.add(new KeyToPath(role + ".crt", null, role + ".crt"));
            items.add(new KeyToPath(role + ".key", null, role + ".key"));
        }
        return Arrays.asList(
            new VolumeBuilder()
                .withName(CONFIG_VOLUME)
                .withNewConfigMap()
                    .withName(configMapName)
                .endConfigMap()
                .build(),
            new VolumeBuilder()
                .withName(CERTS_VOLUME)
                .withNewSecret()
                    .withSecretName(secretName)
                    .withItems(items)
                .endSecret()
                .build()
        );
    }

    static List<VolumeMount> volumeMounts()
    {
        return Arrays.asList(
            new VolumeMountBuilder()
                .withName(CONFIG_VOLUME)
                .withMountPath(CONFIG_PATH)
                .withSubPath(CONFIG_KEY)
                .build(),
            new VolumeMountBuilder()
                .withName(CERTS_VOLUME)
                .withMountPath(StunnelConfigRenderer.CERTS_DIR)
                .build()
        );
    }

    static ContainerPort port(int port)
    {
        return new ContainerPortBuilder()
            .withName(CONTAINER_NAME)
            .withProtocol("TCP")
            .withContainerPort(port)
            .build();
    }
}
