package com.linbit.pvctransfer.naming;

import com.linbit.pvctransfer.pvc.PvcList;

import java.util.Map;

import org.junit.Test;

import static com.linbit.pvctransfer.testutils.PvcFactory.claim;
import static org.assertj.core.api.Assertions.assertThat;

public class ResourceNamesTest
{
    @Test
    public void suffixIsStableAndShort()
    {
        PvcList pvcs = PvcList.of(claim("ns", "data-1"), claim("ns", "data-2"));

        String suffix = ResourceNames.identitySuffix(pvcs);

        assertThat(suffix).hasSize(ResourceNames.SUFFIX_LENGTH).matches("[0-9a-f]+");
        assertThat(ResourceNames.identitySuffix(pvcs)).isEqualTo(suffix);
        assertThat(ResourceNames.identitySuffix(PvcList.of(claim("ns", "data-1"), claim("ns", "data-2"))))
            .isEqualTo(suffix);
    }

    @Test
    public void suffixIgnoresOrder()
    {
        assertThat(ResourceNames.identitySuffix(PvcList.of(claim("ns", "a"), claim("ns", "b"))))
            .isEqualTo(ResourceNames.identitySuffix(PvcList.of(claim("ns", "b"), claim("ns", "a"))));
    }

    @Test
    public void suffixChangesWithVolumeSet()
    {
        String base = ResourceNames.identitySuffix(PvcList.of(claim("ns", "a"), claim("ns", "b")));

        assertThat(ResourceNames.identitySuffix(PvcList.of(claim("ns", "a")))).isNotEqualTo(base);
        assertThat(ResourceNames.identitySuffix(PvcList.of(claim("ns", "a"), claim("ns", "c")))).isNotEqualTo(base);
        assertThat(ResourceNames.identitySuffix(PvcList.of(claim("other", "a"), claim("other", "b"))))
            .isNotEqualTo(base);
        assertThat(ResourceNames.identitySuffix(PvcList.of(claim("ns", "ab")))).isNotEqualTo(base);
    }

    @Test
    public void namespaceSeparatorPreventsShiftedNames()
    {
        assertThat(ResourceNames.identitySuffix(PvcList.of(claim("ns", "ab"))))
            .isNotEqualTo(ResourceNames.identitySuffix(PvcList.of(claim("nsa", "b"))));
    }

    @Test
    public void buildJoinsAndTruncates()
    {
        assertThat(ResourceNames.build(ResourceNames.RSYNC_SERVER, "0123456789")).isEqualTo("rsync-server-0123456789");

        StringBuilder longComponent = new StringBuilder();
        for (int idx = 0; idx < 70; idx++)
        {
            longComponent.append('x');
        }
        String name = ResourceNames.build(longComponent.toString(), "0123456789");
        assertThat(name).hasSize(ResourceNames.DEFAULT_NAME_LIMIT);
        assertThat(name).doesNotContain("0123456789");

        assertThat(ResourceNames.build("abc", "def", 5)).isEqualTo("abc-d");
    }

    @Test
    public void namespaceHashesPerNamespace()
    {
        Map<String, String> hashes = ResourceNames.namespaceHashes(
            PvcList.of(claim("ns1", "a"), claim("ns2", "a"), claim("ns1", "b"))
        );

        assertThat(hashes).containsOnlyKeys("ns1", "ns2");
        assertThat(hashes.get("ns1")).hasSize(32);
        assertThat(hashes.get("ns1")).isNotEqualTo(hashes.get("ns2"));
        assertThat(hashes.get("ns1")).startsWith(ResourceNames.identitySuffix(PvcList.of(claim("ns1", "a"), claim("ns1", "b"))));
    }
}
