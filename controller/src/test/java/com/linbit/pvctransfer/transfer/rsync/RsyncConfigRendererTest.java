package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.pvc.Pvc;
import com.linbit.pvctransfer.pvc.PvcList;

import org.junit.Test;

import static com.linbit.pvctransfer.testutils.K8sTestObjects.claim;
import static org.assertj.core.api.Assertions.assertThat;

public class RsyncConfigRendererTest
{
    private final PvcList pvcList = PvcList.of(claim("ns", "data-a"), claim("ns", "data-b"));

    @Test
    public void modulePerVolume()
    {
        String conf = RsyncConfigRenderer.renderServer("root", true, true, pvcList);

        for (Pvc pvc : pvcList.getPvcs())
        {
            assertThat(conf)
                .contains("[" + pvc.getLabelSafeName() + "]")
                .contains("comment = archive for ns/" + pvc.getName())
                .contains("path = /mnt/ns/" + pvc.getLabelSafeName());
        }
        assertThat(conf)
            .contains("[termination]")
            .contains("path = /usr/share/rsync/termination")
            .contains("read only = false")
            .contains("secrets file = /etc/rsync-secret/rsyncd.secrets")
            .contains("auth users = root");
    }

    @Test
    public void tunnelRestrictsToLocalhost()
    {
        assertThat(RsyncConfigRenderer.renderServer("root", true, true, pvcList))
            .contains("hosts allow = ::1, 127.0.0.1, localhost");
        assertThat(RsyncConfigRenderer.renderServer("root", true, false, pvcList))
            .contains("hosts allow = *.*.*.*, *");
    }

    @Test
    public void noAuthWithoutPassword()
    {
        String conf = RsyncConfigRenderer.renderServer("root", false, true, pvcList);

        assertThat(conf)
            .doesNotContain("auth users")
            .doesNotContain("secrets file");
    }
}
