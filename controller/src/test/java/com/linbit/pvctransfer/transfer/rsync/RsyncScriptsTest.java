package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.pvc.Pvc;
import com.linbit.pvctransfer.pvc.PvcList;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import static com.linbit.pvctransfer.testutils.K8sTestObjects.claim;
import static org.assertj.core.api.Assertions.assertThat;

public class RsyncScriptsTest
{
    private final Pvc pvc = PvcList.of(claim("ns", "data")).getPvcs().get(0);

    @Test
    public void clientRetriesWithBackoff()
    {
        String script = RsyncScripts.clientScript(
            pvc,
            "root",
            "localhost",
            6443,
            Arrays.asList("--recursive", "--delete"),
            120,
            5,
            2
        );

        assertThat(script)
            .startsWith("trap \"touch /usr/share/rsync/rsync-client-container-done\" EXIT SIGINT SIGTERM\n")
            .contains("while [ $SECONDS -lt 120 ]; do")
            .contains("nc -z localhost 6443")
            .contains(
                "/usr/bin/rsync --recursive --delete /mnt/ns/" + pvc.getLabelSafeName() + "/ " +
                    "rsync://root@localhost:6443/" + pvc.getLabelSafeName()
            )
            .contains("[ $ATTEMPT -ge 5 ]")
            .contains("BACKOFF=2\n")
            .contains("BACKOFF=$((BACKOFF*2))")
            .contains("SENTINEL=/usr/share/rsync/" + pvc.getLabelSafeName() + ".done\n")
            .contains("rsync://root@localhost:6443/termination/")
            .endsWith("exit $RC\n");
    }

    @Test
    public void failedClientStillReportsToDaemon()
    {
        String script = RsyncScripts.clientScript(
            pvc, "root", "localhost", 6443, Collections.singletonList("--recursive"), 120, 3, 1
        );

        String afterRetries = script.substring(script.indexOf("if [ $RC -eq 0 ]; then\n    SENTINEL="));
        assertThat(afterRetries)
            .contains("else\n    SENTINEL=/usr/share/rsync/" + pvc.getLabelSafeName() + ".failed\nfi\n")
            .contains(
                "fi\ntouch \"$SENTINEL\"\n" +
                    "if ! /usr/bin/rsync \"$SENTINEL\" rsync://root@localhost:6443/termination/; then\n"
            )
            .endsWith("exit $RC\n");
    }

    @Test
    public void unreachableHostnameIsQuotedInMessage()
    {
        String script = RsyncScripts.clientScript(
            pvc, "root", "$(reboot)", 6443, Collections.singletonList("--recursive"), 1, 1, 1
        );

        assertThat(script)
            .contains("nc -z '$(reboot)' 6443")
            .contains("echo '$(reboot):6443 not reachable after 1 seconds'\n")
            .doesNotContain("\"$(reboot)");
    }

    @Test
    public void serverWaitsForEverySentinel()
    {
        List<Pvc> pvcs = PvcList.of(claim("ns", "data-a"), claim("ns", "data-b")).getPvcs();

        String script = RsyncScripts.serverScript(8080, pvcs, 3600);

        assertThat(script)
            .contains("--daemon --no-detach --port=8080")
            .contains("VOLUMES=(" + pvcs.get(0).getLabelSafeName() + " " + pvcs.get(1).getLabelSafeName() + ")\n")
            .contains("[ -f \"/usr/share/rsync/termination/$VOLUME.done\" ]")
            .contains("if [ $((DONE+FAILED)) -eq ${#VOLUMES[@]} ]; then")
            .contains("exit $RC");
    }

    @Test
    public void serverFinishesWhenClientFails()
    {
        String script = RsyncScripts.serverScript(8080, Collections.singletonList(pvc), 600);

        assertThat(script)
            .contains(
                "elif [ -f \"/usr/share/rsync/termination/$VOLUME.failed\" ]; then\n" +
                    "            FAILED=$((FAILED+1))"
            )
            .contains("echo \"$FAILED client(s) failed\"\n        exit 1\n");
    }

    @Test
    public void serverWaitIsBounded()
    {
        String script = RsyncScripts.serverScript(8080, Collections.singletonList(pvc), 600);

        assertThat(script)
            .contains("SECONDS=0\nwhile [ $SECONDS -lt 600 ]; do\n")
            .endsWith("echo \"clients did not finish within 600 seconds\"\nkill $RSYNC_PID\nexit 1\n");
    }

    @Test
    public void sidecarPollIsBounded()
    {
        String script = RsyncScripts.tunnelSidecarScript(
            Arrays.asList("/bin/stunnel", "/etc/stunnel/stunnel.conf"),
            3600
        );

        assertThat(script)
            .startsWith("/bin/stunnel /etc/stunnel/stunnel.conf &\n")
            .contains("while [ $SECONDS -lt 3600 ]; do")
            .contains("if [ -f /usr/share/rsync/rsync-client-container-done ]; then")
            .endsWith("exit 1\n");
    }

    @Test
    public void unsafeArgumentsAreQuoted()
    {
        String script = RsyncScripts.clientScript(
            pvc, "root", "localhost", 6443, Collections.singletonList("--log-file=/tmp/a b"), 1, 1, 1
        );

        assertThat(script).contains("'--log-file=/tmp/a b'");
    }
}
