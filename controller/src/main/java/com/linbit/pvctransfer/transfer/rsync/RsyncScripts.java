package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.pvc.Pvc;
import com.linbit.pvctransfer.utils.ShellUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup scripts of the mover containers and of the client side tunnel sidecar.
 *
 * Coordination between the containers happens through files only: a finished client copies
 * {@code <labelSafeName>.done}, or {@code <labelSafeName>.failed} once its retries are exhausted, into the
 * termination module of the daemon, and touches
 * {@value #CLIENT_DONE_FILE} in the pod local communication volume to release its tunnel sidecar.
 */
public class RsyncScripts
{
    public static final String RSYNC_BIN = "/usr/bin/rsync";
    public static final String COMMUNICATION_DIR = "/usr/share/rsync";
    public static final String CLIENT_DONE_FILE = COMMUNICATION_DIR + "/rsync-client-container-done";
    public static final String TERMINATION_MODULE = "termination";
    public static final String TERMINATION_DIR = COMMUNICATION_DIR + "/" + TERMINATION_MODULE;
    public static final String SENTINEL_EXTENSION = ".done";
    public static final String FAILED_EXTENSION = ".failed";
    public static final String LOG_DIR = "/var/log/rsyncd/";
    public static final String SECRET_DIR = "/etc/rsync-secret";
    public static final String PASSWORD_ENV = "RSYNC_PASSWORD";

    private RsyncScripts()
    {
    }

    public static String mountPath(Pvc pvc)
    {
        return "/mnt/" + pvc.getNamespace() + "/" + pvc.getLabelSafeName();
    }

    /**
     * Runs the daemon in the background until every volume delivered a sentinel. Exits 0 if all of them
     * are {@code .done}, 1 if any client reported {@code .failed} or the timeout expired, and with the
     * status of the daemon if it dies first.
     */
    public static String serverScript(int port, List<Pvc> pvcs, int timeoutSec)
    {
        List<String> volumes = new ArrayList<>();
        for (Pvc pvc : pvcs)
        {
            volumes.add(pvc.getLabelSafeName());
        }
        return "mkdir -p " + TERMINATION_DIR + "\n" +
            RSYNC_BIN + " --daemon --no-detach --port=" + port + " -vvv > >(tee " + LOG_DIR + "rsync.log) 2>&1 &\n" +
            "RSYNC_PID=$!\n" +
            "VOLUMES=(" + ShellUtils.joinShellQuote(volumes) + ")\n" +
            "SECONDS=0\n" +
            "while [ $SECONDS -lt " + timeoutSec + " ]; do\n" +
            "    DONE=0\n" +
            "    FAILED=0\n" +
            "    for VOLUME in \"${VOLUMES[@]}\"; do\n" +
            "        if [ -f \"" + TERMINATION_DIR + "/$VOLUME" + SENTINEL_EXTENSION + "\" ]; then\n" +
            "            DONE=$((DONE+1))\n" +
            "        elif [ -f \"" + TERMINATION_DIR + "/$VOLUME" + FAILED_EXTENSION + "\" ]; then\n" +
            "            FAILED=$((FAILED+1))\n" +
            "        fi\n" +
            "    done\n" +
            "    if [ $((DONE+FAILED)) -eq ${#VOLUMES[@]} ]; then\n" +
            "        kill $RSYNC_PID\n" +
            "        if [ $FAILED -eq 0 ]; then\n" +
            "            echo \"all clients finished\"\n" +
            "            exit 0\n" +
            "        fi\n" +
            "        echo \"$FAILED client(s) failed\"\n" +
            "        exit 1\n" +
            "    fi\n" +
            "    if ! kill -0 $RSYNC_PID 2>/dev/null; then\n" +
            "        wait $RSYNC_PID\n" +
            "        RC=$?\n" +
            "        echo \"rsync daemon exited with status $RC\"\n" +
            "        exit $RC\n" +
            "    fi\n" +
            "    sleep 1\n" +
            "done\n" +
            "echo \"clients did not finish within " + timeoutSec + " seconds\"\n" +
            "kill $RSYNC_PID\n" +
            "exit 1\n";
    }

    /**
     * Waits for the transport, syncs the volume with bounded retries and reports completion to the
     * daemon and to the tunnel sidecar
     *
     * @param hostname the address the mover connects to, usually the local end of the tunnel
     * @param rsyncArgs validated rsync flags
     */
    public static String clientScript(
        Pvc pvc,
        String user,
        String hostname,
        int port,
        List<String> rsyncArgs,
        int connectTimeoutSec,
        int attempts,
        int initialBackoffSec
    )
    {
        String baseUrl = "rsync://" + user + "@" + hostname + ":" + port + "/";
        List<String> syncCmd = new ArrayList<>();
        syncCmd.add(RSYNC_BIN);
        syncCmd.addAll(rsyncArgs);
        syncCmd.add(mountPath(pvc) + "/");
        syncCmd.add(baseUrl + pvc.getLabelSafeName());

        String sentinelBase = COMMUNICATION_DIR + "/" + pvc.getLabelSafeName();
        return "trap \"touch " + CLIENT_DONE_FILE + "\" EXIT SIGINT SIGTERM\n" +
            "SECONDS=0\n" +
            "REACHABLE=0\n" +
            "while [ $SECONDS -lt " + connectTimeoutSec + " ]; do\n" +
            "    if nc -z " + ShellUtils.shellQuote(hostname) + " " + port + "; then\n" +
            "        REACHABLE=1\n" +
            "        break\n" +
            "    fi\n" +
            "    sleep 1\n" +
            "done\n" +
            "if [ $REACHABLE -ne 1 ]; then\n" +
            "    echo " + ShellUtils.shellQuote(hostname + ":" + port + " not reachable after " + connectTimeoutSec +
                " seconds") + "\n" +
            "    exit 1\n" +
            "fi\n" +
            "ATTEMPT=1\n" +
            "BACKOFF=" + initialBackoffSec + "\n" +
            "while true; do\n" +
            "    " + ShellUtils.joinShellQuote(syncCmd) + "\n" +
            "    RC=$?\n" +
            "    if [ $RC -eq 0 ] || [ $ATTEMPT -ge " + attempts + " ]; then\n" +
            "        break\n" +
            "    fi\n" +
            "    echo \"rsync attempt $ATTEMPT failed with status $RC, retrying in $BACKOFF seconds\"\n" +
            "    sleep $BACKOFF\n" +
            "    BACKOFF=$((BACKOFF*2))\n" +
            "    ATTEMPT=$((ATTEMPT+1))\n" +
            "done\n" +
            "if [ $RC -eq 0 ]; then\n" +
            "    SENTINEL=" + sentinelBase + SENTINEL_EXTENSION + "\n" +
            "else\n" +
            "    SENTINEL=" + sentinelBase + FAILED_EXTENSION + "\n" +
            "fi\n" +
            "touch \"$SENTINEL\"\n" +
            "if ! " + RSYNC_BIN + " \"$SENTINEL\" " + ShellUtils.shellQuote(baseUrl + TERMINATION_MODULE + "/") +
            "; then\n" +
            "    echo \"unable to deliver the sentinel to the daemon\"\n" +
            "fi\n" +
            "exit $RC\n";
    }

    /**
     * Runs the tunnel in the background until the mover container finished or the timeout expired.
     * Running into the timeout is a failure of the sidecar.
     */
    public static String tunnelSidecarScript(List<String> tunnelCommand, int timeoutSec)
    {
        return ShellUtils.joinShellQuote(tunnelCommand) + " &\n" +
            "TUNNEL_PID=$!\n" +
            "SECONDS=0\n" +
            "while [ $SECONDS -lt " + timeoutSec + " ]; do\n" +
            "    if [ -f " + CLIENT_DONE_FILE + " ]; then\n" +
            "        kill $TUNNEL_PID\n" +
            "        exit 0\n" +
            "    fi\n" +
            "    sleep 1\n" +
            "done\n" +
            "echo \"mover did not finish within " + timeoutSec + " seconds\"\n" +
            "kill $TUNNEL_PID\n" +
            "exit 1\n";
    }
}
