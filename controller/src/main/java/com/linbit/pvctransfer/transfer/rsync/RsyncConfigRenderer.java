package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.pvc.Pvc;
import com.linbit.pvctransfer.pvc.PvcList;

/**
 * Renders rsyncd.conf for the mover daemon. Every volume becomes a module named after its label-safe
 * name, plus the {@value RsyncScripts#TERMINATION_MODULE} module that receives the sentinel files of
 * finished clients.
 */
public class RsyncConfigRenderer
{
    static final String SECRETS_FILE = RsyncScripts.SECRET_DIR + "/rsyncd.secrets";

    private RsyncConfigRenderer()
    {
    }

    /**
     * @param authUser the user clients have to authenticate as if {@code withAuth} is set
     * @param allowLocalhostOnly true if the daemon sits behind a tunnel on the same pod
     */
    public static String renderServer(String authUser, boolean withAuth, boolean allowLocalhostOnly, PvcList pvcList)
    {
        StringBuilder conf = new StringBuilder();
        line(conf, "syslog facility = local7");
        line(conf, "read only = no");
        line(conf, "list = yes");
        line(conf, "log file = /dev/stdout");
        line(conf, "max verbosity = 4");
        if (withAuth)
        {
            line(conf, "auth users = " + authUser);
        }
        line(conf, allowLocalhostOnly ? "hosts allow = ::1, 127.0.0.1, localhost" : "hosts allow = *.*.*.*, *");
        line(conf, "uid = root");
        line(conf, "gid = root");

        for (Pvc pvc : pvcList.getPvcs())
        {
            conf.append('\n');
            line(conf, "[" + pvc.getLabelSafeName() + "]");
            line(conf, "    comment = archive for " + pvc.getNamespace() + "/" + pvc.getName());
            line(conf, "    path = " + RsyncScripts.mountPath(pvc));
            line(conf, "    use chroot = no");
            line(conf, "    munge symlinks = no");
            line(conf, "    list = yes");
            line(conf, "    read only = false");
            appendAuth(conf, authUser, withAuth);
        }

        conf.append('\n');
        line(conf, "[" + RsyncScripts.TERMINATION_MODULE + "]");
        line(conf, "    comment = sentinel files of finished clients");
        line(conf, "    path = " + RsyncScripts.TERMINATION_DIR);
        line(conf, "    use chroot = no");
        line(conf, "    list = no");
        line(conf, "    read only = false");
        appendAuth(conf, authUser, withAuth);
        return conf.toString();
    }

    private static void appendAuth(StringBuilder conf, String authUser, boolean withAuth)
    {
        if (withAuth)
        {
            line(conf, "    auth users = " + authUser);
            line(conf, "    secrets file = " + SECRETS_FILE);
        }
    }

    private static void line(StringBuilder conf, String text)
    {
        conf.append(text).append('\n');
    }
}
