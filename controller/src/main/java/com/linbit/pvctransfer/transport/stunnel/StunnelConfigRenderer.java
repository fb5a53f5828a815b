package com.linbit.pvctransfer.transport.stunnel;

import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.transport.CredentialType;

/**
 * Renders stunnel.conf for both ends of the tunnel
 */
public class StunnelConfigRenderer
{
    static final String CERTS_DIR = "/etc/stunnel/certs";
    static final String SERVICE_NAME = "transfer";

    private StunnelConfigRenderer()
    {
    }

    public static String renderServer(
        int acceptPort,
        int connectPort,
        CredentialType credentialType,
        boolean noVerifyCa,
        String caVerifyLevel
    )
    {
        StringBuilder conf = new StringBuilder();
        line(conf, "foreground = no");
        line(conf, "pid =");
        line(conf, "socket = l:TCP_NODELAY=1");
        line(conf, "socket = r:TCP_NODELAY=1");
        line(conf, "debug = 7");
        line(conf, "sslVersion = TLSv1.3");
        line(conf, "output = /dev/stdout");
        appendCredentials(conf, credentialType, "server", noVerifyCa, caVerifyLevel);
        conf.append('\n');
        line(conf, "[" + SERVICE_NAME + "]");
        line(conf, "accept = " + acceptPort);
        line(conf, "connect = " + connectPort);
        line(conf, "TIMEOUTclose = 0");
        return conf.toString();
    }

    /**
     * @param proxyHost {@code host:port} of an HTTP proxy that supports CONNECT, or null to connect directly
     */
    public static String renderClient(
        int listenPort,
        String hostname,
        int connectPort,
        @Nullable String proxyHost,
        @Nullable String proxyUsername,
        @Nullable String proxyPassword,
        CredentialType credentialType,
        boolean noVerifyCa,
        String caVerifyLevel
    )
    {
        StringBuilder conf = new StringBuilder();
        line(conf, "foreground = yes");
        line(conf, "pid =");
        line(conf, "client = yes");
        line(conf, "syslog = no");
        line(conf, "socket = l:TCP_NODELAY=1");
        line(conf, "socket = r:TCP_NODELAY=1");
        line(conf, "sslVersion = TLSv1.3");
        line(conf, "output = /dev/stdout");
        conf.append('\n');
        line(conf, "[" + SERVICE_NAME + "]");
        line(conf, "debug = 7");
        line(conf, "accept = " + listenPort);
        appendCredentials(conf, credentialType, "client", noVerifyCa, caVerifyLevel);
        String target = hostname + ":" + connectPort;
        if (isSet(proxyHost))
        {
            line(conf, "protocol = connect");
            line(conf, "connect = " + proxyHost);
            line(conf, "protocolHost = " + target);
            if (isSet(proxyUsername))
            {
                line(conf, "protocolUsername = " + proxyUsername);
            }
            if (isSet(proxyPassword))
            {
                line(conf, "protocolPassword = " + proxyPassword);
            }
        }
        else
        {
            line(conf, "connect = " + target);
        }
        return conf.toString();
    }

    private static void appendCredentials(
        StringBuilder conf,
        CredentialType credentialType,
        String role,
        boolean noVerifyCa,
        String caVerifyLevel
    )
    {
        switch (credentialType)
        {
            case PSK:
                line(conf, "ciphers = PSK");
                line(conf, "PSKsecrets = " + CERTS_DIR + "/key");
                break;
            case TLS:
            default:
                line(conf, "key = " + CERTS_DIR + "/" + role + ".key");
                line(conf, "cert = " + CERTS_DIR + "/" + role + ".crt");
                if (!noVerifyCa)
                {
                    line(conf, "CAfile = " + CERTS_DIR + "/ca.crt");
                    line(conf, "verify = " + caVerifyLevel);
                }
                break;
        }
    }

    private static void line(StringBuilder conf, String text)
    {
        conf.append(text).append('\n');
    }

    private static boolean isSet(@Nullable String str)
    {
        return str != null && !str.isEmpty();
    }
}
