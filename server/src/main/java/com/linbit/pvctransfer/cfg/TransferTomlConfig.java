package com.linbit.pvctransfer.cfg;

import com.linbit.pvctransfer.annotation.Nullable;

@SuppressWarnings("checkstyle:MemberName")
public class TransferTomlConfig
{
    static class Images
    {
        private @Nullable String transfer;
        private @Nullable String stunnel;

        public void applyTo(TransferConfig cfg)
        {
            cfg.setTransferImage(transfer);
            cfg.setStunnelImage(stunnel);
        }
    }

    static class Security
    {
        private @Nullable String scc_name;
        private @Nullable String rsync_user;
        private @Nullable String psk_identity;

        public void applyTo(TransferConfig cfg)
        {
            cfg.setSccName(scc_name);
            cfg.setRsyncUser(rsync_user);
            cfg.setPskIdentity(psk_identity);
        }
    }

    static class Stunnel
    {
        private @Nullable Integer connect_port;
        private @Nullable Integer listen_port;
        private @Nullable Integer sentinel_timeout;

        public void applyTo(TransferConfig cfg)
        {
            cfg.setStunnelConnectPort(connect_port);
            cfg.setStunnelListenPort(listen_port);
            cfg.setTunnelSentinelTimeoutSec(sentinel_timeout);
        }
    }

    static class Client
    {
        private @Nullable Integer connect_timeout;
        private @Nullable Integer attempts;
        private @Nullable Integer initial_backoff;

        public void applyTo(TransferConfig cfg)
        {
            cfg.setClientConnectTimeoutSec(connect_timeout);
            cfg.setClientAttempts(attempts);
            cfg.setClientInitialBackoffSec(initial_backoff);
        }
    }

    static class Naming
    {
        private @Nullable Integer name_limit;

        public void applyTo(TransferConfig cfg)
        {
            cfg.setResourceNameLimit(name_limit);
        }
    }

    private Images images = new Images();
    private Security security = new Security();
    private Stunnel stunnel = new Stunnel();
    private Client client = new Client();
    private Naming naming = new Naming();

    public void applyTo(TransferConfig cfg)
    {
        images.applyTo(cfg);
        security.applyTo(cfg);
        stunnel.applyTo(cfg);
        client.applyTo(cfg);
        naming.applyTo(cfg);
    }
}
