package com.linbit.pvctransfer.cfg;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.annotation.Nullable;

import java.util.function.Function;

class TransferEnvParser
{
    public static final String TRANSFER_IMAGE = "PVC_TRANSFER_IMAGE";
    public static final String STUNNEL_IMAGE = "PVC_TRANSFER_STUNNEL_IMAGE";
    public static final String SCC_NAME = "PVC_TRANSFER_SCC_NAME";
    public static final String RSYNC_USER = "PVC_TRANSFER_RSYNC_USER";
    public static final String STUNNEL_CONNECT_PORT = "PVC_TRANSFER_STUNNEL_CONNECT_PORT";
    public static final String STUNNEL_LISTEN_PORT = "PVC_TRANSFER_STUNNEL_LISTEN_PORT";
    public static final String CLIENT_CONNECT_TIMEOUT = "PVC_TRANSFER_CLIENT_CONNECT_TIMEOUT";
    public static final String CLIENT_ATTEMPTS = "PVC_TRANSFER_CLIENT_ATTEMPTS";
    public static final String CLIENT_INITIAL_BACKOFF = "PVC_TRANSFER_CLIENT_INITIAL_BACKOFF";
    public static final String SENTINEL_TIMEOUT = "PVC_TRANSFER_SENTINEL_TIMEOUT";
    public static final String PSK_IDENTITY = "PVC_TRANSFER_PSK_IDENTITY";
    public static final String NAME_LIMIT = "PVC_TRANSFER_NAME_LIMIT";

    private TransferEnvParser()
    {
    }

    static void applyTo(TransferConfig cfg, Function<String, String> envLookup) throws InvalidConfigurationException
    {
        cfg.setTransferImage(getEnv(envLookup, TRANSFER_IMAGE));
        cfg.setStunnelImage(getEnv(envLookup, STUNNEL_IMAGE));
        cfg.setSccName(getEnv(envLookup, SCC_NAME));
        cfg.setRsyncUser(getEnv(envLookup, RSYNC_USER));
        cfg.setStunnelConnectPort(getIntEnv(envLookup, STUNNEL_CONNECT_PORT));
        cfg.setStunnelListenPort(getIntEnv(envLookup, STUNNEL_LISTEN_PORT));
        cfg.setClientConnectTimeoutSec(getIntEnv(envLookup, CLIENT_CONNECT_TIMEOUT));
        cfg.setClientAttempts(getIntEnv(envLookup, CLIENT_ATTEMPTS));
        cfg.setClientInitialBackoffSec(getIntEnv(envLookup, CLIENT_INITIAL_BACKOFF));
        cfg.setTunnelSentinelTimeoutSec(getIntEnv(envLookup, SENTINEL_TIMEOUT));
        cfg.setPskIdentity(getEnv(envLookup, PSK_IDENTITY));
        cfg.setResourceNameLimit(getIntEnv(envLookup, NAME_LIMIT));
    }

    static @Nullable String getEnv(Function<String, String> envLookup, String envKey)
    {
        String ret = envLookup.apply(envKey);
        if (ret != null && ret.trim().isEmpty())
        {
            ret = null;
        }
        return ret;
    }

    static @Nullable Integer getIntEnv(Function<String, String> envLookup, String envKey)
        throws InvalidConfigurationException
    {
        Integer ret = null;
        String value = getEnv(envLookup, envKey);
        if (value != null)
        {
            try
            {
                ret = Integer.parseInt(value.trim());
            }
            catch (NumberFormatException nfExc)
            {
                throw new InvalidConfigurationException(
                    String.format("Environment variable %s is not a number: '%s'", envKey, value)
                );
            }
        }
        return ret;
    }
}
