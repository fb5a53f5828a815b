package com.linbit.pvctransfer.cfg;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.annotation.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

import com.moandjiezana.toml.Toml;

/**
 * Settings shared by the transport, transfer and naming components.
 * Values are layered: built-in defaults, then the TOML file {@value #CONFIG_FILE_NAME}
 * of the configuration directory, then {@code PVC_TRANSFER_*} environment variables.
 */
public class TransferConfig
{
    public static final String CONFIG_FILE_NAME = "pvc-transfer.toml";

    public static final String DEFAULT_TRANSFER_IMAGE = "quay.io/konveyor/rsync-transfer:latest";
    public static final String DEFAULT_STUNNEL_IMAGE = "quay.io/konveyor/rsync-transfer:latest";
    public static final String DEFAULT_SCC_NAME = "pvc-transfer-mover";
    public static final String DEFAULT_RSYNC_USER = "root";
    public static final int DEFAULT_STUNNEL_CONNECT_PORT = 8080;
    public static final int DEFAULT_STUNNEL_LISTEN_PORT = 6443;
    public static final int DEFAULT_CLIENT_CONNECT_TIMEOUT_SEC = 120;
    public static final int DEFAULT_CLIENT_ATTEMPTS = 5;
    public static final int DEFAULT_CLIENT_INITIAL_BACKOFF_SEC = 2;
    public static final int DEFAULT_TUNNEL_SENTINEL_TIMEOUT_SEC = 24 * 60 * 60;
    public static final String DEFAULT_PSK_IDENTITY = "pvc-transfer";
    public static final int DEFAULT_RESOURCE_NAME_LIMIT = 62;

    private String transferImage;
    private String stunnelImage;
    private String sccName;
    private String rsyncUser;
    private int stunnelConnectPort;
    private int stunnelListenPort;
    private int clientConnectTimeoutSec;
    private int clientAttempts;
    private int clientInitialBackoffSec;
    private int tunnelSentinelTimeoutSec;
    private String pskIdentity;
    private int resourceNameLimit;

    /**
     * Creates a configuration that only contains the default values
     */
    public TransferConfig()
    {
        applyDefaultValues();
    }

    /**
     * Creates a configuration from the defaults, the TOML file in the given directory (if it exists)
     * and the process environment
     */
    public TransferConfig(@Nullable Path configDir) throws InvalidConfigurationException
    {
        this(configDir, System::getenv);
    }

    public TransferConfig(@Nullable Path configDir, Map<String, String> env) throws InvalidConfigurationException
    {
        this(configDir, env::get);
    }

    private TransferConfig(@Nullable Path configDir, Function<String, String> envLookup)
        throws InvalidConfigurationException
    {
        applyDefaultValues();
        if (configDir != null)
        {
            applyTomlArgs(configDir.resolve(CONFIG_FILE_NAME).normalize());
        }
        TransferEnvParser.applyTo(this, envLookup);
        validate();
    }

    protected void applyDefaultValues()
    {
        transferImage = DEFAULT_TRANSFER_IMAGE;
        stunnelImage = DEFAULT_STUNNEL_IMAGE;
        sccName = DEFAULT_SCC_NAME;
        rsyncUser = DEFAULT_RSYNC_USER;
        stunnelConnectPort = DEFAULT_STUNNEL_CONNECT_PORT;
        stunnelListenPort = DEFAULT_STUNNEL_LISTEN_PORT;
        clientConnectTimeoutSec = DEFAULT_CLIENT_CONNECT_TIMEOUT_SEC;
        clientAttempts = DEFAULT_CLIENT_ATTEMPTS;
        clientInitialBackoffSec = DEFAULT_CLIENT_INITIAL_BACKOFF_SEC;
        tunnelSentinelTimeoutSec = DEFAULT_TUNNEL_SENTINEL_TIMEOUT_SEC;
        pskIdentity = DEFAULT_PSK_IDENTITY;
        resourceNameLimit = DEFAULT_RESOURCE_NAME_LIMIT;
    }

    protected void applyTomlArgs(Path configPath) throws InvalidConfigurationException
    {
        if (Files.exists(configPath))
        {
            try
            {
                TransferTomlConfig transferToml = new Toml().read(configPath.toFile()).to(TransferTomlConfig.class);
                transferToml.applyTo(this);
            }
            catch (RuntimeException tomlExc)
            {
                throw new InvalidConfigurationException(
                    String.format("Error parsing '%s': %s", configPath, tomlExc.getMessage()),
                    "Correct the syntax of the configuration file"
                );
            }
        }
    }

    private void validate() throws InvalidConfigurationException
    {
        checkPort("stunnel connect port", stunnelConnectPort);
        checkPort("stunnel listen port", stunnelListenPort);
        checkPositive("client connect timeout", clientConnectTimeoutSec);
        checkPositive("client attempts", clientAttempts);
        checkPositive("client initial backoff", clientInitialBackoffSec);
        checkPositive("tunnel sentinel timeout", tunnelSentinelTimeoutSec);
        checkPositive("resource name limit", resourceNameLimit);
        if (rsyncUser.isEmpty())
        {
            throw new InvalidConfigurationException("The rsync user name must not be empty");
        }
        if (pskIdentity.isEmpty() || pskIdentity.contains(":"))
        {
            throw new InvalidConfigurationException(
                "Invalid PSK identity '" + pskIdentity + "'",
                "The PSK identity must not be empty and must not contain ':'"
            );
        }
    }

    private static void checkPort(String what, int port) throws InvalidConfigurationException
    {
        if (port < 1 || port > 65535)
        {
            throw new InvalidConfigurationException("Invalid " + what + ": " + port);
        }
    }

    private static void checkPositive(String what, int value) throws InvalidConfigurationException
    {
        if (value < 1)
        {
            throw new InvalidConfigurationException("The " + what + " must be positive, but was " + value);
        }
    }

    public void setTransferImage(@Nullable String transferImageRef)
    {
        if (transferImageRef != null)
        {
            transferImage = transferImageRef;
        }
    }

    public void setStunnelImage(@Nullable String stunnelImageRef)
    {
        if (stunnelImageRef != null)
        {
            stunnelImage = stunnelImageRef;
        }
    }

    public void setSccName(@Nullable String sccNameRef)
    {
        if (sccNameRef != null)
        {
            sccName = sccNameRef;
        }
    }

    public void setRsyncUser(@Nullable String rsyncUserRef)
    {
        if (rsyncUserRef != null)
        {
            rsyncUser = rsyncUserRef;
        }
    }

    public void setStunnelConnectPort(@Nullable Integer stunnelConnectPortRef)
    {
        if (stunnelConnectPortRef != null)
        {
            stunnelConnectPort = stunnelConnectPortRef;
        }
    }

    public void setStunnelListenPort(@Nullable Integer stunnelListenPortRef)
    {
        if (stunnelListenPortRef != null)
        {
            stunnelListenPort = stunnelListenPortRef;
        }
    }

    public void setClientConnectTimeoutSec(@Nullable Integer clientConnectTimeoutSecRef)
    {
        if (clientConnectTimeoutSecRef != null)
        {
            clientConnectTimeoutSec = clientConnectTimeoutSecRef;
        }
    }

    public void setClientAttempts(@Nullable Integer clientAttemptsRef)
    {
        if (clientAttemptsRef != null)
        {
            clientAttempts = clientAttemptsRef;
        }
    }

    public void setClientInitialBackoffSec(@Nullable Integer clientInitialBackoffSecRef)
    {
        if (clientInitialBackoffSecRef != null)
        {
            clientInitialBackoffSec = clientInitialBackoffSecRef;
        }
    }

    public void setTunnelSentinelTimeoutSec(@Nullable Integer tunnelSentinelTimeoutSecRef)
    {
        if (tunnelSentinelTimeoutSecRef != null)
        {
            tunnelSentinelTimeoutSec = tunnelSentinelTimeoutSecRef;
        }
    }

    public void setPskIdentity(@Nullable String pskIdentityRef)
    {
        if (pskIdentityRef != null)
        {
            pskIdentity = pskIdentityRef;
        }
    }

    public void setResourceNameLimit(@Nullable Integer resourceNameLimitRef)
    {
        if (resourceNameLimitRef != null)
        {
            resourceNameLimit = resourceNameLimitRef;
        }
    }

    public String getTransferImage()
    {
        return transferImage;
    }

    public String getStunnelImage()
    {
        return stunnelImage;
    }

    public String getSccName()
    {
        return sccName;
    }

    public String getRsyncUser()
    {
        return rsyncUser;
    }

    public int getStunnelConnectPort()
    {
        return stunnelConnectPort;
    }

    public int getStunnelListenPort()
    {
        return stunnelListenPort;
    }

    public int getClientConnectTimeoutSec()
    {
        return clientConnectTimeoutSec;
    }

    public int getClientAttempts()
    {
        return clientAttempts;
    }

    public int getClientInitialBackoffSec()
    {
        return clientInitialBackoffSec;
    }

    public int getTunnelSentinelTimeoutSec()
    {
        return tunnelSentinelTimeoutSec;
    }

    public String getPskIdentity()
    {
        return pskIdentity;
    }

    public int getResourceNameLimit()
    {
        return resourceNameLimit;
    }
}
