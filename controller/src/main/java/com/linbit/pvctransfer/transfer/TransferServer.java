package com.linbit.pvctransfer.transfer;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.annotation.Nullable;
import com.linbit.pvctransfer.endpoint.Endpoint;
import com.linbit.pvctransfer.pvc.PvcList;
import com.linbit.pvctransfer.transport.Transport;

/**
 * Receiving side of a transfer. One server serves every volume of its namespace.
 */
public interface TransferServer
{
    /**
     * @return the endpoint clients connect to, or null if the caller manages the endpoint
     */
    @Nullable
    Endpoint getEndpoint();

    Transport getTransport();

    /**
     * @return the port the mover daemon listens on
     */
    int getListenPort();

    PvcList getPvcs();

    /**
     * @return true if the mover and all transport containers are ready
     */
    boolean isHealthy() throws PvcTransferException;

    TransferStatus getStatus() throws PvcTransferException;

    boolean isCompleted() throws PvcTransferException;

    /**
     * Labels every owned object with the given key and value. Nothing is deleted.
     */
    void markForCleanup(String key, String value) throws PvcTransferException;
}
