package com.linbit.pvctransfer.transfer;

import com.linbit.pvctransfer.PvcTransferException;
import com.linbit.pvctransfer.pvc.Pvc;
import com.linbit.pvctransfer.pvc.PvcList;
import com.linbit.pvctransfer.transport.Transport;

import java.util.Map;

/**
 * Sending side of a transfer. Every volume is copied by its own pod and completes independently.
 */
public interface TransferClient
{
    Transport getTransport();

    PvcList getPvcs();

    TransferStatus getStatus(Pvc pvc) throws PvcTransferException;

    /**
     * @return the status per label-safe volume name
     */
    Map<String, TransferStatus> getStatuses() throws PvcTransferException;

    /**
     * @return true if the pods of all volumes have completed, successfully or not
     */
    boolean isCompleted() throws PvcTransferException;

    /**
     * Labels every owned object with the given key and value. Nothing is deleted.
     */
    void markForCleanup(String key, String value) throws PvcTransferException;
}
