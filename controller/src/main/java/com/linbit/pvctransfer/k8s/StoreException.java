package com.linbit.pvctransfer.k8s;

import com.linbit.pvctransfer.PvcTransferException;

import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * A read or write of the object store failed
 */
public class StoreException extends PvcTransferException
{
    private static final long serialVersionUID = -7330964217311577823L;

    public static final int HTTP_NOT_FOUND = 404;
    public static final int HTTP_CONFLICT = 409;

    private final int code;

    public StoreException(String message, int codeRef)
    {
        super(message);
        code = codeRef;
    }

    public StoreException(String message, KubernetesClientException cause)
    {
        super(message, cause);
        code = cause.getCode();
    }

    /**
     * @return the HTTP status code of the failed request, 0 if the request did not get a response
     */
    public int getCode()
    {
        return code;
    }

    /**
     * A conditional update lost against a concurrent writer. The caller may retry the whole reconciliation.
     */
    public boolean isConflict()
    {
        return code == HTTP_CONFLICT;
    }

    public boolean isNotFound()
    {
        return code == HTTP_NOT_FOUND;
    }
}
