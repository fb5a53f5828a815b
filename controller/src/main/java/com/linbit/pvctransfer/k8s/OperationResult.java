package com.linbit.pvctransfer.k8s;

public enum OperationResult
{
    CREATED,
    UPDATED,
    UNCHANGED,
    NOT_FOUND
}
