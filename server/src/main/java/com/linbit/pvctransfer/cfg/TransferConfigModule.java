package com.linbit.pvctransfer.cfg;

import com.google.inject.AbstractModule;

public class TransferConfigModule extends AbstractModule
{
    private final TransferConfig transferCfg;

    public TransferConfigModule(TransferConfig transferCfgRef)
    {
        transferCfg = transferCfgRef;
    }

    @Override
    protected void configure()
    {
        bind(TransferConfig.class).toInstance(transferCfg);
    }
}
