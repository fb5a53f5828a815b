package com.linbit.pvctransfer.transfer.rsync;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A customization of the rsync command line. Options are applied in order, later options
 * override earlier ones.
 */
@FunctionalInterface
public interface RsyncOption
{
    void applyTo(CommandOptions opts);

    /**
     * Recursion plus preservation of symlinks, permissions, modification times, owner, group,
     * device and special files and hard links
     */
    static RsyncOption archiveFiles(boolean enable)
    {
        return opts ->
        {
            opts.setRecursive(enable);
            opts.setSymLinks(enable);
            opts.setPermissions(enable);
            opts.setModTimes(enable);
            opts.setGroups(enable);
            opts.setOwners(enable);
            opts.setDeviceFiles(enable);
            opts.setSpecialFiles(enable);
            opts.setHardLinks(enable);
        };
    }

    static RsyncOption preserveOwnership(boolean enable)
    {
        return opts ->
        {
            opts.setOwners(enable);
            opts.setGroups(enable);
        };
    }

    static RsyncOption standardProgress(boolean enable)
    {
        return opts ->
        {
            opts.setInfo(
                enable ?
                    Arrays.asList("COPY2", "DEL2", "REMOVE2", "SKIP2", "FLIST2", "PROGRESS2", "STATS2") :
                    new ArrayList<>()
            );
            opts.setHumanReadable(enable);
        };
    }

    /**
     * Deletes files on the receiving side that do not exist on the sending side
     */
    static RsyncOption deleteDestination(boolean enable)
    {
        return opts -> opts.setDelete(enable);
    }

    static RsyncOption partial(boolean enable)
    {
        return opts -> opts.setPartial(enable);
    }

    /**
     * @param kbPerSec must be positive, validated when the command line is built
     */
    static RsyncOption bwLimit(int kbPerSec)
    {
        return opts -> opts.setBwLimit(kbPerSec);
    }

    static RsyncOption logFile(String path)
    {
        return opts -> opts.setLogFile(path);
    }

    static RsyncOption info(List<String> infoFlags)
    {
        return opts -> opts.setInfo(infoFlags);
    }

    static RsyncOption extras(List<String> extraFlags)
    {
        return opts -> opts.setExtras(extraFlags);
    }
}
