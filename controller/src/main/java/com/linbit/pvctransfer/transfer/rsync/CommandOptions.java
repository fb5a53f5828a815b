package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.InvalidConfigurationException;
import com.linbit.pvctransfer.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The flags of the rsync client command. Build the command line with {@link #toArgs()}.
 */
public class CommandOptions
{
    private static final Pattern INFO_PATTERN = Pattern.compile("^[A-Z]+\\d?$");
    private static final Pattern EXTRA_PATTERN = Pattern.compile("^-{1,2}([a-z0-9]+-)*[a-z0-9]+$");

    private boolean recursive;
    private boolean symLinks;
    private boolean permissions;
    private boolean modTimes;
    private boolean deviceFiles;
    private boolean specialFiles;
    private boolean groups;
    private boolean owners;
    private boolean hardLinks;
    private boolean delete;
    private boolean partial;
    private @Nullable Integer bwLimit;
    private boolean humanReadable;
    private @Nullable String logFile;
    private List<String> info = new ArrayList<>();
    private List<String> extras = new ArrayList<>();

    /**
     * @return archive semantics and standard progress reporting, customized by the given options
     */
    public static CommandOptions withDefaults(RsyncOption... opts)
    {
        CommandOptions ret = new CommandOptions();
        ret.apply(RsyncOption.archiveFiles(true), RsyncOption.standardProgress(true));
        ret.apply(opts);
        return ret;
    }

    public CommandOptions apply(RsyncOption... opts)
    {
        for (RsyncOption opt : opts)
        {
            opt.applyTo(this);
        }
        return this;
    }

    /**
     * @throws InvalidConfigurationException listing every invalid value if any option fails validation
     */
    public List<String> toArgs() throws InvalidConfigurationException
    {
        List<String> errors = new ArrayList<>();
        List<String> args = new ArrayList<>();
        addIf(args, recursive, "--recursive");
        addIf(args, symLinks, "--links");
        addIf(args, permissions, "--perms");
        addIf(args, deviceFiles, "--devices");
        addIf(args, specialFiles, "--specials");
        addIf(args, modTimes, "--times");
        addIf(args, owners, "--owner");
        addIf(args, groups, "--group");
        addIf(args, hardLinks, "--hard-links");
        addIf(args, delete, "--delete");
        addIf(args, partial, "--partial");
        if (bwLimit != null)
        {
            if (bwLimit > 0)
            {
                args.add("--bwlimit=" + bwLimit);
            }
            else
            {
                errors.add("rsync bwlimit value must be a positive integer, got " + bwLimit);
            }
        }
        addIf(args, humanReadable, "--human-readable");
        if (logFile != null && !logFile.isEmpty())
        {
            args.add("--log-file=" + logFile);
        }
        if (!info.isEmpty())
        {
            List<String> validInfo = new ArrayList<>();
            for (String flag : info)
            {
                String trimmed = flag == null ? "" : flag.trim();
                if (INFO_PATTERN.matcher(trimmed).matches())
                {
                    validInfo.add(trimmed);
                }
                else
                {
                    errors.add("invalid value '" + flag + "' for rsync option --info");
                }
            }
            if (!validInfo.isEmpty())
            {
                args.add("--info=" + String.join(",", validInfo));
            }
        }
        for (String extra : extras)
        {
            if (extra != null && EXTRA_PATTERN.matcher(extra).matches())
            {
                args.add(extra);
            }
            else
            {
                errors.add("invalid rsync option '" + extra + "'");
            }
        }

        if (!errors.isEmpty())
        {
            throw new InvalidConfigurationException(
                "Invalid rsync command options: " + String.join("; ", errors),
                "Flags must look like -x or --long-flag, --info values like NAME or NAME2"
            );
        }
        return args;
    }

    private static void addIf(List<String> args, boolean condition, String arg)
    {
        if (condition)
        {
            args.add(arg);
        }
    }

    public boolean isRecursive()
    {
        return recursive;
    }

    public void setRecursive(boolean recursiveRef)
    {
        recursive = recursiveRef;
    }

    public boolean isSymLinks()
    {
        return symLinks;
    }

    public void setSymLinks(boolean symLinksRef)
    {
        symLinks = symLinksRef;
    }

    public boolean isPermissions()
    {
        return permissions;
    }

    public void setPermissions(boolean permissionsRef)
    {
        permissions = permissionsRef;
    }

    public boolean isModTimes()
    {
        return modTimes;
    }

    public void setModTimes(boolean modTimesRef)
    {
        modTimes = modTimesRef;
    }

    public boolean isDeviceFiles()
    {
        return deviceFiles;
    }

    public void setDeviceFiles(boolean deviceFilesRef)
    {
        deviceFiles = deviceFilesRef;
    }

    public boolean isSpecialFiles()
    {
        return specialFiles;
    }

    public void setSpecialFiles(boolean specialFilesRef)
    {
        specialFiles = specialFilesRef;
    }

    public boolean isGroups()
    {
        return groups;
    }

    public void setGroups(boolean groupsRef)
    {
        groups = groupsRef;
    }

    public boolean isOwners()
    {
        return owners;
    }

    public void setOwners(boolean ownersRef)
    {
        owners = ownersRef;
    }

    public boolean isHardLinks()
    {
        return hardLinks;
    }

    public void setHardLinks(boolean hardLinksRef)
    {
        hardLinks = hardLinksRef;
    }

    public boolean isDelete()
    {
        return delete;
    }

    public void setDelete(boolean deleteRef)
    {
        delete = deleteRef;
    }

    public boolean isPartial()
    {
        return partial;
    }

    public void setPartial(boolean partialRef)
    {
        partial = partialRef;
    }

    public @Nullable Integer getBwLimit()
    {
        return bwLimit;
    }

    public void setBwLimit(@Nullable Integer bwLimitRef)
    {
        bwLimit = bwLimitRef;
    }

    public boolean isHumanReadable()
    {
        return humanReadable;
    }

    public void setHumanReadable(boolean humanReadableRef)
    {
        humanReadable = humanReadableRef;
    }

    public @Nullable String getLogFile()
    {
        return logFile;
    }

    public void setLogFile(@Nullable String logFileRef)
    {
        logFile = logFileRef;
    }

    public List<String> getInfo()
    {
        return Collections.unmodifiableList(info);
    }

    public void setInfo(List<String> infoRef)
    {
        info = new ArrayList<>(infoRef);
    }

    public List<String> getExtras()
    {
        return Collections.unmodifiableList(extras);
    }

    public void setExtras(List<String> extrasRef)
    {
        extras = new ArrayList<>(extrasRef);
    }
}
