package com.linbit.pvctransfer.utils;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Helpers for the startup scripts that run inside the transfer containers
 */
public class ShellUtils
{
    public static final String BASH = "/bin/bash";

    // same character class as Python's shlex.quote
    private static final Pattern UNSAFE_FOR_SHELL = Pattern.compile("[^\\w@%+=:,./-]");

    private ShellUtils()
    {
    }

    /**
     * @return the container command that runs the given script with bash
     */
    public static List<String> bashCommand(String script)
    {
        return Arrays.asList(BASH, "-c", script);
    }

    /**
     * Single quotes the argument unless it consists of characters that are safe for a POSIX shell only
     */
    public static String shellQuote(String arg)
    {
        String ret;
        if (arg.isEmpty())
        {
            ret = "''";
        }
        else
        if (UNSAFE_FOR_SHELL.matcher(arg).find())
        {
            ret = "'" + arg.replace("'", "'\"'\"'") + "'";
        }
        else
        {
            ret = arg;
        }
        return ret;
    }

    /**
     * @return the quoted arguments, separated by single blanks
     */
    public static String joinShellQuote(List<String> args)
    {
        assert args.stream().noneMatch(Objects::isNull) : "null argument in " + args;

        return args.stream().map(ShellUtils::shellQuote).collect(Collectors.joining(" "));
    }
}
