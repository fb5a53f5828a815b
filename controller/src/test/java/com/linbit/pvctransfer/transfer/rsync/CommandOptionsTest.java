package com.linbit.pvctransfer.transfer.rsync;

import com.linbit.pvctransfer.InvalidConfigurationException;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CommandOptionsTest
{
    @Test
    public void defaultsAreArchiveWithoutDelete() throws InvalidConfigurationException
    {
        List<String> args = CommandOptions.withDefaults().toArgs();

        assertThat(args).containsExactly(
            "--recursive",
            "--links",
            "--perms",
            "--devices",
            "--specials",
            "--times",
            "--owner",
            "--group",
            "--hard-links",
            "--human-readable",
            "--info=COPY2,DEL2,REMOVE2,SKIP2,FLIST2,PROGRESS2,STATS2"
        );
        assertThat(args).doesNotContain("--delete");
    }

    @Test
    public void deleteDestinationAddsExactlyDelete() throws InvalidConfigurationException
    {
        List<String> defaults = CommandOptions.withDefaults().toArgs();
        List<String> withDelete = CommandOptions.withDefaults(RsyncOption.deleteDestination(true)).toArgs();

        assertThat(withDelete).hasSize(defaults.size() + 1);
        assertThat(withDelete).containsAll(defaults);
        assertThat(withDelete).contains("--delete");
    }

    @Test
    public void optInFlags() throws InvalidConfigurationException
    {
        List<String> args = CommandOptions.withDefaults(
            RsyncOption.partial(true),
            RsyncOption.bwLimit(1024),
            RsyncOption.logFile("/dev/stdout")
        ).toArgs();

        assertThat(args).contains("--partial", "--bwlimit=1024", "--log-file=/dev/stdout");
    }

    @Test
    public void preserveOwnershipCanBeDisabled() throws InvalidConfigurationException
    {
        List<String> args = CommandOptions.withDefaults(RsyncOption.preserveOwnership(false)).toArgs();

        assertThat(args).doesNotContain("--owner", "--group").contains("--perms");
    }

    @Test
    public void invalidValuesAreReportedTogether()
    {
        CommandOptions opts = CommandOptions.withDefaults(
            RsyncOption.bwLimit(0),
            RsyncOption.info(Arrays.asList("COPY2", "bad info")),
            RsyncOption.extras(Arrays.asList("--checksum", "--rsh=evil", "; rm -rf /"))
        );

        assertThatThrownBy(opts::toArgs)
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("bwlimit")
            .hasMessageContaining("bad info")
            .hasMessageContaining("--rsh=evil")
            .hasMessageContaining("; rm -rf /")
            .satisfies(exc -> assertThat(exc.getMessage()).doesNotContain("'--checksum'"));
    }

    @Test
    public void validExtrasAreAppended() throws InvalidConfigurationException
    {
        List<String> args = CommandOptions.withDefaults(
            RsyncOption.extras(Arrays.asList("-z", "--no-inc-recursive"))
        ).toArgs();

        assertThat(args).endsWith("-z", "--no-inc-recursive");
    }
}
