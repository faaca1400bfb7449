package nl.nfi.pcfglite.main;

import nl.nfi.pcfglite.pcfg.PcfgScorerCli;
import picocli.CommandLine;

public final class ScorerMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new PcfgScorerCli()).execute(args);
        System.exit(exitCode);
    }
}
