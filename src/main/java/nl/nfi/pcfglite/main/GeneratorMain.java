package nl.nfi.pcfglite.main;

import nl.nfi.pcfglite.guess.PcfgGeneratorCli;
import picocli.CommandLine;

public final class GeneratorMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new PcfgGeneratorCli()).execute(args);
        System.exit(exitCode);
    }
}
