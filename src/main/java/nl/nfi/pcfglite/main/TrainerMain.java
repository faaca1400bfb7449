package nl.nfi.pcfglite.main;

import nl.nfi.pcfglite.train.PcfgTrainerCli;
import picocli.CommandLine;

public final class TrainerMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new PcfgTrainerCli()).execute(args);
        System.exit(exitCode);
    }
}
