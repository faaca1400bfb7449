package nl.nfi.pcfglite;

import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.text.PasswordAnalyzer;
import nl.nfi.pcfglite.train.PcfgTrainer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;

public final class Utils {

    public static final Path TEST_RESOURCES_PATH = Paths.get("src/test/resources").toAbsolutePath();

    // WORD8|DIGITS1 twice, WORD7 once ("letme1n" normalizes to "letmeln")
    public static final List<String> SCENARIO_CORPUS = List.of("password1", "Password2", "letme1n");

    public static PcfgModel trainScenarioModel() {
        return train(SCENARIO_CORPUS);
    }

    public static PcfgModel train(final List<String> corpus) {
        return PcfgTrainer.using(PasswordAnalyzer.create())
                .fit(corpus.stream())
                .model();
    }

    public static PcfgModel train(final String... corpus) {
        return PcfgTrainer.using(PasswordAnalyzer.create())
                .fit(Stream.of(corpus))
                .model();
    }
}
