package nl.nfi.pcfglite.pcfg;

import nl.nfi.pcfglite.config.PcfgConfig;
import nl.nfi.pcfglite.serialize.ModelCodec;
import nl.nfi.pcfglite.text.InvalidInputException;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "pcfg_scorer", description = "Print the log-probability of every password in the input")
public class PcfgScorerCli implements Callable<Integer> {

    @Option(names = {"--model"}, description = "The model snapshot to score against", required = true)
    private String modelPath;

    @Option(names = {"--input"}, description = "File with one password per line")
    private String inputPath = "-";

    @Option(names = {"--output"}, description = "The file to write <password> TAB <score> lines to")
    private String outputPath = "-";

    @Option(names = {"--config"}, description = "INI file with text settings, must match the ones used for training")
    private String configPath;

    @Override
    public Integer call() throws Exception {
        try {
            final PcfgConfig config = configPath == null ? PcfgConfig.defaults() : PcfgConfig.loadFrom(Paths.get(configPath));
            final PcfgModel model = ModelCodec.load(Paths.get(modelPath));
            final Scorer scorer = Scorer.using(config.createAnalyzer());

            try (final BufferedReader input = inputPath.equals("-")
                    ? new BufferedReader(new InputStreamReader(System.in, UTF_8))
                    : Files.newBufferedReader(Paths.get(inputPath), UTF_8)) {
                if (outputPath.equals("-")) {
                    // stdout stays open
                    final PrintStream output = new PrintStream(System.out, false, UTF_8);
                    scoreAll(model, scorer, input, output);
                    output.flush();
                } else {
                    try (final PrintStream output = new PrintStream(new BufferedOutputStream(new FileOutputStream(outputPath)), false, UTF_8)) {
                        scoreAll(model, scorer, input, output);
                    }
                }
            }
        } catch (final Throwable t) {
            LoggerFactory.getLogger(PcfgScorerCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }

    private static void scoreAll(final PcfgModel model, final Scorer scorer, final BufferedReader input, final PrintStream output) throws IOException {
        String password;
        while ((password = input.readLine()) != null) {
            if (password.isEmpty()) {
                continue;
            }
            try {
                output.println(password + "\t" + scorer.score(model, password));
            } catch (final InvalidInputException e) {
                LoggerFactory.getLogger(PcfgScorerCli.class).warn("Cannot score {}: {}", password, e.getMessage());
            }
        }
    }
}
