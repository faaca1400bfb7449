package nl.nfi.pcfglite.train;

import nl.nfi.pcfglite.common.Timers.TimedResult;
import nl.nfi.pcfglite.common.logger.LoggerConfigurator;
import nl.nfi.pcfglite.config.PcfgConfig;
import nl.nfi.pcfglite.config.TrainingSettings;
import nl.nfi.pcfglite.serialize.ModelCodec;
import nl.nfi.pcfglite.serialize.ModelSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import static nl.nfi.pcfglite.common.Formatting.toHumanReadableDuration;
import static nl.nfi.pcfglite.common.Timers.time;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "pcfg_trainer", description = "Train a password model from a corpus with one password per line")
public class PcfgTrainerCli implements Callable<Integer> {

    @Option(names = {"--corpus"}, description = "The password corpus to train on", required = true)
    private String corpusPath;

    @Option(names = {"--output"}, description = "The file to write the model snapshot to", required = true)
    private String outputPath;

    @Option(names = {"--config"}, description = "INI file with training settings")
    private String configPath;

    @Option(names = {"--min_length"}, description = "Only train on passwords of at least this length (overrides TRAINING_MIN_LENGTH)")
    private Integer minLength;

    @Option(names = {"--alpha"}, description = "Smoothing strength (overrides ALPHA)")
    private Double alpha;

    @Option(names = {"--max_lines"}, description = "Read at most this many corpus lines (overrides MAX_TRAINING_LINES)")
    private Long maxLines;

    @Option(names = {"--summary"}, description = "Also write a JSON summary of the model to this file")
    private String summaryPath;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() throws Exception {
        // must be set before the first logger is created
        if (logPath != null) {
            System.setProperty(LoggerConfigurator.LOG_DIRECTORY_PROPERTY, logPath);
        }
        final Logger log = LoggerFactory.getLogger(PcfgTrainerCli.class);

        try {
            PcfgConfig config = configPath == null ? PcfgConfig.defaults() : PcfgConfig.loadFrom(Paths.get(configPath));
            TrainingSettings training = config.training();
            if (minLength != null) {
                training = training.withMinLength(minLength);
            }
            if (alpha != null) {
                training = training.withAlpha(alpha);
            }
            if (maxLines != null) {
                training = training.withMaxLines(maxLines);
            }
            config = config.withTraining(training);

            final PcfgTrainer trainer = PcfgTrainer.using(config.createAnalyzer())
                    .alpha(training.alpha())
                    .minLength(training.minLength())
                    .maxLines(training.maxLines())
                    .progressInterval(training.progressInterval());

            final Path corpus = Paths.get(corpusPath);
            final TimedResult<TrainingResult> result;
            try (final Stream<String> lines = CorpusReader.lines(corpus, training.encoding())) {
                result = time(() -> trainer.fit(lines));
            }
            log.info("Trained on {} in {}", corpus, toHumanReadableDuration(result.duration()));

            final TrainingReport report = result.value().report();
            ModelCodec.save(result.value().model(), Paths.get(outputPath));
            if (summaryPath != null) {
                ModelSummary.writeTo(result.value().model(), config.summaryTopN(), Paths.get(summaryPath));
            }

            System.out.printf("read: %d%nprocessed: %d%nfiltered: %d%nskipped: %d%n", report.read(), report.processed(), report.filtered(), report.skipped());
        } catch (final Throwable t) {
            log.error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }
}
