package nl.nfi.pcfglite.guess;

import nl.nfi.pcfglite.common.logger.LoggerConfigurator;
import nl.nfi.pcfglite.config.PcfgConfig;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.concurrent.Callable;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "pcfg_generator", description = "Generate ranked password candidates from a trained model")
public class PcfgGeneratorCli implements Callable<Integer> {

    @Option(names = {"--model"}, description = "The model snapshot to generate candidates from", required = true)
    private String modelPath;

    @Option(names = {"--output_directory"}, description = "Directory to write the deterministic, stochastic and combined candidate files to", required = true)
    private String outputDirectory;

    @Option(names = {"--config"}, description = "INI file with generation settings")
    private String configPath;

    @Option(names = {"--skip_deterministic"}, description = "Do not run the beam search")
    private boolean skipDeterministic = false;

    @Option(names = {"--skip_stochastic"}, description = "Do not run the weighted sampling")
    private boolean skipStochastic = false;

    @Option(names = {"--seed"}, description = "Seed for the weighted sampling (overrides RNG_SEED)")
    private Long seed;

    @Option(names = {"--samples"}, description = "Number of weighted samples to draw (overrides STOCHASTIC_NUM_SAMPLES)")
    private Integer samples;

    @Option(names = {"--max_candidates"}, description = "Maximum number of beam search candidates (overrides BEAM_MAX_TOTAL_CANDIDATES)")
    private Integer maxCandidates;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() throws Exception {
        // must be set before the first logger is created
        if (logPath != null) {
            System.setProperty(LoggerConfigurator.LOG_DIRECTORY_PROPERTY, logPath);
        }

        try {
            PcfgConfig config = configPath == null ? PcfgConfig.defaults() : PcfgConfig.loadFrom(Paths.get(configPath));
            if (seed != null) {
                config = config.withSampling(config.sampling().withSeed(seed));
            }
            if (samples != null) {
                config = config.withSampling(config.sampling().withNumSamples(samples));
            }
            if (maxCandidates != null) {
                config = config.withBeam(config.beam().withMaxTotal(maxCandidates));
            }

            final GenerationReport report = CandidatePipeline.forModel(Paths.get(modelPath), config)
                    .deterministic(!skipDeterministic)
                    .stochastic(!skipStochastic)
                    .generateInto(Paths.get(outputDirectory));

            System.out.printf("deterministic: %d%nstochastic: %d%ncombined: %d%n", report.deterministic(), report.stochastic(), report.combined());
        } catch (final Throwable t) {
            LoggerFactory.getLogger(PcfgGeneratorCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }
}
