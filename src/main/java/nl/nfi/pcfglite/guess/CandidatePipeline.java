package nl.nfi.pcfglite.guess;

import nl.nfi.pcfglite.common.Timers.TimedResult;
import nl.nfi.pcfglite.config.PcfgConfig;
import nl.nfi.pcfglite.guess.generate.BeamSearch;
import nl.nfi.pcfglite.guess.generate.Candidate;
import nl.nfi.pcfglite.guess.generate.CandidateAggregator;
import nl.nfi.pcfglite.guess.generate.CandidateWriter;
import nl.nfi.pcfglite.guess.generate.RandomWalk;
import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.pcfg.Scorer;
import nl.nfi.pcfglite.serialize.ModelCodec;
import nl.nfi.pcfglite.text.PasswordAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static nl.nfi.pcfglite.common.Formatting.toHumanReadableCount;
import static nl.nfi.pcfglite.common.Formatting.toHumanReadableDuration;
import static nl.nfi.pcfglite.common.Timers.time;

// runs both generators against one loaded model and writes the candidate artifacts
public final class CandidatePipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CandidatePipeline.class);

    public static final String DETERMINISTIC_FILE_NAME = "candidates_det.txt";
    public static final String STOCHASTIC_FILE_NAME = "candidates_sto.txt";
    public static final String COMBINED_FILE_NAME = "candidates_combined.txt";

    private final PcfgModel model;
    private final PcfgConfig config;
    private final Scorer scorer;
    private final boolean deterministic;
    private final boolean stochastic;

    private CandidatePipeline(final PcfgModel model, final PcfgConfig config, final Scorer scorer, final boolean deterministic, final boolean stochastic) {
        this.model = model;
        this.config = config;
        this.scorer = scorer;
        this.deterministic = deterministic;
        this.stochastic = stochastic;
    }

    public static CandidatePipeline forModel(final Path modelPath, final PcfgConfig config) throws IOException {
        return forModel(ModelCodec.load(modelPath), config, config.createAnalyzer());
    }

    public static CandidatePipeline forModel(final PcfgModel model, final PcfgConfig config, final PasswordAnalyzer analyzer) {
        Scorer.requireTrained(model);
        return new CandidatePipeline(model, config, Scorer.using(analyzer), true, true);
    }

    public CandidatePipeline deterministic(final boolean deterministic) {
        return new CandidatePipeline(model, config, scorer, deterministic, stochastic);
    }

    public CandidatePipeline stochastic(final boolean stochastic) {
        return new CandidatePipeline(model, config, scorer, deterministic, stochastic);
    }

    public GenerationResult generate() {
        final TimedResult<List<Candidate>> det = time(() -> deterministic
                ? BeamSearch.init(scorer, config.beam(), config.length()).generate(model)
                : List.<Candidate>of());
        final TimedResult<List<Candidate>> sto = time(() -> stochastic
                ? RandomWalk.init(scorer, config.sampling(), config.length()).generate(model)
                : List.<Candidate>of());
        LOG.debug("Beam search took {}, sampling took {}", toHumanReadableDuration(det.duration()), toHumanReadableDuration(sto.duration()));

        final List<String> combined = CandidateAggregator.combine(det.value(), sto.value(), config.length());
        return new GenerationResult(det.value(), sto.value(), combined, det.duration().plus(sto.duration()));
    }

    public GenerationReport generateInto(final Path outputDirectory) throws IOException {
        final GenerationResult result = generate();

        if (deterministic) {
            CandidateWriter.writeCandidates(result.deterministic(), outputDirectory.resolve(DETERMINISTIC_FILE_NAME));
        }
        if (stochastic) {
            CandidateWriter.writeCandidates(result.stochastic(), outputDirectory.resolve(STOCHASTIC_FILE_NAME));
        }
        CandidateWriter.write(result.combined(), outputDirectory.resolve(COMBINED_FILE_NAME));

        final GenerationReport report = result.report();
        LOG.info("Deterministic: {}, stochastic: {}, combined: {} (took {})",
                toHumanReadableCount(report.deterministic()),
                toHumanReadableCount(report.stochastic()),
                toHumanReadableCount(report.combined()),
                toHumanReadableDuration(report.duration()));
        LOG.info("Candidates written to {}", outputDirectory.resolve(COMBINED_FILE_NAME));
        return report;
    }

    public record GenerationResult(List<Candidate> deterministic, List<Candidate> stochastic, List<String> combined, Duration duration) {

        public GenerationReport report() {
            return new GenerationReport(deterministic.size(), stochastic.size(), combined.size(), duration);
        }
    }
}
