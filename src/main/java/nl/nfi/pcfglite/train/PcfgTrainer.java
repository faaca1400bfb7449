package nl.nfi.pcfglite.train;

import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.text.InvalidInputException;
import nl.nfi.pcfglite.text.PasswordAnalyzer;
import nl.nfi.pcfglite.text.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.function.LongConsumer;
import java.util.stream.Stream;

import static nl.nfi.pcfglite.train.CorpusReader.REPLACEMENT_CHARACTER;

/**
 * Trains a {@link PcfgModel} in a single forward pass over a corpus.
 * <p>
 * Only the counts are retained, so memory grows with the vocabulary and not with the corpus.
 * Empty and malformed lines are skipped and counted, they never abort the pass.
 */
public final class PcfgTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(PcfgTrainer.class);

    private final PasswordAnalyzer analyzer;
    private final double alpha;
    private final int minLength;
    private final long maxLines;
    private final long progressInterval;
    private final LongConsumer progressListener;

    private PcfgTrainer(final PasswordAnalyzer analyzer, final double alpha, final int minLength, final long maxLines, final long progressInterval, final LongConsumer progressListener) {
        this.analyzer = analyzer;
        this.alpha = alpha;
        this.minLength = minLength;
        this.maxLines = maxLines;
        this.progressInterval = progressInterval;
        this.progressListener = progressListener;
    }

    public static PcfgTrainer using(final PasswordAnalyzer analyzer) {
        return new PcfgTrainer(analyzer, 1.0, 0, 0, 100_000, read -> {});
    }

    public PcfgTrainer alpha(final double alpha) {
        return new PcfgTrainer(analyzer, alpha, minLength, maxLines, progressInterval, progressListener);
    }

    // lines with fewer code points are excluded before tokenization
    public PcfgTrainer minLength(final int minLength) {
        return new PcfgTrainer(analyzer, alpha, minLength, maxLines, progressInterval, progressListener);
    }

    // 0 means the whole corpus
    public PcfgTrainer maxLines(final long maxLines) {
        return new PcfgTrainer(analyzer, alpha, minLength, maxLines, progressInterval, progressListener);
    }

    public PcfgTrainer progressInterval(final long progressInterval) {
        if (progressInterval < 1) {
            throw new IllegalArgumentException("Progress interval must be positive: %d".formatted(progressInterval));
        }
        return new PcfgTrainer(analyzer, alpha, minLength, maxLines, progressInterval, progressListener);
    }

    // called with the number of lines read so far, every progress interval
    public PcfgTrainer progressListener(final LongConsumer progressListener) {
        return new PcfgTrainer(analyzer, alpha, minLength, maxLines, progressInterval, progressListener);
    }

    public TrainingResult fit(final Stream<String> corpus) {
        final FrequencyTable table = FrequencyTable.empty();

        long read = 0;
        long filtered = 0;
        long skipped = 0;

        final Iterator<String> lines = corpus.iterator();
        while (lines.hasNext() && (maxLines == 0 || read < maxLines)) {
            final String line = lines.next();
            read++;

            if (line.codePointCount(0, line.length()) < minLength) {
                filtered++;
            } else {
                try {
                    checkWellFormed(line);
                    table.add(analyzer.analyze(line));
                } catch (final InvalidInputException e) {
                    skipped++;
                    LOG.trace("Skipped line {}: {}", read, e.getMessage());
                }
            }

            if (read % progressInterval == 0) {
                LOG.info("Read {} lines, {} unique templates", read, table.uniqueTemplates());
                progressListener.accept(read);
            }
        }

        final TrainingReport report = new TrainingReport(read, table.totalExamples(), filtered, skipped);
        LOG.info("Training done: {} lines read, {} processed, {} filtered, {} skipped", report.read(), report.processed(), report.filtered(), report.skipped());
        LOG.info("Vocabulary: {} templates, {} words, {} fragments, {} digit runs, {} symbol runs",
                table.uniqueTemplates(),
                table.uniqueValues(TokenType.WORD),
                table.uniqueValues(TokenType.FRAG),
                table.uniqueValues(TokenType.DIGITS),
                table.uniqueValues(TokenType.SYMBOL));

        return new TrainingResult(table.toModel(alpha), report);
    }

    private static void checkWellFormed(final String line) {
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c == REPLACEMENT_CHARACTER) {
                throw new InvalidInputException("Undecodable characters");
            }
            if (Character.isISOControl(c)) {
                throw new InvalidInputException("Control character 0x%02x".formatted((int) c));
            }
        }
    }
}
