package nl.nfi.pcfglite.config;

import nl.nfi.pcfglite.common.ini.IniConfig;
import nl.nfi.pcfglite.common.ini.IniSection;
import nl.nfi.pcfglite.text.LeetNormalizer;
import nl.nfi.pcfglite.text.PasswordAnalyzer;
import nl.nfi.pcfglite.text.Tokenizer;
import nl.nfi.pcfglite.text.Vocabulary;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * All settings of a training or generation run, passed explicitly to every stage.
 * <p>
 * Loaded from an INI file with the sections {@code LENGTH}, {@code TEXT}, {@code TRAINING}, {@code BEAM},
 * {@code STOCHASTIC} and {@code SUMMARY}. Every key is optional and falls back to {@link #defaults()}.
 */
public record PcfgConfig(LengthBounds length, TextSettings text, TrainingSettings training, BeamSettings beam, SamplingSettings sampling, int summaryTopN) {

    public static PcfgConfig defaults() {
        return fromIni(IniConfig.empty());
    }

    public static PcfgConfig loadFrom(final Path path) throws IOException {
        return fromIni(IniConfig.loadFrom(path));
    }

    public static PcfgConfig fromIni(final IniConfig ini) {
        final IniSection length = ini.getSection("LENGTH");
        final IniSection text = ini.getSection("TEXT");
        final IniSection training = ini.getSection("TRAINING");
        final IniSection beam = ini.getSection("BEAM");
        final IniSection stochastic = ini.getSection("STOCHASTIC");
        final IniSection summary = ini.getSection("SUMMARY");

        final String vocabularyPath = text.getString("VOCABULARY_PATH", "");

        return new PcfgConfig(
                new LengthBounds(
                        length.getInt("MIN_PASSWORD_LENGTH", 6),
                        length.getInt("MAX_PASSWORD_LENGTH", 64)
                ),
                new TextSettings(
                        text.hasKey("LEET_SUBSTITUTIONS") ? parseSubstitutions(text.getJsonObject("LEET_SUBSTITUTIONS")) : LeetNormalizer.DEFAULT_SUBSTITUTIONS,
                        text.getInt("MIN_WORD_LENGTH", Tokenizer.DEFAULT_MIN_WORD_LENGTH),
                        vocabularyPath.isEmpty() ? null : Paths.get(vocabularyPath)
                ),
                new TrainingSettings(
                        training.getDouble("ALPHA", 1.0),
                        training.getInt("TRAINING_MIN_LENGTH", 0),
                        training.getLong("MAX_TRAINING_LINES", 0),
                        training.getLong("PROGRESS_INTERVAL", 100_000),
                        Charset.forName(training.getString("ENCODING", UTF_8.name()))
                ),
                new BeamSettings(
                        beam.getInt("BEAM_TOPK_TEMPLATES", 40),
                        beam.getInt("BEAM_TOPK_PER_SLOT", 300),
                        beam.getInt("BEAM_WIDTH", 2000),
                        beam.getInt("BEAM_MAX_OUTPUT_PER_TEMPLATE", 2000),
                        beam.getInt("BEAM_MAX_TOTAL_CANDIDATES", 200_000),
                        beam.getBoolean("BEAM_PARALLEL", false)
                ),
                new SamplingSettings(
                        stochastic.getInt("STOCHASTIC_NUM_SAMPLES", 180_000),
                        stochastic.getInt("STOCHASTIC_TOPK_TEMPLATES", 0),
                        stochastic.getLong("RNG_SEED", 42)
                ),
                summary.getInt("SUMMARY_TOP_N", 200)
        );
    }

    // {"0": "o", "@": "a"}
    private static Map<Character, Character> parseSubstitutions(final JSONObject json) {
        final Map<Character, Character> substitutions = new HashMap<>();
        for (final String key : json.keySet()) {
            final String value = json.getString(key);
            if (key.length() != 1 || value.length() != 1) {
                throw new IllegalArgumentException("LEET_SUBSTITUTIONS entries must map a single character to a single character: %s -> %s".formatted(key, value));
            }
            substitutions.put(key.charAt(0), value.charAt(0));
        }
        return substitutions;
    }

    public PcfgConfig withLength(final LengthBounds length) {
        return new PcfgConfig(length, text, training, beam, sampling, summaryTopN);
    }

    public PcfgConfig withTraining(final TrainingSettings training) {
        return new PcfgConfig(length, text, training, beam, sampling, summaryTopN);
    }

    public PcfgConfig withBeam(final BeamSettings beam) {
        return new PcfgConfig(length, text, training, beam, sampling, summaryTopN);
    }

    public PcfgConfig withSampling(final SamplingSettings sampling) {
        return new PcfgConfig(length, text, training, beam, sampling, summaryTopN);
    }

    // loads the vocabulary, if configured
    public PasswordAnalyzer createAnalyzer() throws IOException {
        final Vocabulary vocabulary = text.vocabularyPath() == null
                ? Vocabulary.unrestricted()
                : Vocabulary.loadFrom(text.vocabularyPath(), training.encoding());
        return PasswordAnalyzer.of(
                LeetNormalizer.withSubstitutions(text.substitutions()),
                Tokenizer.create().minWordLength(text.minWordLength()).vocabulary(vocabulary)
        );
    }
}
