package nl.nfi.pcfglite.config;

import nl.nfi.pcfglite.text.LeetNormalizer;
import nl.nfi.pcfglite.text.PasswordAnalyzer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.pcfglite.Utils.TEST_RESOURCES_PATH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PcfgConfigTest {

    @TempDir
    Path tempWorkDir;

    @Test
    void defaults() {
        final PcfgConfig config = PcfgConfig.defaults();

        assertThat(config.length()).isEqualTo(new LengthBounds(6, 64));
        assertThat(config.text().substitutions()).isEqualTo(LeetNormalizer.DEFAULT_SUBSTITUTIONS);
        assertThat(config.text().minWordLength()).isEqualTo(3);
        assertThat(config.text().vocabularyPath()).isNull();
        assertThat(config.training()).isEqualTo(new TrainingSettings(1.0, 0, 0, 100_000, UTF_8));
        assertThat(config.beam()).isEqualTo(new BeamSettings(40, 300, 2000, 2000, 200_000, false));
        assertThat(config.sampling()).isEqualTo(new SamplingSettings(180_000, 0, 42));
        assertThat(config.summaryTopN()).isEqualTo(200);
    }

    @Test
    void loadFrom() throws IOException {
        final PcfgConfig config = PcfgConfig.loadFrom(TEST_RESOURCES_PATH.resolve("config/test.ini"));

        assertThat(config.length()).isEqualTo(new LengthBounds(4, 16));
        assertThat(config.text().substitutions()).isEqualTo(Map.of('0', 'o', '3', 'e'));
        assertThat(config.text().minWordLength()).isEqualTo(4);
        assertThat(config.training()).isEqualTo(new TrainingSettings(0.5, 3, 1000, 100_000, ISO_8859_1));
        assertThat(config.beam()).isEqualTo(new BeamSettings(5, 10, 50, 20, 100, true));
        assertThat(config.sampling()).isEqualTo(new SamplingSettings(25, 3, 7));
        assertThat(config.summaryTopN()).isEqualTo(12);
    }

    @Test
    void createAnalyzer() throws IOException {
        final PasswordAnalyzer analyzer = PcfgConfig.loadFrom(TEST_RESOURCES_PATH.resolve("config/test.ini")).createAnalyzer();

        // '1' is not substituted and words need at least four letters
        assertThat(analyzer.analyze("l3t1t").template().label()).isEqualTo("FRAG3|DIGITS1|FRAG1");
        assertThat(analyzer.analyze("h0use").template().label()).isEqualTo("WORD5");
    }

    @Test
    void createAnalyzerWithVocabulary() throws IOException {
        final Path vocabulary = tempWorkDir.resolve("words.txt");
        Files.writeString(vocabulary, "dragon\n");
        final Path ini = tempWorkDir.resolve("vocabulary.ini");
        Files.writeString(ini, "[TEXT]\nVOCABULARY_PATH = %s\n".formatted(vocabulary));

        final PasswordAnalyzer analyzer = PcfgConfig.loadFrom(ini).createAnalyzer();

        assertThat(analyzer.analyze("dragon1").template().label()).isEqualTo("WORD6|DIGITS1");
        assertThat(analyzer.analyze("qwerty1").template().label()).isEqualTo("FRAG6|DIGITS1");
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> load("[LENGTH]\nMIN_PASSWORD_LENGTH = 10\nMAX_PASSWORD_LENGTH = 5\n")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> load("[TRAINING]\nALPHA = 0\n")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> load("[BEAM]\nBEAM_WIDTH = 0\n")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> load("[STOCHASTIC]\nSTOCHASTIC_NUM_SAMPLES = -1\n")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> load("[TEXT]\nLEET_SUBSTITUTIONS = {\"00\": \"o\"}\n")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withers() {
        final PcfgConfig config = PcfgConfig.defaults()
                .withLength(new LengthBounds(1, 2))
                .withTraining(PcfgConfig.defaults().training().withAlpha(2.0).withMinLength(4).withMaxLines(5))
                .withBeam(PcfgConfig.defaults().beam().withTopTemplates(3).withTopPerSlot(2).withMaxTotal(1))
                .withSampling(PcfgConfig.defaults().sampling().withNumSamples(9).withSeed(1));

        assertThat(config.length()).isEqualTo(new LengthBounds(1, 2));
        assertThat(config.training()).isEqualTo(new TrainingSettings(2.0, 4, 5, 100_000, UTF_8));
        assertThat(config.beam()).isEqualTo(new BeamSettings(3, 2, 2000, 2000, 1, false));
        assertThat(config.sampling()).isEqualTo(new SamplingSettings(9, 0, 1));
    }

    private PcfgConfig load(final String content) throws IOException {
        final Path path = Files.createTempFile(tempWorkDir, "config", ".ini");
        Files.writeString(path, content);
        return PcfgConfig.loadFrom(path);
    }
}
