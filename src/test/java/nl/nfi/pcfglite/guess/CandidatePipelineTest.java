package nl.nfi.pcfglite.guess;

import nl.nfi.pcfglite.config.PcfgConfig;
import nl.nfi.pcfglite.pcfg.ModelNotTrainedException;
import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.text.PasswordAnalyzer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.pcfglite.Utils.trainScenarioModel;
import static nl.nfi.pcfglite.guess.CandidatePipeline.COMBINED_FILE_NAME;
import static nl.nfi.pcfglite.guess.CandidatePipeline.DETERMINISTIC_FILE_NAME;
import static nl.nfi.pcfglite.guess.CandidatePipeline.STOCHASTIC_FILE_NAME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidatePipelineTest {

    @TempDir
    Path tempWorkDir;

    private final PcfgConfig config = PcfgConfig.defaults()
            .withSampling(PcfgConfig.defaults().sampling().withNumSamples(100));

    @Test
    void writesAllArtifacts() throws IOException {
        final GenerationReport report = CandidatePipeline.forModel(trainScenarioModel(), config, PasswordAnalyzer.create())
                .generateInto(tempWorkDir);

        final List<String> deterministic = Files.readAllLines(tempWorkDir.resolve(DETERMINISTIC_FILE_NAME), UTF_8);
        final List<String> stochastic = Files.readAllLines(tempWorkDir.resolve(STOCHASTIC_FILE_NAME), UTF_8);
        final List<String> combined = Files.readAllLines(tempWorkDir.resolve(COMBINED_FILE_NAME), UTF_8);

        assertThat(deterministic).containsExactly("letmeln", "password1", "password2");
        assertThat(stochastic).hasSize(100);
        assertThat(combined).containsExactly("letmeln", "password1", "password2");
        assertThat(report.deterministic()).isEqualTo(3);
        assertThat(report.stochastic()).isEqualTo(100);
        assertThat(report.combined()).isEqualTo(3);
    }

    @Test
    void combinedHasNoDuplicatesAndKeepsDeterministicOrder() {
        final CandidatePipeline.GenerationResult result = CandidatePipeline.forModel(trainScenarioModel(), config, PasswordAnalyzer.create())
                .generate();

        assertThat(result.combined()).doesNotHaveDuplicates();
        assertThat(result.combined().subList(0, result.deterministic().size()))
                .containsExactlyElementsOf(result.deterministic().stream().map(candidate -> candidate.text()).toList());
    }

    @Test
    void skipDeterministic() throws IOException {
        final GenerationReport report = CandidatePipeline.forModel(trainScenarioModel(), config, PasswordAnalyzer.create())
                .deterministic(false)
                .generateInto(tempWorkDir);

        assertThat(report.deterministic()).isZero();
        assertThat(tempWorkDir.resolve(DETERMINISTIC_FILE_NAME)).doesNotExist();
        assertThat(tempWorkDir.resolve(STOCHASTIC_FILE_NAME)).exists();
        assertThat(Files.readAllLines(tempWorkDir.resolve(COMBINED_FILE_NAME), UTF_8)).isNotEmpty();
    }

    @Test
    void skipBoth() throws IOException {
        final GenerationReport report = CandidatePipeline.forModel(trainScenarioModel(), config, PasswordAnalyzer.create())
                .deterministic(false)
                .stochastic(false)
                .generateInto(tempWorkDir.resolve("nested/output"));

        assertThat(report.combined()).isZero();
        assertThat(tempWorkDir.resolve("nested/output").resolve(COMBINED_FILE_NAME)).isEmptyFile();
    }

    @Test
    void requiresTrainedModel() {
        assertThatThrownBy(() -> CandidatePipeline.forModel(PcfgModel.empty(1.0), config, PasswordAnalyzer.create()))
                .isInstanceOf(ModelNotTrainedException.class);
    }
}
