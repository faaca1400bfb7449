package nl.nfi.pcfglite.main;

import nl.nfi.pcfglite.guess.PcfgGeneratorCli;
import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.pcfg.PcfgScorerCli;
import nl.nfi.pcfglite.serialize.ModelCodec;
import nl.nfi.pcfglite.train.PcfgTrainerCli;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.pcfglite.Utils.TEST_RESOURCES_PATH;
import static org.assertj.core.api.Assertions.assertThat;
import static picocli.CommandLine.ExitCode;

class CommandLineTest {

    @TempDir
    Path tempWorkDir;

    @Test
    void trainGenerateAndScore() throws IOException {
        final Path model = tempWorkDir.resolve("model.pfm");
        final Path summary = tempWorkDir.resolve("summary.json");
        final Path output = tempWorkDir.resolve("out");
        final Path scores = tempWorkDir.resolve("scores.tsv");

        final int trained = new CommandLine(new PcfgTrainerCli()).execute(
                "--corpus", TEST_RESOURCES_PATH.resolve("corpus/small.txt").toString(),
                "--output", model.toString(),
                "--summary", summary.toString()
        );
        assertThat(trained).isEqualTo(ExitCode.OK);

        final PcfgModel loaded = ModelCodec.load(model);
        // one of the eight lines is empty
        assertThat(loaded.totalExamples()).isEqualTo(7);
        assertThat(new JSONObject(Files.readString(summary, UTF_8)).getLong("total_examples")).isEqualTo(7);

        final int generated = new CommandLine(new PcfgGeneratorCli()).execute(
                "--model", model.toString(),
                "--output_directory", output.toString(),
                "--samples", "50",
                "--seed", "3"
        );
        assertThat(generated).isEqualTo(ExitCode.OK);
        final List<String> combined = Files.readAllLines(output.resolve("candidates_combined.txt"), UTF_8);
        assertThat(combined).contains("password1").doesNotHaveDuplicates();
        assertThat(Files.readAllLines(output.resolve("candidates_sto.txt"), UTF_8)).hasSize(50);

        final Path input = tempWorkDir.resolve("input.txt");
        Files.write(input, List.of("password1", "", "zzzzzzzzzz"), UTF_8);
        final int scored = new CommandLine(new PcfgScorerCli()).execute(
                "--model", model.toString(),
                "--input", input.toString(),
                "--output", scores.toString()
        );
        assertThat(scored).isEqualTo(ExitCode.OK);
        final List<String> lines = Files.readAllLines(scores, UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).startsWith("password1\t-");
        assertThat(Double.parseDouble(lines.get(0).split("\t")[1])).isGreaterThan(Double.parseDouble(lines.get(1).split("\t")[1]));
    }

    @Test
    void trainingOverrides() {
        final Path model = tempWorkDir.resolve("model.pfm");

        final int exitCode = new CommandLine(new PcfgTrainerCli()).execute(
                "--corpus", TEST_RESOURCES_PATH.resolve("corpus/small.txt").toString(),
                "--output", model.toString(),
                "--config", TEST_RESOURCES_PATH.resolve("config/test.ini").toString(),
                "--min_length", "9",
                "--max_lines", "4"
        );

        assertThat(exitCode).isEqualTo(ExitCode.OK);
        assertThat(model).exists();
    }

    @Test
    void missingInputFails() {
        final int exitCode = new CommandLine(new PcfgGeneratorCli()).execute(
                "--model", tempWorkDir.resolve("missing.pfm").toString(),
                "--output_directory", tempWorkDir.toString()
        );

        assertThat(exitCode).isEqualTo(ExitCode.SOFTWARE);
    }

    @Test
    void corruptSnapshotFails() throws IOException {
        final Path model = tempWorkDir.resolve("corrupt.pfm");
        Files.write(model, new byte[]{3, 'p', 'f', 'm', 7});

        final int exitCode = new CommandLine(new PcfgScorerCli()).execute("--model", model.toString());

        assertThat(exitCode).isEqualTo(ExitCode.SOFTWARE);
    }

    @Test
    void missingRequiredOption() {
        assertThat(new CommandLine(new PcfgTrainerCli()).execute("--corpus", "x")).isEqualTo(ExitCode.USAGE);
    }
}
