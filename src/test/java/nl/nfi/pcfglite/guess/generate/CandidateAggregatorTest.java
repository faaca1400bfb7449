package nl.nfi.pcfglite.guess.generate;

import nl.nfi.pcfglite.config.LengthBounds;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static nl.nfi.pcfglite.guess.generate.Candidate.Source.DETERMINISTIC;
import static nl.nfi.pcfglite.guess.generate.Candidate.Source.STOCHASTIC;
import static org.assertj.core.api.Assertions.assertThat;

class CandidateAggregatorTest {

    @Test
    void deterministicFirstWithoutDuplicates() {
        final List<String> combined = CandidateAggregator.combine(
                candidates(DETERMINISTIC, "password1", "dragon12", "password1"),
                candidates(STOCHASTIC, "monkey99", "dragon12", "monkey99", "shadow7"),
                new LengthBounds(6, 64)
        );

        assertThat(combined).containsExactly("password1", "dragon12", "monkey99", "shadow7");
    }

    @Test
    void dropsOutOfBoundsAndMultiLineCandidates() {
        final List<String> combined = CandidateAggregator.combine(
                candidates(DETERMINISTIC, "short", "justright", "waytoolongforthis"),
                candidates(STOCHASTIC, "line\nbreak", "carriage\rret", "😀😀😀😀😀😀"),
                new LengthBounds(6, 10)
        );

        assertThat(combined).containsExactly("justright", "😀😀😀😀😀😀");
    }

    @Test
    void emptyInputs() {
        assertThat(CandidateAggregator.combine(List.of(), List.of(), new LengthBounds(1, 2))).isEmpty();
    }

    private static List<Candidate> candidates(final Candidate.Source source, final String... texts) {
        return Arrays.stream(texts).map(text -> new Candidate(text, source, -1.0)).toList();
    }
}
