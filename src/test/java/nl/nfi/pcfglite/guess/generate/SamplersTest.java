package nl.nfi.pcfglite.guess.generate;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.function.ToIntFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SamplersTest {

    @Test
    void frequenciesFollowWeights() {
        final double[] weights = {1, 2, 7, 0};
        final ToIntFunction<Random> sampler = Samplers.buildIndexSampler(weights.length, i -> weights[i]);

        final Random random = new Random(0);
        final int draws = 200_000;
        final int[] counts = new int[weights.length];
        for (int i = 0; i < draws; i++) {
            counts[sampler.applyAsInt(random)]++;
        }

        assertThat(counts[0] / (double) draws).isCloseTo(0.1, within(0.01));
        assertThat(counts[1] / (double) draws).isCloseTo(0.2, within(0.01));
        assertThat(counts[2] / (double) draws).isCloseTo(0.7, within(0.01));
        assertThat(counts[3]).isZero();
    }

    @Test
    void singleElement() {
        assertThat(Samplers.buildSampler(List.of("only"), value -> 5.0).apply(new Random(1))).isEqualTo("only");
    }

    @Test
    void rejectsInvalidWeights() {
        assertThatThrownBy(() -> Samplers.buildIndexSampler(0, i -> 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Samplers.buildIndexSampler(2, i -> 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Samplers.buildIndexSampler(2, i -> i == 0 ? -1.0 : 1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
