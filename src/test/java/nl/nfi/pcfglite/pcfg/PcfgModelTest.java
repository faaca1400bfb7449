package nl.nfi.pcfglite.pcfg;

import nl.nfi.pcfglite.text.Slot;
import nl.nfi.pcfglite.text.Template;
import nl.nfi.pcfglite.text.TokenType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static nl.nfi.pcfglite.Utils.trainScenarioModel;
import static nl.nfi.pcfglite.text.TokenType.DIGITS;
import static nl.nfi.pcfglite.text.TokenType.WORD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PcfgModelTest {

    @Test
    void rankedTemplates() {
        final PcfgModel model = trainScenarioModel();

        assertThat(model.rankedTemplates()).containsExactly(Template.parse("WORD8|DIGITS1"), Template.parse("WORD7"));
    }

    @Test
    void rankedValuesAreFilteredByLengthAndTieBrokenByValue() {
        final PcfgModel model = PcfgModel.create(1.0, 4,
                Map.of(Template.parse("DIGITS1"), 3L, Template.parse("DIGITS2"), 1L),
                Map.of(DIGITS, Map.of("2", 1L, "1", 1L, "7", 1L, "12", 1L)));

        assertThat(model.rankedValues(new Slot(DIGITS, 1)))
                .extracting(RankedValue::value)
                .containsExactly("1", "2", "7");
        assertThat(model.rankedValues(new Slot(DIGITS, 2)))
                .containsExactly(new RankedValue("12", 1));
        assertThat(model.rankedValues(new Slot(WORD, 5))).isEmpty();
    }

    @Test
    void smoothedProbabilities() {
        final PcfgModel model = trainScenarioModel();

        assertThat(model.templateProbability(Template.parse("WORD8|DIGITS1"))).isCloseTo(0.5, within(1e-12));
        assertThat(model.templateProbability(Template.parse("SYMBOL9"))).isCloseTo(1.0 / 6.0, within(1e-12));
        assertThat(model.valueProbability(DIGITS, "1")).isCloseTo(0.4, within(1e-12));
        // floor for a type that was never observed
        assertThat(model.valueProbability(TokenType.SYMBOL, "!")).isEqualTo(1.0);
    }

    @Test
    void probabilitiesOfKnownAndUnseenSumToOne() {
        final PcfgModel model = trainScenarioModel();

        final double known = model.templateCounts().keySet().stream().mapToDouble(model::templateProbability).sum();
        final double unseen = model.templateProbability(Template.parse("FRAG1"));

        assertThat(known + unseen).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void rejectsInconsistentCounts() {
        assertThatThrownBy(() -> PcfgModel.create(1.0, 5, Map.of(Template.parse("WORD3"), 3L), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum to 3");
        assertThatThrownBy(() -> PcfgModel.create(1.0, 0, Map.of(Template.parse("WORD3"), 0L), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PcfgModel.create(1.0, 0, Map.of(), Map.of(WORD, Map.of("", 1L))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsCountsOverflowingLong() {
        assertThatThrownBy(() -> PcfgModel.create(1.0, 1,
                Map.of(Template.parse("WORD6"), Long.MAX_VALUE, Template.parse("DIGITS4"), Long.MAX_VALUE),
                Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overflow")
                .hasCauseInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> PcfgModel.create(1.0, 1,
                Map.of(Template.parse("DIGITS1"), 1L),
                Map.of(DIGITS, Map.of("1", Long.MAX_VALUE, "2", 1L))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DIGITS counts overflow");
    }

    @Test
    void rejectsInvalidAlpha() {
        assertThatThrownBy(() -> PcfgModel.empty(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PcfgModel.empty(-1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PcfgModel.empty(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equality() {
        assertThat(trainScenarioModel()).isEqualTo(trainScenarioModel());
        assertThat(trainScenarioModel().hashCode()).isEqualTo(trainScenarioModel().hashCode());
        assertThat(PcfgModel.empty(1.0).isEmpty()).isTrue();
    }
}
