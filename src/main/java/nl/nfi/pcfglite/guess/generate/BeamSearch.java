package nl.nfi.pcfglite.guess.generate;

import nl.nfi.pcfglite.config.BeamSettings;
import nl.nfi.pcfglite.config.LengthBounds;
import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.pcfg.RankedValue;
import nl.nfi.pcfglite.pcfg.Scorer;
import nl.nfi.pcfglite.text.Slot;
import nl.nfi.pcfglite.text.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static java.lang.Math.log;
import static java.lang.Math.min;
import static java.util.Comparator.comparingDouble;
import static nl.nfi.pcfglite.guess.generate.Candidate.Source.DETERMINISTIC;

/**
 * Deterministic candidate generation by beam search over the most frequent templates.
 * <p>
 * Each template is expanded slot by slot: every partial password in the beam is extended with the most
 * frequent values of the slot's type and length, after which only the best partials (by summed value
 * log-probability) are kept. This is a greedy approximation of enumerating in probability order, it does
 * not guarantee the globally most probable password when the beam is narrower than the vocabulary.
 * <p>
 * All survivors are merged by score, ties broken on text, so output is identical for the same model and
 * settings, also when templates are expanded in parallel.
 */
public final class BeamSearch implements CandidateGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(BeamSearch.class);

    private static final Comparator<Partial> PARTIAL_ORDER = comparingDouble(Partial::logProbability).reversed()
            .thenComparing(Partial::text);
    private static final Comparator<Candidate> CANDIDATE_ORDER = comparingDouble(Candidate::score).reversed()
            .thenComparing(Candidate::text);

    private final Scorer scorer;
    private final BeamSettings settings;
    private final LengthBounds bounds;

    private BeamSearch(final Scorer scorer, final BeamSettings settings, final LengthBounds bounds) {
        this.scorer = scorer;
        this.settings = settings;
        this.bounds = bounds;
    }

    public static BeamSearch init(final Scorer scorer, final BeamSettings settings, final LengthBounds bounds) {
        return new BeamSearch(scorer, settings, bounds);
    }

    @Override
    public List<Candidate> generate(final PcfgModel model) {
        Scorer.requireTrained(model);

        final List<Template> templates = eligibleTemplates(model)
                .limit(settings.topTemplates())
                .toList();
        LOG.info("Expanding {} templates (beam width {}, top {} per slot)", templates.size(), settings.width(), settings.topPerSlot());

        final Stream<List<Candidate>> expanded = settings.parallel()
                ? templates.parallelStream().map(template -> expand(model, template))
                : templates.stream().map(template -> expand(model, template));

        // merged by score, so the outcome does not depend on which template finishes first
        final List<Candidate> candidates = expanded
                .flatMap(List::stream)
                .sorted(CANDIDATE_ORDER)
                .limit(settings.maxTotal())
                .toList();

        LOG.info("Generated {} deterministic candidates", candidates.size());
        return candidates;
    }

    List<Candidate> expand(final PcfgModel model, final Template template) {
        List<Partial> beam = List.of(new Partial("", 0.0));

        for (final Slot slot : template.slots()) {
            final List<RankedValue> choices = model.rankedValues(slot);
            if (choices.isEmpty()) {
                LOG.debug("No values for slot {} of template {}", slot, template);
                return List.of();
            }

            final List<RankedValue> top = choices.subList(0, min(settings.topPerSlot(), choices.size()));
            final double[] logProbabilities = top.stream()
                    .mapToDouble(choice -> log(model.valueProbability(slot.type(), choice.value())))
                    .toArray();

            final List<Partial> extended = new ArrayList<>();
            for (final Partial partial : beam) {
                for (int i = 0; i < top.size(); i++) {
                    extended.add(new Partial(partial.text() + top.get(i).value(), partial.logProbability() + logProbabilities[i]));
                }
            }
            extended.sort(PARTIAL_ORDER);
            beam = extended.subList(0, min(settings.width(), extended.size()));
        }

        final List<Candidate> survivors = beam.stream()
                .map(partial -> new Candidate(partial.text(), DETERMINISTIC, scorer.score(model, partial.text())))
                .sorted(CANDIDATE_ORDER)
                .limit(settings.maxOutputPerTemplate())
                .toList();

        LOG.debug("Template {} produced {} candidates", template, survivors.size());
        return survivors;
    }

    private record Partial(String text, double logProbability) {
    }

    // templates of which every password lies within the length bounds, most frequent first
    Stream<Template> eligibleTemplates(final PcfgModel model) {
        return model.rankedTemplates().stream().filter(template -> bounds.contains(template.passwordLength()));
    }
}
