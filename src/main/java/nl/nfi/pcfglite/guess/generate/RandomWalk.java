package nl.nfi.pcfglite.guess.generate;

import nl.nfi.pcfglite.config.LengthBounds;
import nl.nfi.pcfglite.config.SamplingSettings;
import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.pcfg.RankedValue;
import nl.nfi.pcfglite.pcfg.Scorer;
import nl.nfi.pcfglite.text.Slot;
import nl.nfi.pcfglite.text.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

import static nl.nfi.pcfglite.guess.generate.Candidate.Source.STOCHASTIC;
import static nl.nfi.pcfglite.guess.generate.Samplers.buildSampler;

// draws a template proportional to its count, then a value for every slot proportional to its count
// the random source is seeded explicitly, so a seed always reproduces the same sequence, duplicates included
public final class RandomWalk implements CandidateGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(RandomWalk.class);

    private final Scorer scorer;
    private final SamplingSettings settings;
    private final LengthBounds bounds;

    private RandomWalk(final Scorer scorer, final SamplingSettings settings, final LengthBounds bounds) {
        this.scorer = scorer;
        this.settings = settings;
        this.bounds = bounds;
    }

    public static RandomWalk init(final Scorer scorer, final SamplingSettings settings, final LengthBounds bounds) {
        return new RandomWalk(scorer, settings, bounds);
    }

    @Override
    public List<Candidate> generate(final PcfgModel model) {
        Scorer.requireTrained(model);

        final List<Template> templates = model.rankedTemplates().stream()
                .filter(template -> bounds.contains(template.passwordLength()))
                .filter(template -> template.slots().stream().noneMatch(slot -> model.rankedValues(slot).isEmpty()))
                .limit(settings.topTemplates() == 0 ? Long.MAX_VALUE : settings.topTemplates())
                .toList();
        if (templates.isEmpty() || settings.numSamples() == 0) {
            LOG.warn("Nothing to sample: {} eligible templates, {} samples requested", templates.size(), settings.numSamples());
            return List.of();
        }

        final Function<Random, Template> templateSampler = buildSampler(templates, model::templateCount);
        final Map<Slot, Function<Random, String>> valueSamplers = new HashMap<>();
        for (final Template template : templates) {
            for (final Slot slot : template.slots()) {
                valueSamplers.computeIfAbsent(slot, s -> {
                    final Function<Random, RankedValue> sampler = buildSampler(model.rankedValues(s), RankedValue::count);
                    return random -> sampler.apply(random).value();
                });
            }
        }
        LOG.info("Sampling {} candidates from {} templates, seed {}", settings.numSamples(), templates.size(), settings.seed());

        final Random random = new Random(settings.seed());
        final List<Candidate> candidates = new ArrayList<>(settings.numSamples());
        final StringBuilder guess = new StringBuilder();
        for (int i = 0; i < settings.numSamples(); i++) {
            final Template template = templateSampler.apply(random);
            guess.setLength(0);
            for (final Slot slot : template.slots()) {
                guess.append(valueSamplers.get(slot).apply(random));
            }
            final String text = guess.toString();
            candidates.add(new Candidate(text, STOCHASTIC, scorer.score(model, text)));
        }

        LOG.info("Generated {} stochastic candidates", candidates.size());
        return candidates;
    }
}
