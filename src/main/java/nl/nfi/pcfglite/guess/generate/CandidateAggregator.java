package nl.nfi.pcfglite.guess.generate;

import nl.nfi.pcfglite.config.LengthBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// deterministic candidates first, first occurrence wins, out of bounds or multi-line strings are dropped
public final class CandidateAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(CandidateAggregator.class);

    private CandidateAggregator() {
    }

    public static List<String> combine(final List<Candidate> deterministic, final List<Candidate> stochastic, final LengthBounds bounds) {
        final Set<String> combined = new LinkedHashSet<>();
        long dropped = 0;

        for (final List<Candidate> candidates : List.of(deterministic, stochastic)) {
            for (final Candidate candidate : candidates) {
                final String text = candidate.text();
                if (!bounds.contains(text) || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
                    dropped++;
                    continue;
                }
                combined.add(text);
            }
        }

        LOG.info("Combined {} deterministic and {} stochastic candidates into {} unique ({} out of bounds)",
                deterministic.size(), stochastic.size(), combined.size(), dropped);
        return List.copyOf(combined);
    }
}
