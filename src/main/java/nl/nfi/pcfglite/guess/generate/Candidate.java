package nl.nfi.pcfglite.guess.generate;

import static java.util.Objects.requireNonNull;

// score is the log-probability under the model the candidate was generated from
public record Candidate(String text, Source source, double score) {

    public Candidate {
        requireNonNull(text);
        requireNonNull(source);
    }

    public enum Source {
        DETERMINISTIC,
        STOCHASTIC
    }
}
