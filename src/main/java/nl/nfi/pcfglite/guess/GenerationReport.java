package nl.nfi.pcfglite.guess;

import java.time.Duration;

// counts per strategy (duplicates included) and after combining
public record GenerationReport(long deterministic, long stochastic, long combined, Duration duration) {

}
