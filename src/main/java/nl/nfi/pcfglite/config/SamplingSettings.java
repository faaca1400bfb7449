package nl.nfi.pcfglite.config;

// topTemplates of 0 samples from every eligible template
public record SamplingSettings(int numSamples, int topTemplates, long seed) {

    public SamplingSettings {
        if (numSamples < 0) {
            throw new IllegalArgumentException("STOCHASTIC_NUM_SAMPLES must not be negative: %d".formatted(numSamples));
        }
        if (topTemplates < 0) {
            throw new IllegalArgumentException("STOCHASTIC_TOPK_TEMPLATES must not be negative: %d".formatted(topTemplates));
        }
    }

    public SamplingSettings withNumSamples(final int numSamples) {
        return new SamplingSettings(numSamples, topTemplates, seed);
    }

    public SamplingSettings withSeed(final long seed) {
        return new SamplingSettings(numSamples, topTemplates, seed);
    }
}
