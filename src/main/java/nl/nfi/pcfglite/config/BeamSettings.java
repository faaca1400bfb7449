package nl.nfi.pcfglite.config;

public record BeamSettings(int topTemplates, int topPerSlot, int width, int maxOutputPerTemplate, int maxTotal, boolean parallel) {

    public BeamSettings {
        requirePositive("BEAM_TOPK_TEMPLATES", topTemplates);
        requirePositive("BEAM_TOPK_PER_SLOT", topPerSlot);
        requirePositive("BEAM_WIDTH", width);
        requirePositive("BEAM_MAX_OUTPUT_PER_TEMPLATE", maxOutputPerTemplate);
        requirePositive("BEAM_MAX_TOTAL_CANDIDATES", maxTotal);
    }

    public BeamSettings withTopTemplates(final int topTemplates) {
        return new BeamSettings(topTemplates, topPerSlot, width, maxOutputPerTemplate, maxTotal, parallel);
    }

    public BeamSettings withTopPerSlot(final int topPerSlot) {
        return new BeamSettings(topTemplates, topPerSlot, width, maxOutputPerTemplate, maxTotal, parallel);
    }

    public BeamSettings withMaxTotal(final int maxTotal) {
        return new BeamSettings(topTemplates, topPerSlot, width, maxOutputPerTemplate, maxTotal, parallel);
    }

    public BeamSettings withParallel(final boolean parallel) {
        return new BeamSettings(topTemplates, topPerSlot, width, maxOutputPerTemplate, maxTotal, parallel);
    }

    static void requirePositive(final String name, final long value) {
        if (value < 1) {
            throw new IllegalArgumentException("%s must be positive: %d".formatted(name, value));
        }
    }
}
