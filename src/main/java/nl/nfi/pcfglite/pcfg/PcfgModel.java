package nl.nfi.pcfglite.pcfg;

import nl.nfi.pcfglite.text.Slot;
import nl.nfi.pcfglite.text.Template;
import nl.nfi.pcfglite.text.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.util.Comparator.comparing;
import static java.util.Comparator.comparingLong;

/**
 * Immutable frequency model of password templates and token values.
 * <p>
 * Probabilities use additive smoothing with parameter {@code alpha} over the relevant table:
 * {@code (count + alpha) / (total + alpha * (distinct + 1))}, so unseen keys get a non-zero floor.
 */
public final class PcfgModel {

    public static final int SCHEMA_VERSION = 1;

    private static final Comparator<RankedValue> VALUE_RANK = comparingLong(RankedValue::count).reversed()
            .thenComparing(RankedValue::value);

    private final double alpha;
    private final long totalExamples;
    private final Map<Template, Long> templateCounts;
    private final Map<TokenType, Map<String, Long>> valueCounts;

    private final Map<TokenType, Long> valueTotals;
    private final List<Template> rankedTemplates;
    private final Map<Slot, List<RankedValue>> rankedValues;

    private PcfgModel(final double alpha, final long totalExamples, final Map<Template, Long> templateCounts, final Map<TokenType, Map<String, Long>> valueCounts) {
        this.alpha = alpha;
        this.totalExamples = totalExamples;
        this.templateCounts = templateCounts;
        this.valueCounts = valueCounts;

        this.valueTotals = new EnumMap<>(TokenType.class);
        valueCounts.forEach((type, counts) -> valueTotals.put(type, counts.values().stream().mapToLong(Long::longValue).sum()));

        final List<Template> templates = new ArrayList<>(templateCounts.keySet());
        templates.sort(comparing((Template template) -> templateCounts.get(template)).reversed().thenComparing(Template::label));
        this.rankedTemplates = Collections.unmodifiableList(templates);

        final Map<Slot, List<RankedValue>> values = new HashMap<>();
        valueCounts.forEach((type, counts) -> counts.forEach((value, count) -> {
            final Slot slot = new Slot(type, value.codePointCount(0, value.length()));
            values.computeIfAbsent(slot, s -> new ArrayList<>()).add(new RankedValue(value, count));
        }));
        values.replaceAll((slot, list) -> {
            list.sort(VALUE_RANK);
            return Collections.unmodifiableList(list);
        });
        this.rankedValues = Collections.unmodifiableMap(values);
    }

    public static PcfgModel create(final double alpha, final long totalExamples, final Map<Template, Long> templateCounts, final Map<TokenType, Map<String, Long>> valueCounts) {
        checkAlpha(alpha);

        long templateTotal = 0;
        for (final Map.Entry<Template, Long> entry : templateCounts.entrySet()) {
            checkCount(entry.getValue(), entry.getKey().label());
            templateTotal = checkedSum(templateTotal, entry.getValue(), "Template counts");
        }
        if (templateTotal != totalExamples) {
            throw new IllegalArgumentException("Template counts sum to %d, expected %d training examples".formatted(templateTotal, totalExamples));
        }

        final Map<TokenType, Map<String, Long>> values = new EnumMap<>(TokenType.class);
        for (final TokenType type : TokenType.values()) {
            final Map<String, Long> counts = valueCounts.getOrDefault(type, Map.of());
            long valueTotal = 0;
            for (final Map.Entry<String, Long> entry : counts.entrySet()) {
                if (entry.getKey().isEmpty()) {
                    throw new IllegalArgumentException("Empty %s value".formatted(type));
                }
                checkCount(entry.getValue(), entry.getKey());
                valueTotal = checkedSum(valueTotal, entry.getValue(), "%s counts".formatted(type));
            }
            values.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(counts)));
        }

        return new PcfgModel(alpha, totalExamples, Collections.unmodifiableMap(new LinkedHashMap<>(templateCounts)), Collections.unmodifiableMap(values));
    }

    public static PcfgModel empty(final double alpha) {
        return create(alpha, 0, Map.of(), Map.of());
    }

    private static void checkAlpha(final double alpha) {
        if (!(alpha > 0.0) || Double.isInfinite(alpha)) {
            throw new IllegalArgumentException("Smoothing alpha must be positive and finite: %s".formatted(alpha));
        }
    }

    private static long checkedSum(final long total, final long count, final String what) {
        try {
            return Math.addExact(total, count);
        } catch (final ArithmeticException e) {
            throw new IllegalArgumentException("%s overflow a long".formatted(what), e);
        }
    }

    private static void checkCount(final Long count, final String key) {
        if (count == null || count < 1) {
            throw new IllegalArgumentException("Count for %s must be at least 1: %s".formatted(key, count));
        }
    }

    public int schemaVersion() {
        return SCHEMA_VERSION;
    }

    public double alpha() {
        return alpha;
    }

    public long totalExamples() {
        return totalExamples;
    }

    public boolean isEmpty() {
        return totalExamples == 0;
    }

    public Map<Template, Long> templateCounts() {
        return templateCounts;
    }

    public Map<String, Long> valueCounts(final TokenType type) {
        return valueCounts.get(type);
    }

    public long templateCount(final Template template) {
        return templateCounts.getOrDefault(template, 0L);
    }

    public long valueCount(final TokenType type, final String value) {
        return valueCounts.get(type).getOrDefault(value, 0L);
    }

    public double templateProbability(final Template template) {
        return smoothed(templateCount(template), totalExamples, templateCounts.size());
    }

    public double valueProbability(final TokenType type, final String value) {
        return smoothed(valueCount(type, value), valueTotals.get(type), valueCounts.get(type).size());
    }

    private double smoothed(final long count, final long total, final int distinct) {
        return (count + alpha) / (total + alpha * (distinct + 1));
    }

    // most frequent first, ties by label
    public List<Template> rankedTemplates() {
        return rankedTemplates;
    }

    // values of the slot's type and length, most frequent first, ties by value
    public List<RankedValue> rankedValues(final Slot slot) {
        return rankedValues.getOrDefault(slot, List.of());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PcfgModel other)) {
            return false;
        }
        return Double.compare(alpha, other.alpha) == 0
                && totalExamples == other.totalExamples
                && templateCounts.equals(other.templateCounts)
                && valueCounts.equals(other.valueCounts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alpha, totalExamples, templateCounts, valueCounts);
    }

    @Override
    public String toString() {
        return "PcfgModel[alpha=%s, totalExamples=%d, uniqueTemplates=%d]".formatted(alpha, totalExamples, templateCounts.size());
    }
}
