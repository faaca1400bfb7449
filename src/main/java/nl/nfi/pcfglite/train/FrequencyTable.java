package nl.nfi.pcfglite.train;

import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.text.Template;
import nl.nfi.pcfglite.text.Token;
import nl.nfi.pcfglite.text.TokenType;
import nl.nfi.pcfglite.text.TokenizedPassword;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

// mutable counts collected during a single training pass, frozen into a PcfgModel at the end
public final class FrequencyTable {

    private final Map<Template, Long> templateCounts;
    private final Map<TokenType, Map<String, Long>> valueCounts;
    private long totalExamples;

    private FrequencyTable() {
        this.templateCounts = new HashMap<>();
        this.valueCounts = new EnumMap<>(TokenType.class);
        for (final TokenType type : TokenType.values()) {
            valueCounts.put(type, new HashMap<>());
        }
    }

    public static FrequencyTable empty() {
        return new FrequencyTable();
    }

    public void add(final TokenizedPassword password) {
        templateCounts.merge(password.template(), 1L, Long::sum);
        for (final Token token : password.tokens()) {
            valueCounts.get(token.type()).merge(token.value(), 1L, Long::sum);
        }
        totalExamples++;
    }

    public long totalExamples() {
        return totalExamples;
    }

    public int uniqueTemplates() {
        return templateCounts.size();
    }

    public int uniqueValues(final TokenType type) {
        return valueCounts.get(type).size();
    }

    public PcfgModel toModel(final double alpha) {
        return PcfgModel.create(alpha, totalExamples, templateCounts, valueCounts);
    }
}
