package nl.nfi.pcfglite.serialize;

import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.pcfg.RankedValue;
import nl.nfi.pcfglite.text.Template;
import nl.nfi.pcfglite.text.TokenType;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Comparator.comparingLong;

// human readable overview of a model: the most frequent templates and values per token type
public final class ModelSummary {

    private static final Comparator<RankedValue> VALUE_RANK = comparingLong(RankedValue::count).reversed()
            .thenComparing(RankedValue::value);

    private ModelSummary() {
    }

    public static JSONObject summarize(final PcfgModel model, final int topN) {
        final JSONObject summary = new JSONObject();
        summary.put("schema_version", model.schemaVersion());
        summary.put("alpha", model.alpha());
        summary.put("total_examples", model.totalExamples());
        summary.put("unique_templates", model.templateCounts().size());

        final JSONArray templates = new JSONArray();
        for (final Template template : model.rankedTemplates().subList(0, Math.min(topN, model.rankedTemplates().size()))) {
            templates.put(new JSONArray().put(template.label()).put(model.templateCount(template)));
        }
        summary.put("top_templates", templates);

        final JSONObject values = new JSONObject();
        for (final TokenType type : TokenType.values()) {
            final List<RankedValue> ranked = model.valueCounts(type).entrySet().stream()
                    .map(entry -> new RankedValue(entry.getKey(), entry.getValue()))
                    .sorted(VALUE_RANK)
                    .limit(topN)
                    .toList();
            final JSONArray entries = new JSONArray();
            ranked.forEach(value -> entries.put(new JSONArray().put(value.value()).put(value.count())));
            values.put(type.name(), entries);
        }
        summary.put("top_values", values);

        return summary;
    }

    public static void writeTo(final PcfgModel model, final int topN, final Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (final Writer writer = Files.newBufferedWriter(path, UTF_8)) {
            summarize(model, topN).write(writer, 2, 0);
        }
    }
}
