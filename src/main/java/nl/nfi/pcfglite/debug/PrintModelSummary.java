package nl.nfi.pcfglite.debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.serialize.ModelCodec;
import nl.nfi.pcfglite.serialize.ModelSummary;
import nl.nfi.pcfglite.text.Template;

public final class PrintModelSummary {

    public static void main(final String... args) throws IOException {
        //  snapshot: model.pfm (412 bytes)
        //  examples: 3
        // templates: 2
        //       top: WORD8|DIGITS1 (2, -0.51)
        final Path modelPath = Paths.get(args.length > 0 ? args[0] : "model.pfm");
        final int topN = args.length > 1 ? Integer.parseInt(args[1]) : 10;

        final PcfgModel model = ModelCodec.load(modelPath);

        System.out.printf(" snapshot: %s (%d bytes)%n", modelPath, Files.size(modelPath));
        System.out.printf(" examples: %d%n", model.totalExamples());
        System.out.printf("templates: %d%n", model.templateCounts().size());
        final List<Template> ranked = model.rankedTemplates();
        for (final Template template : ranked.subList(0, Math.min(topN, ranked.size()))) {
            System.out.printf("      top: %s (%d, %.2f)%n", template.label(), model.templateCount(template), Math.log(model.templateProbability(template)));
        }
        System.out.println();
        System.out.println(ModelSummary.summarize(model, topN).toString(2));
    }
}
