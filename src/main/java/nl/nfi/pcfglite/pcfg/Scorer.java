package nl.nfi.pcfglite.pcfg;

import nl.nfi.pcfglite.text.PasswordAnalyzer;
import nl.nfi.pcfglite.text.Token;
import nl.nfi.pcfglite.text.TokenizedPassword;

import static java.lang.Math.log;

// log P(template) + sum of log P(value | type), both smoothed, so never -infinity
public final class Scorer {

    private final PasswordAnalyzer analyzer;

    private Scorer(final PasswordAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public static Scorer using(final PasswordAnalyzer analyzer) {
        return new Scorer(analyzer);
    }

    public double score(final PcfgModel model, final String candidate) {
        requireTrained(model);
        return score(model, analyzer.analyze(candidate));
    }

    public double score(final PcfgModel model, final TokenizedPassword password) {
        requireTrained(model);
        double logProbability = log(model.templateProbability(password.template()));
        for (final Token token : password.tokens()) {
            logProbability += log(model.valueProbability(token.type(), token.value()));
        }
        return logProbability;
    }

    public static void requireTrained(final PcfgModel model) {
        if (model == null) {
            throw new ModelNotTrainedException("No model loaded");
        }
        if (model.isEmpty()) {
            throw new ModelNotTrainedException("Model contains no training examples");
        }
    }
}
