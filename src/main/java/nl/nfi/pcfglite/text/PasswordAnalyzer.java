package nl.nfi.pcfglite.text;

// normalize, then tokenize; shared by training and scoring so both see the same grammar
public final class PasswordAnalyzer {

    private final LeetNormalizer normalizer;
    private final Tokenizer tokenizer;

    private PasswordAnalyzer(final LeetNormalizer normalizer, final Tokenizer tokenizer) {
        this.normalizer = normalizer;
        this.tokenizer = tokenizer;
    }

    public static PasswordAnalyzer create() {
        return new PasswordAnalyzer(LeetNormalizer.withDefaultSubstitutions(), Tokenizer.create());
    }

    public static PasswordAnalyzer of(final LeetNormalizer normalizer, final Tokenizer tokenizer) {
        return new PasswordAnalyzer(normalizer, tokenizer);
    }

    public LeetNormalizer normalizer() {
        return normalizer;
    }

    public Tokenizer tokenizer() {
        return tokenizer;
    }

    public TokenizedPassword analyze(final String password) {
        return tokenizer.tokenize(normalizer.normalize(password));
    }
}
