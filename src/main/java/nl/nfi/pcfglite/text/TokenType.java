package nl.nfi.pcfglite.text;

// the four classes a run of characters can fall in
//  WORD:   letter run of at least the minimum word length (and in the vocabulary, if one is used)
//  FRAG:   any other letter run
//  DIGITS: digit run
//  SYMBOL: everything else
public enum TokenType {

    WORD,
    FRAG,
    DIGITS,
    SYMBOL;

    // SYMBOL4 -> SYMBOL
    static TokenType ofLabel(final String label) {
        for (final TokenType type : values()) {
            if (label.startsWith(type.name())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown token type in label: %s".formatted(label));
    }
}
