package nl.nfi.pcfglite.text;

import static java.util.Objects.requireNonNull;

// a maximal run of one character class, length is in code points
public record Token(TokenType type, String value, int length) {

    public Token {
        requireNonNull(type);
        requireNonNull(value);
    }

    public static Token of(final TokenType type, final String value) {
        return new Token(type, value, value.codePointCount(0, value.length()));
    }

    public Slot slot() {
        return new Slot(type, length);
    }
}
