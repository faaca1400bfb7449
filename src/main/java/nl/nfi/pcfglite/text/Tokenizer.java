package nl.nfi.pcfglite.text;

import java.util.ArrayList;
import java.util.List;

import static nl.nfi.pcfglite.text.TokenType.DIGITS;
import static nl.nfi.pcfglite.text.TokenType.FRAG;
import static nl.nfi.pcfglite.text.TokenType.SYMBOL;
import static nl.nfi.pcfglite.text.TokenType.WORD;

public final class Tokenizer {

    public static final int DEFAULT_MIN_WORD_LENGTH = 3;

    private final int minWordLength;
    private final Vocabulary vocabulary;

    private Tokenizer(final int minWordLength, final Vocabulary vocabulary) {
        this.minWordLength = minWordLength;
        this.vocabulary = vocabulary;
    }

    public static Tokenizer create() {
        return new Tokenizer(DEFAULT_MIN_WORD_LENGTH, Vocabulary.unrestricted());
    }

    public Tokenizer minWordLength(final int minWordLength) {
        if (minWordLength < 1) {
            throw new IllegalArgumentException("Minimum word length must be positive: %d".formatted(minWordLength));
        }
        return new Tokenizer(minWordLength, vocabulary);
    }

    public Tokenizer vocabulary(final Vocabulary vocabulary) {
        return new Tokenizer(minWordLength, vocabulary);
    }

    public TokenizedPassword tokenize(final String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            throw new InvalidInputException("Cannot tokenize empty password");
        }

        final List<Token> tokens = new ArrayList<>();

        int start = 0;
        CharClass current = CharClass.of(normalized.codePointAt(0));
        int position = Character.charCount(normalized.codePointAt(0));

        while (position < normalized.length()) {
            final int codePoint = normalized.codePointAt(position);
            final CharClass next = CharClass.of(codePoint);
            if (next != current) {
                tokens.add(createToken(current, normalized.substring(start, position)));
                start = position;
                current = next;
            }
            position += Character.charCount(codePoint);
        }
        tokens.add(createToken(current, normalized.substring(start)));

        return new TokenizedPassword(Template.of(tokens), tokens);
    }

    private Token createToken(final CharClass charClass, final String value) {
        final Token token = switch (charClass) {
            case LETTER -> Token.of(FRAG, value);
            case DIGIT -> Token.of(DIGITS, value);
            case OTHER -> Token.of(SYMBOL, value);
        };
        if (token.type() == FRAG && token.length() >= minWordLength && vocabulary.contains(value)) {
            return new Token(WORD, value, token.length());
        }
        return token;
    }

    private enum CharClass {
        LETTER,
        DIGIT,
        OTHER;

        static CharClass of(final int codePoint) {
            if (Character.isLetter(codePoint)) {
                return LETTER;
            }
            if (Character.isDigit(codePoint)) {
                return DIGIT;
            }
            return OTHER;
        }
    }
}
