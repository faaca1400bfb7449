package nl.nfi.pcfglite.text;

import static java.util.Objects.requireNonNull;

// a single position in a template, e.g. WORD8
public record Slot(TokenType type, int length) {

    public Slot {
        requireNonNull(type);
        if (length < 1) {
            throw new IllegalArgumentException("Slot length must be positive: %d".formatted(length));
        }
    }

    public static Slot parse(final String label) {
        final TokenType type = TokenType.ofLabel(label);
        final String length = label.substring(type.name().length());
        try {
            return new Slot(type, Integer.parseInt(length));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid slot label: %s".formatted(label), e);
        }
    }

    public String label() {
        return type.name() + length;
    }

    @Override
    public String toString() {
        return label();
    }
}
