package nl.nfi.pcfglite.text;

import java.util.ArrayList;
import java.util.List;

import static java.util.stream.Collectors.joining;

// the structural shape of a password, e.g.:
//      WORD8|DIGITS3|SYMBOL1
//  where slots = [WORD8, DIGITS3, SYMBOL1]
public record Template(List<Slot> slots) implements Comparable<Template> {

    private static final String SEPARATOR = "|";

    public Template {
        if (slots.isEmpty()) {
            throw new IllegalArgumentException("Template must contain at least one slot");
        }
        slots = List.copyOf(slots);
    }

    public static Template of(final List<Token> tokens) {
        return new Template(tokens.stream().map(Token::slot).toList());
    }

    public static Template parse(final String label) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("Empty template label");
        }
        final List<Slot> slots = new ArrayList<>();
        for (final String part : label.split("\\" + SEPARATOR, -1)) {
            slots.add(Slot.parse(part));
        }
        return new Template(slots);
    }

    public int size() {
        return slots.size();
    }

    public Slot slotAt(final int position) {
        return slots.get(position);
    }

    // number of code points of every password that fits this template
    public int passwordLength() {
        return slots.stream().mapToInt(Slot::length).sum();
    }

    public String label() {
        return slots.stream().map(Slot::label).collect(joining(SEPARATOR));
    }

    @Override
    public int compareTo(final Template other) {
        return label().compareTo(other.label());
    }

    @Override
    public String toString() {
        return label();
    }
}
