package nl.nfi.pcfglite.text;

import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

public final class LeetNormalizer {

    public static final Map<Character, Character> DEFAULT_SUBSTITUTIONS = Map.ofEntries(
            entry('0', 'o'),
            entry('1', 'l'),
            entry('3', 'e'),
            entry('4', 'a'),
            entry('5', 's'),
            entry('7', 't'),
            entry('@', 'a'),
            entry('$', 's'),
            entry('!', 'i')
    );

    private final Map<Character, Character> substitutions;

    private LeetNormalizer(final Map<Character, Character> substitutions) {
        this.substitutions = substitutions;
    }

    public static LeetNormalizer withDefaultSubstitutions() {
        return new LeetNormalizer(DEFAULT_SUBSTITUTIONS);
    }

    public static LeetNormalizer withSubstitutions(final Map<Character, Character> substitutions) {
        for (final Map.Entry<Character, Character> substitution : substitutions.entrySet()) {
            if (!Character.isLetter(substitution.getValue())) {
                throw new IllegalArgumentException("Substitution must map to a letter: %s -> %s".formatted(substitution.getKey(), substitution.getValue()));
            }
            if (Character.isLetter(substitution.getKey())) {
                throw new IllegalArgumentException("Substitution must not rewrite a letter: %s".formatted(substitution.getKey()));
            }
        }
        return new LeetNormalizer(Map.copyOf(substitutions));
    }

    public Map<Character, Character> substitutions() {
        return substitutions;
    }

    // a maximal run of substitutable characters is only rewritten when directly enclosed by letters:
    //      p@$$w0rd  -> password
    //      letme1n   -> letmeln
    //      password1 -> password1
    // characters around an untouched run are never rewritten themselves, which keeps this idempotent
    public String normalize(final String password) {
        if (password == null || password.isEmpty()) {
            throw new InvalidInputException("Cannot normalize empty password");
        }

        final StringBuilder normalized = new StringBuilder(password);
        int position = 0;
        while (position < normalized.length()) {
            if (!substitutions.containsKey(normalized.charAt(position))) {
                position++;
                continue;
            }

            final int start = position;
            while (position < normalized.length() && substitutions.containsKey(normalized.charAt(position))) {
                position++;
            }

            if (isLetterBefore(normalized, start) && isLetterAt(normalized, position)) {
                for (int i = start; i < position; i++) {
                    normalized.setCharAt(i, substitutions.get(normalized.charAt(i)));
                }
            }
        }
        return normalized.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean isLetterBefore(final CharSequence text, final int index) {
        return index > 0 && Character.isLetter(Character.codePointBefore(text, index));
    }

    private static boolean isLetterAt(final CharSequence text, final int index) {
        return index < text.length() && Character.isLetter(Character.codePointAt(text, index));
    }
}
