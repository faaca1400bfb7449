package nl.nfi.pcfglite.config;

import java.nio.file.Path;
import java.util.Map;

// vocabularyPath is null when every long enough letter run counts as a word
public record TextSettings(Map<Character, Character> substitutions, int minWordLength, Path vocabularyPath) {

    public TextSettings {
        substitutions = Map.copyOf(substitutions);
        if (minWordLength < 1) {
            throw new IllegalArgumentException("Minimum word length must be positive: %d".formatted(minWordLength));
        }
    }
}
