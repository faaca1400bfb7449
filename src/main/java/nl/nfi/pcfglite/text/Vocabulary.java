package nl.nfi.pcfglite.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import static java.nio.file.Files.exists;
import static java.nio.file.Files.lines;

// set of dictionary words deciding between WORD and FRAG for letter runs
public final class Vocabulary {

    private static final Logger LOG = LoggerFactory.getLogger(Vocabulary.class);

    private static final Vocabulary UNRESTRICTED = new Vocabulary(null);

    private final Set<String> words;

    private Vocabulary(final Set<String> words) {
        this.words = words;
    }

    // every letter run of sufficient length counts as a word
    public static Vocabulary unrestricted() {
        return UNRESTRICTED;
    }

    public static Vocabulary of(final Set<String> words) {
        final Set<String> folded = new HashSet<>();
        words.forEach(word -> folded.add(word.toLowerCase(Locale.ROOT)));
        return new Vocabulary(Set.copyOf(folded));
    }

    public static Vocabulary loadFrom(final Path path, final Charset encoding) throws IOException {
        if (!exists(path)) {
            throw new IllegalArgumentException("Vocabulary path does not exist: %s".formatted(path));
        }
        final Set<String> words = new HashSet<>();
        try (final Stream<String> lines = lines(path, encoding)) {
            lines.map(String::strip)
                    .filter(line -> !line.isEmpty())
                    .forEach(words::add);
        }
        final Vocabulary vocabulary = of(words);
        LOG.info("Loaded vocabulary of {} words from {}", vocabulary.words.size(), path);
        return vocabulary;
    }

    public boolean isUnrestricted() {
        return words == null;
    }

    public boolean contains(final String word) {
        return words == null || words.contains(word);
    }
}
