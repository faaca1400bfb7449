package nl.nfi.pcfglite.train;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static java.nio.charset.CodingErrorAction.REPLACE;
import static java.nio.file.Files.exists;

// lazily streams a password corpus, one password per line
// undecodable bytes become U+FFFD instead of aborting the stream, the trainer skips such lines
public final class CorpusReader {

    public static final char REPLACEMENT_CHARACTER = '\uFFFD';

    public static Stream<String> lines(final Path path, final Charset encoding) throws IOException {
        if (!exists(path)) {
            throw new IllegalArgumentException("Corpus path does not exist: %s".formatted(path));
        }
        return lines(Files.newInputStream(path), encoding);
    }

    public static Stream<String> lines(final InputStream input, final Charset encoding) {
        final CharsetDecoder decoder = encoding.newDecoder()
                .onMalformedInput(REPLACE)
                .onUnmappableCharacter(REPLACE);
        final BufferedReader reader = new BufferedReader(new InputStreamReader(input, decoder), 1 << 16);
        return reader.lines().onClose(() -> {
            try {
                reader.close();
            } catch (final IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }
}
