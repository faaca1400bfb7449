package nl.nfi.pcfglite.guess.generate;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

import static java.nio.charset.StandardCharsets.UTF_8;

// newline delimited UTF-8, one candidate per line
public final class CandidateWriter {

    private CandidateWriter() {
    }

    public static long write(final Collection<String> candidates, final Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        long written = 0;
        try (final BufferedWriter writer = Files.newBufferedWriter(path, UTF_8)) {
            for (final String candidate : candidates) {
                writer.write(candidate);
                writer.write('\n');
                written++;
            }
        }
        return written;
    }

    public static long writeCandidates(final Collection<Candidate> candidates, final Path path) throws IOException {
        return write(candidates.stream().map(Candidate::text).toList(), path);
    }
}
