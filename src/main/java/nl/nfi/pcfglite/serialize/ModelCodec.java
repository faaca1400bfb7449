package nl.nfi.pcfglite.serialize;

import nl.nfi.pcfglite.pcfg.PcfgModel;
import nl.nfi.pcfglite.serialize.common.JreTypeCodec;
import nl.nfi.pcfglite.serialize.common.MalformedDataException;
import nl.nfi.pcfglite.text.Template;
import nl.nfi.pcfglite.text.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static java.nio.file.Files.exists;
import static nl.nfi.pcfglite.common.Formatting.toHumanReadableSize;
import static nl.nfi.pcfglite.serialize.ModelCodec.Decoder;
import static nl.nfi.pcfglite.serialize.ModelCodec.Encoder;

// snapshot layout:
//      magic, schema version, alpha, total examples,
//      templates as (label, count) pairs,
//      per token type: name, followed by (value, count) pairs
public abstract sealed class ModelCodec implements Closeable permits Encoder, Decoder {

    private static final Logger LOG = LoggerFactory.getLogger(ModelCodec.class);

    private static final String MAGIC = "pfm";

    public static Encoder forOutput(final OutputStream output) {
        return new Encoder(JreTypeCodec.forOutput(output));
    }

    public static Decoder forInput(final InputStream input) {
        return new Decoder(JreTypeCodec.forInput(input));
    }

    public static void save(final PcfgModel model, final Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (final Encoder encoder = forOutput(new BufferedOutputStream(Files.newOutputStream(path)))) {
            encoder.write(model);
        }
        LOG.info("Saved {} to {} ({})", model, path, toHumanReadableSize(Files.size(path)));
    }

    public static PcfgModel load(final Path path) throws IOException {
        if (!exists(path)) {
            throw new IllegalArgumentException("Model snapshot path does not exist: %s".formatted(path));
        }
        try (final Decoder decoder = forInput(new BufferedInputStream(Files.newInputStream(path)))) {
            final PcfgModel model = decoder.read();
            LOG.info("Loaded {} from {}", model, path);
            return model;
        }
    }

    public static final class Encoder extends ModelCodec {

        private final JreTypeCodec.Encoder encoder;

        private Encoder(final JreTypeCodec.Encoder encoder) {
            this.encoder = encoder;
        }

        public void write(final PcfgModel model) throws IOException {
            write(model, PcfgModel.SCHEMA_VERSION);
        }

        // version is only overridden to produce outdated snapshots in tests
        void write(final PcfgModel model, final int schemaVersion) throws IOException {
            encoder.writeString(MAGIC);
            encoder.writeVarInt(schemaVersion);
            encoder.writeDouble(model.alpha());
            encoder.writeVarLong(model.totalExamples());

            final Map<Template, Long> templates = new LinkedHashMap<>();
            model.rankedTemplates().forEach(template -> templates.put(template, model.templateCount(template)));
            encoder.writeMap(templates, template -> encoder.writeString(template.label()), encoder::writeVarLong);

            encoder.writeVarInt(TokenType.values().length);
            for (final TokenType type : TokenType.values()) {
                encoder.writeString(type.name());
                encoder.writeMap(new TreeMap<>(model.valueCounts(type)), encoder::writeString, encoder::writeVarLong);
            }
            encoder.flush();
        }

        @Override
        public void close() throws IOException {
            encoder.close();
        }
    }

    public static final class Decoder extends ModelCodec {

        private final JreTypeCodec.Decoder decoder;

        private Decoder(final JreTypeCodec.Decoder decoder) {
            this.decoder = decoder;
        }

        public PcfgModel read() throws IOException {
            try {
                return readChecked();
            } catch (final EOFException e) {
                throw new SnapshotCorruptException("Snapshot is truncated", e);
            } catch (final MalformedDataException e) {
                throw new SnapshotCorruptException("Snapshot is malformed: " + e.getMessage(), e);
            } catch (final IllegalArgumentException e) {
                throw new SnapshotCorruptException("Snapshot content is invalid: " + e.getMessage(), e);
            }
        }

        private PcfgModel readChecked() throws IOException {
            final String magic = decoder.readString();
            if (!magic.equals(MAGIC)) {
                throw new SnapshotCorruptException("Not a model snapshot, magic: %s".formatted(magic));
            }

            final int version = decoder.readVarInt();
            if (version != PcfgModel.SCHEMA_VERSION) {
                throw new SnapshotCorruptException("Unsupported snapshot schema version %d, expected %d".formatted(version, PcfgModel.SCHEMA_VERSION));
            }

            final double alpha = decoder.readDouble();
            final long totalExamples = decoder.readVarLong();

            final int templateCount = readSize();
            final Map<Template, Long> templates = new LinkedHashMap<>();
            for (int i = 0; i < templateCount; i++) {
                final Template template = Template.parse(decoder.readString());
                if (templates.put(template, decoder.readVarLong()) != null) {
                    throw new SnapshotCorruptException("Duplicate template: %s".formatted(template));
                }
            }

            final int typeCount = readSize();
            final Map<TokenType, Map<String, Long>> values = new EnumMap<>(TokenType.class);
            for (int i = 0; i < typeCount; i++) {
                final TokenType type = TokenType.valueOf(decoder.readString());
                final int valueCount = readSize();
                final Map<String, Long> counts = new LinkedHashMap<>();
                for (int j = 0; j < valueCount; j++) {
                    final String value = decoder.readString();
                    if (counts.put(value, decoder.readVarLong()) != null) {
                        throw new SnapshotCorruptException("Duplicate %s value: %s".formatted(type, value));
                    }
                }
                if (values.put(type, counts) != null) {
                    throw new SnapshotCorruptException("Duplicate token type: %s".formatted(type));
                }
            }

            if (!decoder.isAtEnd()) {
                throw new SnapshotCorruptException("Trailing data after snapshot");
            }
            return PcfgModel.create(alpha, totalExamples, templates, values);
        }

        private int readSize() throws IOException {
            final int size = decoder.readVarInt();
            if (size < 0) {
                throw new SnapshotCorruptException("Negative collection size: %d".formatted(size));
            }
            return size;
        }

        @Override
        public void close() throws IOException {
            decoder.close();
        }
    }
}
