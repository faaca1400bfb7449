package nl.nfi.pcfglite.serialize.common;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;
import java.util.Map.Entry;

import static java.lang.Math.toIntExact;
import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.pcfglite.serialize.common.JreTypeCodec.Decoder;
import static nl.nfi.pcfglite.serialize.common.JreTypeCodec.Encoder;

// little-endian primitives and LEB128 style varints
public abstract sealed class JreTypeCodec implements Closeable permits Encoder, Decoder {

    // guards against allocating huge buffers when reading a corrupted length prefix
    private static final int MAX_STRING_BYTES = 1 << 20;

    public static Encoder forOutput(final OutputStream output) {
        return new Encoder(output);
    }

    public static Decoder forInput(final InputStream input) {
        return new Decoder(input);
    }

    public static final class Encoder extends JreTypeCodec {

        private final OutputStream output;

        Encoder(final OutputStream output) {
            this.output = output;
        }

        public void writeString(final String value) throws IOException {
            final byte[] bytes = value.getBytes(UTF_8);
            if (bytes.length > MAX_STRING_BYTES) {
                throw new IOException("String too long to encode: %d bytes".formatted(bytes.length));
            }
            writeVarInt(bytes.length);
            output.write(bytes);
        }

        public void writeDouble(final double value) throws IOException {
            writeLong(Double.doubleToLongBits(value));
        }

        public void writeLong(final long value) throws IOException {
            long bits = value;
            for (long shift = 0; shift < 64; shift += 8) {
                output.write((int) (bits & 0xff));
                bits >>>= 8;
            }
        }

        public void writeVarInt(final int value) throws IOException {
            int bits = value;
            while (true) {
                if ((bits & ~0x7f) == 0) {
                    output.write(bits);
                    return;
                }
                output.write((bits & 0x7F | 0x80));
                bits >>>= 7;
            }
        }

        public void writeVarLong(final long value) throws IOException {
            long bits = value;
            while (true) {
                if ((bits & ~0x7fL) == 0) {
                    output.write(toIntExact(bits));
                    return;
                }
                output.write(toIntExact((bits & 0x7FL | 0x80L)));
                bits >>>= 7;
            }
        }

        public <K, V> void writeMap(final Map<K, V> values, final ValueWriter<K> keyWriter, final ValueWriter<V> valueWriter) throws IOException {
            writeVarInt(values.size());
            for (final Entry<K, V> entry : values.entrySet()) {
                keyWriter.write(entry.getKey());
                valueWriter.write(entry.getValue());
            }
        }

        public void flush() throws IOException {
            output.flush();
        }

        @Override
        public void close() throws IOException {
            output.close();
        }
    }

    public static final class Decoder extends JreTypeCodec {

        private final InputStream input;

        Decoder(final InputStream input) {
            this.input = input;
        }

        public String readString() throws IOException {
            final int length = readVarInt();
            if (length < 0 || length > MAX_STRING_BYTES) {
                throw new MalformedDataException("Invalid string length: %d".formatted(length));
            }
            final byte[] bytes = input.readNBytes(length);
            if (bytes.length != length) {
                throw new EOFException("End of stream reached inside string of %d bytes".formatted(length));
            }
            return new String(bytes, UTF_8);
        }

        public double readDouble() throws IOException {
            return Double.longBitsToDouble(readLong());
        }

        public int readUnsignedByte() throws IOException {
            final int read = input.read();
            if (read == -1) {
                throw new EOFException("End of stream reached");
            }
            return read;
        }

        public long readLong() throws IOException {
            long bits = 0;
            for (long shift = 0; shift < 64; shift += 8) {
                bits |= ((long) readUnsignedByte()) << shift;
            }
            return bits;
        }

        public int readVarInt() throws IOException {
            int value = 0;
            int shift = 0;

            while (shift < 35) {
                final int b = readUnsignedByte();
                value |= (b & 0x7f) << shift;
                if ((b & 0x80) == 0) {
                    return value;
                }
                shift += 7;
            }
            throw new MalformedDataException("Malformed varint");
        }

        public long readVarLong() throws IOException {
            long value = 0;
            long shift = 0;

            while (shift < 70) {
                final int b = readUnsignedByte();
                value |= (b & 0x7fL) << shift;
                if ((b & 0x80L) == 0) {
                    return value;
                }
                shift += 7;
            }
            throw new MalformedDataException("Malformed varlong");
        }

        public boolean isAtEnd() throws IOException {
            return input.read() == -1;
        }

        @Override
        public void close() throws IOException {
            input.close();
        }
    }

    @FunctionalInterface
    public interface ValueWriter<T> {
        void write(T value) throws IOException;
    }
}
