package nl.nfi.pcfglite.serialize;

import java.io.IOException;

// a model snapshot that cannot be trusted: wrong schema version or damaged structure
public class SnapshotCorruptException extends IOException {

    public SnapshotCorruptException(final String message) {
        super(message);
    }

    public SnapshotCorruptException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
