package nl.nfi.pcfglite.serialize.common;

import java.io.IOException;

// bytes that cannot be a value of the requested type, e.g. an oversized length prefix
public class MalformedDataException extends IOException {

    public MalformedDataException(final String message) {
        super(message);
    }
}
