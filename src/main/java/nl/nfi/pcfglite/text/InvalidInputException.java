package nl.nfi.pcfglite.text;

// empty or malformed password text, always recoverable by the caller
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(final String message) {
        super(message);
    }
}
