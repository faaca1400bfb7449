package nl.nfi.pcfglite.config;

// inclusive bounds on password length, in code points
public record LengthBounds(int min, int max) {

    public LengthBounds {
        if (min < 1) {
            throw new IllegalArgumentException("Minimum password length must be positive: %d".formatted(min));
        }
        if (max < min) {
            throw new IllegalArgumentException("Maximum password length %d is below minimum %d".formatted(max, min));
        }
    }

    public boolean contains(final int length) {
        return length >= min && length <= max;
    }

    public boolean contains(final String password) {
        return contains(password.codePointCount(0, password.length()));
    }
}
