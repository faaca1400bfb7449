package nl.nfi.pcfglite.config;

import java.nio.charset.Charset;

// minLength and maxLines of 0 disable the filter and the limit
public record TrainingSettings(double alpha, int minLength, long maxLines, long progressInterval, Charset encoding) {

    public TrainingSettings {
        if (!(alpha > 0.0) || Double.isInfinite(alpha)) {
            throw new IllegalArgumentException("ALPHA must be positive and finite: %s".formatted(alpha));
        }
        if (minLength < 0) {
            throw new IllegalArgumentException("TRAINING_MIN_LENGTH must not be negative: %d".formatted(minLength));
        }
        if (maxLines < 0) {
            throw new IllegalArgumentException("MAX_TRAINING_LINES must not be negative: %d".formatted(maxLines));
        }
        if (progressInterval < 1) {
            throw new IllegalArgumentException("PROGRESS_INTERVAL must be positive: %d".formatted(progressInterval));
        }
    }

    public TrainingSettings withAlpha(final double alpha) {
        return new TrainingSettings(alpha, minLength, maxLines, progressInterval, encoding);
    }

    public TrainingSettings withMinLength(final int minLength) {
        return new TrainingSettings(alpha, minLength, maxLines, progressInterval, encoding);
    }

    public TrainingSettings withMaxLines(final long maxLines) {
        return new TrainingSettings(alpha, minLength, maxLines, progressInterval, encoding);
    }
}
