package nl.nfi.pcfglite.common;

import java.text.CharacterIterator;
import java.text.StringCharacterIterator;
import java.time.Duration;

import static java.lang.Long.signum;
import static java.lang.Math.abs;

public final class Formatting {

    private Formatting() {
    }

    public static String toHumanReadableSize(final long size) {
        final long absB = size == Long.MIN_VALUE ? Long.MAX_VALUE : abs(size);
        if (absB < 1024) {
            return size + " B";
        }
        long value = absB;
        final CharacterIterator ci = new StringCharacterIterator("KMGTPE");
        for (int i = 40; i >= 0 && absB > 0xfffccccccccccccL >> i; i -= 10) {
            value >>= 10;
            ci.next();
        }
        value *= signum(size);
        return String.format("%.1f%ciB", value / 1024.0, ci.current());
    }

    // 42.0s, 3.5m, 1.2h
    public static String toHumanReadableDuration(final Duration duration) {
        final double seconds = duration.toMillis() / 1000.0;
        if (seconds < 60) {
            return String.format("%.1fs", seconds);
        }
        if (seconds < 3600) {
            return String.format("%.1fm", seconds / 60);
        }
        return String.format("%.1fh", seconds / 3600);
    }

    // 14344391 -> 14,344,391
    public static String toHumanReadableCount(final long count) {
        return String.format("%,d", count);
    }
}
