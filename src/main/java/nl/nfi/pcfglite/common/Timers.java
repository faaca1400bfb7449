package nl.nfi.pcfglite.common;

import java.time.Duration;

public final class Timers {

    private Timers() {
    }

    public static <T, X extends Exception> TimedResult<T> time(final Expression<T, X> executable) throws X {
        final long start = System.nanoTime();
        final T result = executable.execute();
        return new TimedResult<>(result, Duration.ofNanos(System.nanoTime() - start));
    }

    @FunctionalInterface
    public interface Expression<T, X extends Exception> {
        T execute() throws X;
    }

    public record TimedResult<T>(T value, Duration duration) {
    }
}
