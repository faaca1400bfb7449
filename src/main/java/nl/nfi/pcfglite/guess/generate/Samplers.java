package nl.nfi.pcfglite.guess.generate;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.Random;
import java.util.function.Function;
import java.util.function.IntToDoubleFunction;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

// alias method (Vose): O(n) setup, O(1) per draw, two random numbers per draw
public final class Samplers {

    private Samplers() {
    }

    // weights need not be normalized, but must be non-negative with a positive sum
    static ToIntFunction<Random> buildIndexSampler(final int n, final IntToDoubleFunction weights) {
        if (n < 1) {
            throw new IllegalArgumentException("Cannot sample from an empty set");
        }

        double total = 0.0;
        for (int element = 0; element < n; element++) {
            final double weight = weights.applyAsDouble(element);
            if (weight < 0.0 || Double.isNaN(weight)) {
                throw new IllegalArgumentException("Invalid weight at %d: %s".formatted(element, weight));
            }
            total += weight;
        }
        if (!(total > 0.0)) {
            throw new IllegalArgumentException("Weights must have a positive sum");
        }

        final double[] u = new double[n];
        final int[] k = new int[n];

        final Queue<Integer> small = new ArrayDeque<>();
        final Queue<Integer> large = new ArrayDeque<>();

        for (int element = 0; element < n; element++) {
            u[element] = weights.applyAsDouble(element) / total * n;
            k[element] = element;

            if (u[element] < 1.0) {
                small.add(element);
            } else {
                large.add(element);
            }
        }

        while (!(small.isEmpty() || large.isEmpty())) {
            final int l = small.poll();
            final int g = large.poll();

            k[l] = g;
            u[g] = u[g] + u[l] - 1.0;

            if (u[g] < 1.0) {
                small.add(g);
            } else {
                large.add(g);
            }
        }

        // leftovers are due to rounding, they are (close to) exactly 1
        while (!large.isEmpty()) {
            u[large.poll()] = 1.0;
        }
        while (!small.isEmpty()) {
            u[small.poll()] = 1.0;
        }

        return random -> {
            final int i = random.nextInt(n);
            if (random.nextDouble() < u[i]) {
                return i;
            }
            return k[i];
        };
    }

    static <T> Function<Random, T> buildSampler(final List<T> elements, final ToDoubleFunction<T> weight) {
        final ToIntFunction<Random> indexSampler = buildIndexSampler(elements.size(), index -> weight.applyAsDouble(elements.get(index)));
        return random -> elements.get(indexSampler.applyAsInt(random));
    }
}
