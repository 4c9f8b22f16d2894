package com.optionlab.simulation;

import java.util.concurrent.ThreadLocalRandom;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Explicit randomness source: a master seed from which any number of independent generators can
 * be derived by index.
 *
 * <p>{@link #stream(int)} is a pure function of (seed, index), so sub-stream {@code i} produces
 * the same numbers no matter which thread asks for it or in what order. Each sub-stream is a fresh
 * {@link Well19937c} whose state is initialised from a SplitMix64 hash of the pair, which keeps
 * neighbouring indices decorrelated. Generators are not thread-safe; hand each worker its own.
 */
public final class RandomStreams {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long seed;

    public RandomStreams(long seed) {
        this.seed = seed;
    }

    /** Uses {@code seed} when given, otherwise draws one; read it back with {@link #getSeed()}. */
    public static RandomStreams of(Long seed) {
        return new RandomStreams(seed != null ? seed : ThreadLocalRandom.current().nextLong());
    }

    public long getSeed() {
        return seed;
    }

    public RandomGenerator stream(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Stream index must be >= 0, got " + index);
        }
        long first = mix64(seed + GOLDEN_GAMMA * (index + 1L));
        long second = mix64(first ^ GOLDEN_GAMMA);
        return new Well19937c(new int[] {
            (int) (first >>> 32), (int) first, (int) (second >>> 32), (int) second, index
        });
    }

    private static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    @Override
    public String toString() {
        return "RandomStreams{seed=" + seed + "}";
    }
}
