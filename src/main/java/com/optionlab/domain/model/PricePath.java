package com.optionlab.domain.model;

import java.util.Arrays;
import java.util.stream.DoubleStream;

/**
 * One simulated price path of {@code steps + 1} prices, index 0 being the spot.
 *
 * <p>Immutable: the backing array is never handed out, {@link #toArray()} returns a copy.
 */
public final class PricePath {

    private final double[] prices;
    private final double timeStep;

    private PricePath(double[] prices, double timeStep) {
        this.prices = prices;
        this.timeStep = timeStep;
    }

    /** Copies {@code prices}. */
    public static PricePath of(double[] prices, double timeStep) {
        return new PricePath(prices.clone(), timeStep);
    }

    /** Takes ownership of {@code prices}; the caller must not write to the array afterwards. */
    public static PricePath wrap(double[] prices, double timeStep) {
        return new PricePath(prices, timeStep);
    }

    public int steps() {
        return prices.length - 1;
    }

    public int length() {
        return prices.length;
    }

    public double timeStep() {
        return timeStep;
    }

    public double price(int index) {
        return prices[index];
    }

    public double initial() {
        return prices[0];
    }

    public double terminal() {
        return prices[prices.length - 1];
    }

    public double maximum() {
        double max = prices[0];
        for (int i = 1; i < prices.length; i++) {
            if (prices[i] > max) {
                max = prices[i];
            }
        }
        return max;
    }

    /** Arithmetic mean over all observations, including the initial price. */
    public double average() {
        double sum = 0.0;
        for (double price : prices) {
            sum += price;
        }
        return sum / prices.length;
    }

    /**
     * Returns the path observed every {@code stride} steps. The result is a coarser sampling of
     * the same trajectory, so its maximum never exceeds this path's maximum.
     *
     * @throws IllegalArgumentException if {@code stride} does not divide the step count
     */
    public PricePath subsample(int stride) {
        if (stride == 1) {
            return this;
        }
        if (stride < 1 || steps() % stride != 0) {
            throw new IllegalArgumentException("Stride " + stride + " does not divide " + steps() + " steps");
        }
        double[] coarse = new double[steps() / stride + 1];
        for (int i = 0; i < coarse.length; i++) {
            coarse[i] = prices[i * stride];
        }
        return new PricePath(coarse, timeStep * stride);
    }

    public double[] toArray() {
        return prices.clone();
    }

    public DoubleStream stream() {
        return Arrays.stream(prices);
    }

    @Override
    public String toString() {
        return "PricePath{steps=" + steps() + ", initial=" + initial() + ", terminal=" + terminal() + "}";
    }
}
