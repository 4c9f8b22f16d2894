package com.optionlab.simulation;

import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.PricePath;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Finite, lazily generated sequence of simulated paths. Nothing is stored: each
 * {@link #iterator()} asks the source for a new generator and simulates from scratch, so
 * iterating twice over a seeded sequence yields the same paths.
 */
public final class PathSequence implements Iterable<PricePath> {

    private final PathSimulator pathSimulator;
    private final MarketParameters market;
    private final int steps;
    private final int paths;
    private final boolean antithetic;
    private final Supplier<? extends RandomGenerator> source;

    PathSequence(
            PathSimulator pathSimulator,
            MarketParameters market,
            int steps,
            int paths,
            boolean antithetic,
            Supplier<? extends RandomGenerator> source) {
        this.pathSimulator = pathSimulator;
        this.market = market;
        this.steps = steps;
        this.paths = paths;
        this.antithetic = antithetic;
        this.source = source;
    }

    public int size() {
        return paths;
    }

    public int steps() {
        return steps;
    }

    public boolean isAntithetic() {
        return antithetic;
    }

    public MarketParameters market() {
        return market;
    }

    @Override
    public Iterator<PricePath> iterator() {
        return new PathIterator(source.get());
    }

    public Stream<PricePath> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(
                        iterator(), paths, Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
                false);
    }

    private final class PathIterator implements Iterator<PricePath> {

        private final RandomGenerator rng;
        private int emitted;
        private PricePath mirror;

        private PathIterator(RandomGenerator rng) {
            this.rng = rng;
        }

        @Override
        public boolean hasNext() {
            return emitted < paths;
        }

        @Override
        public PricePath next() {
            if (!hasNext()) {
                throw new NoSuchElementException("All " + paths + " paths have been generated");
            }
            emitted++;
            if (mirror != null) {
                PricePath next = mirror;
                mirror = null;
                return next;
            }
            if (antithetic) {
                PricePath[] pair = pathSimulator.generateAntitheticPair(market, steps, rng);
                mirror = pair[1];
                return pair[0];
            }
            return pathSimulator.generatePath(market, steps, rng);
        }
    }
}
