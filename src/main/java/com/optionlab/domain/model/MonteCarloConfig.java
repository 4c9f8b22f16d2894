package com.optionlab.domain.model;

import com.optionlab.exception.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

/**
 * Monte Carlo run settings.
 *
 * <p>{@code seed} null means a fresh seed is drawn and reported on the result.
 * {@code tolerance} null disables the convergence warning. With {@code antithetic} each normal
 * draw is also used negated and the pair average counts as one sample, so {@code paths} must be
 * even.
 */
@Value
public class MonteCarloConfig {

    int steps;
    int paths;
    Long seed;
    Double tolerance;
    boolean antithetic;

    @Builder(toBuilder = true)
    private MonteCarloConfig(int steps, int paths, Long seed, Double tolerance, boolean antithetic) {
        InvalidParameterException.require(steps >= 1, "Monte Carlo steps must be >= 1, got " + steps);
        InvalidParameterException.require(paths >= 1, "Monte Carlo paths must be >= 1, got " + paths);
        InvalidParameterException.require(
                tolerance == null || tolerance > 0, "Standard error tolerance must be positive");
        InvalidParameterException.require(
                !antithetic || paths % 2 == 0, "Antithetic sampling needs an even path count, got " + paths);
        this.steps = steps;
        this.paths = paths;
        this.seed = seed;
        this.tolerance = tolerance;
        this.antithetic = antithetic;
    }

    public static MonteCarloConfig of(int steps, int paths, long seed) {
        return new MonteCarloConfig(steps, paths, seed, null, false);
    }
}
