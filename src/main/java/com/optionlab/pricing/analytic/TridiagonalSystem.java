package com.optionlab.pricing.analytic;

/**
 * A constant tridiagonal matrix factorised once (Thomas algorithm) and solved against many
 * right-hand sides. The PDE operator does not change between time steps, so the forward
 * elimination factors are computed in the constructor and each {@link #solve} is a single O(n)
 * sweep.
 *
 * <p>Row i reads {@code lower[i] * x[i-1] + diagonal[i] * x[i] + upper[i] * x[i+1] = rhs[i]};
 * {@code lower[0]} and {@code upper[n-1]} are ignored. Not thread-safe: the scratch buffer is
 * shared between calls.
 */
final class TridiagonalSystem {

    private final int size;
    private final double[] lower;
    private final double[] modifiedUpper;
    private final double[] pivots;
    private final double[] scratch;

    TridiagonalSystem(double[] lower, double[] diagonal, double[] upper) {
        this.size = diagonal.length;
        this.lower = lower.clone();
        this.modifiedUpper = new double[size];
        this.pivots = new double[size];
        this.scratch = new double[size];

        pivots[0] = diagonal[0];
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                pivots[i] = diagonal[i] - lower[i] * modifiedUpper[i - 1];
            }
            if (pivots[i] == 0.0) {
                throw new ArithmeticException("Singular tridiagonal system at row " + i);
            }
            modifiedUpper[i] = i < size - 1 ? upper[i] / pivots[i] : 0.0;
        }
    }

    /** Writes the solution into {@code out}; {@code rhs} and {@code out} may be the same array. */
    void solve(double[] rhs, double[] out) {
        scratch[0] = rhs[0] / pivots[0];
        for (int i = 1; i < size; i++) {
            scratch[i] = (rhs[i] - lower[i] * scratch[i - 1]) / pivots[i];
        }
        out[size - 1] = scratch[size - 1];
        for (int i = size - 2; i >= 0; i--) {
            out[i] = scratch[i] - modifiedUpper[i] * out[i + 1];
        }
    }

    int size() {
        return size;
    }
}
