package com.optionlab.domain.model;

/**
 * Non-fatal Monte Carlo outcome: the standard error after all requested paths still exceeds the
 * caller's tolerance. The estimate is returned regardless.
 */
public record ConvergenceWarning(double standardError, double tolerance, int paths) {

    public String message() {
        return String.format(
                "Standard error %.6f exceeds tolerance %.6f after %d paths", standardError, tolerance, paths);
    }
}
