package com.optionlab.domain.model;

import com.optionlab.domain.enums.PricingMethod;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one pricing call. Only {@link #value} and {@link #method} are always set; the other
 * fields are method specific and null when not applicable:
 * <ul>
 *   <li>standardError, seed, referenceValue, deviationInStandardErrors: Monte Carlo</li>
 *   <li>exerciseBoundary: American lattice</li>
 *   <li>diagnosticGrid: finite difference</li>
 * </ul>
 */
@Value
@Builder
public class PricingResult {

    PricingMethod method;
    double value;
    Double standardError;
    Long seed;
    Integer steps;
    Integer paths;

    /** Closed-form value used to validate a Monte Carlo estimate. */
    Double referenceValue;

    /** (value - referenceValue) / standardError. */
    Double deviationInStandardErrors;

    List<ExerciseBoundaryPoint> exerciseBoundary;
    DiagnosticGrid diagnosticGrid;

    @Singular
    List<ConvergenceWarning> warnings;

    long elapsedMillis;

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
