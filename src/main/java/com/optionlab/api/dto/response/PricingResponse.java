package com.optionlab.api.dto.response;

import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.DiagnosticGrid;
import com.optionlab.domain.model.ExerciseBoundaryPoint;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * DTO for a single pricing call returned by the pricing REST API.
 *
 * <p>Method specific fields are null when they do not apply. Convergence warnings are rendered
 * as readable messages.
 */
@Data
@Builder
public class PricingResponse {

    private PricingMethod method;
    private double value;
    private Double standardError;
    private Long seed;
    private Integer steps;
    private Integer paths;

    /** Closed-form value the estimate was checked against. */
    private Double referenceValue;

    private Double deviationInStandardErrors;
    private List<ExerciseBoundaryPoint> exerciseBoundary;
    private DiagnosticGrid diagnosticGrid;
    private List<String> warnings;

    /** Wall time of the calculation in milliseconds. */
    private long elapsedMillis;
}
