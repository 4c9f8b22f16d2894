package com.optionlab.domain.enums;

/**
 * When the holder may exercise. EUROPEAN only at expiry; AMERICAN at any time up to expiry.
 */
public enum ExerciseStyle {
    EUROPEAN,
    AMERICAN
}
