package com.optionlab.domain.enums;

public enum PricingMethod {
    CLOSED_FORM,
    FINITE_DIFFERENCE,
    LATTICE,
    MONTE_CARLO
}
