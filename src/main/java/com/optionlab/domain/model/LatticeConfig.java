package com.optionlab.domain.model;

import com.optionlab.exception.InvalidParameterException;
import lombok.Value;

@Value
public class LatticeConfig {

    int steps;

    public LatticeConfig(int steps) {
        InvalidParameterException.require(steps >= 1, "Lattice steps must be >= 1, got " + steps);
        this.steps = steps;
    }

    public static LatticeConfig ofSteps(int steps) {
        return new LatticeConfig(steps);
    }
}
