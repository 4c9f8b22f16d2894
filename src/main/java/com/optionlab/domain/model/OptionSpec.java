package com.optionlab.domain.model;

import com.optionlab.domain.enums.ExerciseStyle;
import com.optionlab.domain.enums.PayoffKind;
import com.optionlab.exception.InvalidParameterException;
import com.optionlab.payoff.Payoff;
import lombok.Builder;
import lombok.Value;

/**
 * What is being priced: an exercise style and a payoff variant. The payoff carries its strike
 * and any kind-specific parameters (barrier window, cash amount).
 */
@Value
public class OptionSpec {

    ExerciseStyle exerciseStyle;
    Payoff payoff;

    @Builder
    private OptionSpec(ExerciseStyle exerciseStyle, Payoff payoff) {
        InvalidParameterException.require(payoff != null, "Option payoff is required");
        this.exerciseStyle = exerciseStyle != null ? exerciseStyle : ExerciseStyle.EUROPEAN;
        this.payoff = payoff;
    }

    public static OptionSpec european(Payoff payoff) {
        return new OptionSpec(ExerciseStyle.EUROPEAN, payoff);
    }

    public static OptionSpec american(Payoff payoff) {
        return new OptionSpec(ExerciseStyle.AMERICAN, payoff);
    }

    public boolean isAmerican() {
        return exerciseStyle == ExerciseStyle.AMERICAN;
    }

    public PayoffKind getPayoffKind() {
        return payoff.kind();
    }

    public double getStrike() {
        return payoff.strike();
    }
}
