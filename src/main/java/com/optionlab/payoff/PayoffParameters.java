package com.optionlab.payoff;

import lombok.Builder;
import lombok.Value;

/**
 * Untyped parameter bag for building a {@link Payoff} from external input. Which fields are
 * required depends on the kind; see {@link PayoffFactory#create}.
 */
@Value
@Builder
public class PayoffParameters {

    Double strike;
    Double lowerBound;
    Double upperBound;
    Double amount;
}
