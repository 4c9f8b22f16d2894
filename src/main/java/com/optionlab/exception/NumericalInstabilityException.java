package com.optionlab.exception;

import java.util.Map;

/**
 * A finite-difference run violated its stability condition or produced non-finite grid values.
 * Details carry the grid configuration so the run can be reproduced.
 */
public class NumericalInstabilityException extends BaseException {

    public NumericalInstabilityException(String message, Map<String, Object> details) {
        super(ErrorCode.NUMERICAL_INSTABILITY, message, details);
    }
}
