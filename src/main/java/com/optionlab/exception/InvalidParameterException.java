package com.optionlab.exception;

import java.util.Map;

/**
 * Raised before any computation starts when an input cannot be priced: non-positive volatility,
 * expiry or spot, step/path counts below one, or a payoff the selected pricer cannot evaluate.
 */
public class InvalidParameterException extends BaseException {

    public InvalidParameterException(String message) {
        super(ErrorCode.INVALID_PARAMETER, message);
    }

    public InvalidParameterException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_PARAMETER, message, details);
    }

    /** Fails with {@code message} unless {@code condition} holds. */
    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidParameterException(message);
        }
    }
}
