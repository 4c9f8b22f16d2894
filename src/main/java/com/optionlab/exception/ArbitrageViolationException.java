package com.optionlab.exception;

import java.util.Map;

/**
 * The lattice risk-neutral probability fell outside (0, 1): the time step is too coarse for the
 * given volatility and carry. Details carry sigma, r, q, dt, u, d and p.
 */
public class ArbitrageViolationException extends BaseException {

    public ArbitrageViolationException(String message, Map<String, Object> details) {
        super(ErrorCode.ARBITRAGE_VIOLATION, message, details);
    }
}
