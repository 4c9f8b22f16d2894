package com.optionlab.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_PARAMETER("INVALID_PARAMETER", 400),
    NOT_FOUND("NOT_FOUND", 404),
    ARBITRAGE_VIOLATION("ARBITRAGE_VIOLATION", 422),
    NUMERICAL_INSTABILITY("NUMERICAL_INSTABILITY", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
