package com.optionlab.api.dto.response;

import com.optionlab.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Failure envelope written by {@link com.optionlab.exception.GlobalExceptionHandler}.
 *
 * <p>{@code error.status} repeats the HTTP status so clients can tell rejected input (400) from a
 * pricing method that failed on valid input (422: arbitrage violation on the lattice or an
 * unstable PDE grid). For those, {@code error.details} carries the offending parameters or grid
 * configuration; for validation errors it maps each field to its message.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        ErrorDetail errorDetail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(errorDetail);
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
