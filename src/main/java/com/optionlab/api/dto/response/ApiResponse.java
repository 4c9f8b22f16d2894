package com.optionlab.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for every {@code /api/**} body: {@code {"success": true, "data": ..., "timestamp": ...}}.
 *
 * <p>Controllers return bare DTOs (pricing results, comparisons, simulated paths); the wrapping
 * is done once by {@link com.optionlab.config.ApiResponseAdvice}.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data) {
        this.success = true;
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
