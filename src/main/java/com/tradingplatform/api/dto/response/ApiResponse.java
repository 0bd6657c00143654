package com.tradingplatform.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/** Envelope for successful API responses. Added by {@link com.tradingplatform.config.ApiResponseAdvice}. */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final String path;
    private final Instant timestamp;

    private ApiResponse(T data, String path, Instant timestamp) {
        this.data = data;
        this.path = path;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data, String path) {
        return new ApiResponse<>(data, path, Instant.now());
    }
}
