package com.tradingplatform.api.dto.response;

import com.tradingplatform.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope written by {@link com.tradingplatform.exception.GlobalExceptionHandler}.
 * {@code details} carries field errors for bad requests, and the error type, source and
 * order id for execution failures.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorBody error;

    private ApiErrorResponse(ErrorBody error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorBody.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Getter
    @Builder
    public static class ErrorBody {
        private final String code;
        private final int status;
        private final String message;
        private final Map<String, Object> details;
        private final String path;
        private final Instant timestamp;
    }
}
