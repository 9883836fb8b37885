package com.kurobe.api;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpStatus;

/**
 * Error body returned by every failing endpoint. {@code status} repeats the HTTP status code so
 * clients that only keep the body still see it; {@code trace_id} matches the request's log lines.
 */
@Value
@Builder
public class ErrorResponse {
    int status;
    String code;
    String message;
    String details;
    String traceId;

    public static ErrorResponse of(HttpStatus status, String code, String message, String details, String traceId) {
        return ErrorResponse.builder()
                .status(status.value())
                .code(code)
                .message(message)
                .details(details)
                .traceId(traceId)
                .build();
    }
}
