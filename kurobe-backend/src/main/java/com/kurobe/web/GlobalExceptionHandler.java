package com.kurobe.web;

import com.kurobe.api.ErrorResponse;
import com.kurobe.exception.ConfigurationException;
import com.kurobe.exception.DataConnectionException;
import com.kurobe.exception.DuplicateNameException;
import com.kurobe.exception.EngineStateException;
import com.kurobe.exception.KurobeException;
import com.kurobe.exception.NotFoundException;
import com.kurobe.exception.QueryExecutionException;
import com.kurobe.exception.QueryTimeoutException;
import com.kurobe.exception.QuestionStateException;
import com.kurobe.exception.UnknownProviderException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_ID = "trace_id";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read", ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler({ConfigurationException.class, UnknownProviderException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
        String code = ex instanceof UnknownProviderException ? "UNKNOWN_PROVIDER"
                : ex instanceof ConfigurationException ? "CONFIGURATION_ERROR" : "INVALID_ARGUMENT";
        return respond(HttpStatus.BAD_REQUEST, code, ex.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNoHandler(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler({DuplicateNameException.class, QuestionStateException.class, EngineStateException.class})
    public ResponseEntity<ErrorResponse> handleConflict(KurobeException ex) {
        String code = ex instanceof DuplicateNameException ? "DUPLICATE_NAME" : "INVALID_STATE";
        return respond(HttpStatus.CONFLICT, code, ex.getMessage(), null);
    }

    @ExceptionHandler(QueryTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(QueryTimeoutException ex) {
        log.warn("Query timed out: timeout_seconds={}", ex.getTimeoutSeconds());
        return respond(HttpStatus.GATEWAY_TIMEOUT, "QUERY_TIMEOUT", ex.getMessage(), "timeout_seconds=" + ex.getTimeoutSeconds());
    }

    @ExceptionHandler(DataConnectionException.class)
    public ResponseEntity<ErrorResponse> handleConnection(DataConnectionException ex) {
        log.warn("Backend connection failure: name={}, error={}", ex.getConnectionName(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CONNECTION_FAILED", ex.getMessage(), "connection=" + ex.getConnectionName());
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> handleQueryExecution(QueryExecutionException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "QUERY_FAILED", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status, code, message, details, MDC.get(TRACE_ID)));
    }
}
