package com.kurobe.exception;

/**
 * Thrown when a backend rejects or fails a query. The message carries the backend error text.
 */
public class QueryExecutionException extends KurobeException {
    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
