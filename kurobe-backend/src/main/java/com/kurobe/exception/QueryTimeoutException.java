package com.kurobe.exception;

/**
 * Thrown when a query exceeds its configured timeout.
 */
public class QueryTimeoutException extends KurobeException {
    private final int timeoutSeconds;

    /**
     * Create a new exception.
     *
     * @param timeoutSeconds the timeout that was exceeded
     * @param cause underlying driver or transport error, may be null
     */
    public QueryTimeoutException(int timeoutSeconds, Throwable cause) {
        super("Query exceeded timeout of " + timeoutSeconds + " seconds", cause);
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
