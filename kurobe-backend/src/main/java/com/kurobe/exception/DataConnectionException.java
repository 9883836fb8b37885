package com.kurobe.exception;

/**
 * Thrown when a backend is unreachable, rejects credentials, or fails its handshake.
 */
public class DataConnectionException extends KurobeException {
    private final String connectionName;

    public DataConnectionException(String connectionName, String message) {
        super(message);
        this.connectionName = connectionName;
    }

    public DataConnectionException(String connectionName, String message, Throwable cause) {
        super(message, cause);
        this.connectionName = connectionName;
    }

    public String getConnectionName() {
        return connectionName;
    }
}
