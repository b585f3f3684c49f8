package io.github.rtdb.errors;

/**
 * Thrown when a network connection fails.
 */
public class ConnectionError extends DatabaseException {

    /**
     * Creates a new ConnectionError with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public ConnectionError(String message, Throwable cause) {
        super(ErrorKind.NETWORK, message, cause);
    }
}
