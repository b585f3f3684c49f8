package io.github.rtdb.errors;

/**
 * Thrown when a request exceeds its deadline while connecting or waiting for a response.
 */
public class TimeoutError extends DatabaseException {

    /**
     * Creates a new TimeoutError.
     *
     * @param message the error message
     * @param cause   the transport exception that reported the timeout
     */
    public TimeoutError(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
