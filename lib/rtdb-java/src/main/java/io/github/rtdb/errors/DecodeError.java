package io.github.rtdb.errors;

/**
 * Thrown when a response does not parse into the expected shape.
 */
public class DecodeError extends DatabaseException {

    /**
     * Creates a new DecodeError.
     *
     * @param message the error message
     */
    public DecodeError(String message) {
        super(ErrorKind.DECODE, message, null);
    }

    /**
     * Creates a new DecodeError with a cause.
     *
     * @param message the error message
     * @param cause   the parser exception
     */
    public DecodeError(String message, Throwable cause) {
        super(ErrorKind.DECODE, message, cause);
    }
}
