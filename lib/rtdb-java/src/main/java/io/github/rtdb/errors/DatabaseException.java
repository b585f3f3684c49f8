package io.github.rtdb.errors;

/**
 * Base exception for all database client errors.
 */
public class DatabaseException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Creates a new configuration error.
     *
     * @param message the error message
     */
    public DatabaseException(String message) {
        this(ErrorKind.CONFIG, message, null);
    }

    /**
     * Creates a new DatabaseException with a kind, message and cause.
     *
     * @param kind    the failure kind
     * @param message the error message
     * @param cause   the underlying cause, may be null
     */
    protected DatabaseException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the failure kind.
     *
     * @return the kind
     */
    public ErrorKind getKind() {
        return kind;
    }
}
