package io.github.rtdb.errors;

/**
 * Reported to listeners when a streaming session ends because the connection
 * closed or the server revoked it.
 */
public class StreamTerminatedError extends DatabaseException {

    /**
     * Creates a new StreamTerminatedError.
     *
     * @param message the error message
     */
    public StreamTerminatedError(String message) {
        super(ErrorKind.STREAM_TERMINATED, message, null);
    }
}
