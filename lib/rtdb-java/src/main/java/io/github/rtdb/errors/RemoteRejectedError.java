package io.github.rtdb.errors;

/**
 * Thrown when the service answers with a status outside 200..299.
 * The service puts its error message in the body, which is kept verbatim.
 */
public class RemoteRejectedError extends DatabaseException {

    private final int statusCode;
    private final String body;

    /**
     * Creates a new RemoteRejectedError.
     *
     * @param statusCode the HTTP status
     * @param body       the raw response body
     */
    public RemoteRejectedError(int statusCode, String body) {
        super(ErrorKind.REMOTE_REJECTED, "HTTP " + statusCode + ": " + body, null);
        this.statusCode = statusCode;
        this.body = body;
    }

    /**
     * Returns the HTTP status.
     *
     * @return the status code
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the raw response body.
     *
     * @return the body text
     */
    public String getBody() {
        return body;
    }
}
