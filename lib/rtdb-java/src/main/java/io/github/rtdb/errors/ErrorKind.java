package io.github.rtdb.errors;

/**
 * Closed set of failure kinds a database call can end with.
 */
public enum ErrorKind {
    /** connect, header or response deadline exceeded */
    TIMEOUT,
    /** any other connection-level failure */
    NETWORK,
    /** more redirect hops than the configured bound */
    REDIRECT_LIMIT,
    /** non-2xx status from the service */
    REMOTE_REJECTED,
    /** response body or stream frame did not parse as expected */
    DECODE,
    /** streaming session ended by connection loss or by the server */
    STREAM_TERMINATED,
    /** invalid client configuration */
    CONFIG
}
