package io.github.rtdb;

import io.github.rtdb.errors.ConnectionError;
import io.github.rtdb.errors.DatabaseException;
import io.github.rtdb.errors.TimeoutError;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Maps whatever a transport throws onto the client's error kinds.
 * <p>
 * An expired deadline becomes {@link TimeoutError} wherever it sits in the cause chain.
 * Any other network failure, an interrupted read included, becomes {@link ConnectionError}.
 */
final class TransportFailures {

    private TransportFailures() {
    }

    static DatabaseException classify(String operation, Throwable failure) {
        if (failure instanceof DatabaseException) {
            return (DatabaseException) failure;
        }
        Throwable timeout = findTimeout(failure);
        if (timeout != null) {
            return new TimeoutError(operation + " timed out: " + timeout.getMessage(), failure);
        }
        return new ConnectionError(operation + " failed: " + failure.getMessage(), failure);
    }

    static ConnectionError interrupted(String operation, InterruptedException e) {
        Thread.currentThread().interrupt();
        return new ConnectionError(operation + " interrupted", e);
    }

    /**
     * Returns true if an I/O or timeout failure is the exception or one of its causes.
     */
    static boolean isTransportFailure(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static Throwable findTimeout(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (isTimeout(t)) {
                return t;
            }
        }
        return null;
    }

    private static boolean isTimeout(Throwable t) {
        // HttpConnectTimeoutException extends HttpTimeoutException
        return t instanceof HttpTimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof TimeoutException;
    }
}
