package io.github.rtdb.transport;

import java.io.IOException;
import java.io.InputStream;

/**
 * HTTP transport used by references. One instance may be shared by any number of references.
 * <p>
 * Implementations enforce the redirect policy themselves and report deadline expiry by
 * throwing a timeout exception (for example {@link java.net.http.HttpTimeoutException}
 * or {@link java.net.SocketTimeoutException}), possibly wrapped.
 */
public interface Transport {

    /**
     * Performs one request and buffers the whole response body.
     *
     * @param request the request
     * @return the final (non-redirect) response
     * @throws IOException          on network failure or timeout
     * @throws InterruptedException if the calling thread is interrupted
     */
    TransportResponse<byte[]> send(TransportRequest request) throws IOException, InterruptedException;

    /**
     * Performs one request and hands back the response body unread.
     * The caller owns the returned stream and must close it.
     *
     * @param request the request
     * @return the final (non-redirect) response
     * @throws IOException          on network failure or timeout
     * @throws InterruptedException if the calling thread is interrupted
     */
    TransportResponse<InputStream> openStream(TransportRequest request) throws IOException, InterruptedException;
}
