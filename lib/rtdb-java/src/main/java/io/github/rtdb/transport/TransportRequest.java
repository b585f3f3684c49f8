package io.github.rtdb.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * One request as handed to a {@link Transport}.
 *
 * @param method  HTTP method
 * @param url     fully rendered URL
 * @param headers headers to send on the request and on every redirect hop
 * @param body    request body, null for none
 * @param timeout end-to-end deadline for connecting and receiving response headers, null for none
 */
public record TransportRequest(
        String method,
        URI url,
        Map<String, String> headers,
        byte[] body,
        Duration timeout
) {
    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? null : body.clone();
    }
}
