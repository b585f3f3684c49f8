package io.github.rtdb.transport;

import io.github.rtdb.errors.RedirectLimitError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Transport implementation using {@link java.net.http.HttpClient}.
 * <p>
 * Redirects are followed here rather than by the client so that every hop carries the
 * original request headers and the hop count is bounded by a {@link RedirectPolicy}.
 * The request timeout is a single deadline spread over all hops.
 */
public final class JdkHttpTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient http;
    private final RedirectPolicy redirectPolicy;

    /**
     * Creates a transport with its own HttpClient.
     *
     * @param connectTimeout the connect timeout
     * @param redirectPolicy the redirect policy
     */
    public JdkHttpTransport(Duration connectTimeout, RedirectPolicy redirectPolicy) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), redirectPolicy);
    }

    /**
     * Creates a transport over an existing HttpClient.
     * The client must not follow redirects on its own.
     *
     * @param http           the JDK HttpClient to use
     * @param redirectPolicy the redirect policy
     */
    public JdkHttpTransport(HttpClient http, RedirectPolicy redirectPolicy) {
        this.http = Objects.requireNonNull(http, "http");
        this.redirectPolicy = Objects.requireNonNull(redirectPolicy, "redirectPolicy");
    }

    @Override
    public TransportResponse<byte[]> send(TransportRequest request) throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = exchange(request, HttpResponse.BodyHandlers.ofByteArray(), body -> { });
        byte[] body = resp.body() == null ? new byte[0] : resp.body();
        return new TransportResponse<>(resp.statusCode(), body);
    }

    @Override
    public TransportResponse<InputStream> openStream(TransportRequest request) throws IOException, InterruptedException {
        HttpResponse<InputStream> resp = exchange(request, HttpResponse.BodyHandlers.ofInputStream(), InputStream::close);
        return new TransportResponse<>(resp.statusCode(), resp.body());
    }

    private <T> HttpResponse<T> exchange(TransportRequest request,
                                         HttpResponse.BodyHandler<T> handler,
                                         BodyDiscarder<T> discarder) throws IOException, InterruptedException {
        Instant deadline = request.timeout() == null ? null : Instant.now().plus(request.timeout());
        String method = request.method();
        URI url = request.url();
        byte[] body = request.body();
        int hops = 0;

        while (true) {
            HttpRequest httpRequest = buildRequest(method, url, request.headers(), body, remaining(deadline, hops));
            HttpResponse<T> response = http.send(httpRequest, handler);

            int status = response.statusCode();
            String location = response.headers().firstValue("Location").orElse(null);
            if (!redirectPolicy.isRedirect(status) || location == null) {
                return response;
            }

            discarder.discard(response.body());
            hops++;
            if (hops > redirectPolicy.getMaxHops()) {
                throw new RedirectLimitError(hops);
            }

            String nextMethod = redirectPolicy.redirectMethod(status, method);
            if (!nextMethod.equals(method)) {
                body = null;
            }
            method = nextMethod;
            url = url.resolve(location);
            LOGGER.debug("redirect {} ({}) to {}://{}{}", hops, status, url.getScheme(), url.getAuthority(), url.getPath());
        }
    }

    private static Duration remaining(Instant deadline, int hops) throws HttpTimeoutException {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        if (left.isNegative() || left.isZero()) {
            throw new HttpTimeoutException("deadline exceeded after " + hops + " redirects");
        }
        return left;
    }

    private static HttpRequest buildRequest(String method, URI url, Map<String, String> headers,
                                            byte[] body, Duration timeout) {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);

        HttpRequest.Builder builder = HttpRequest.newBuilder(url).method(method, publisher);
        if (timeout != null) {
            builder.timeout(timeout);
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    @FunctionalInterface
    private interface BodyDiscarder<T> {
        void discard(T body) throws IOException;
    }
}
