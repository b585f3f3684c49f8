package io.github.rtdb;

import io.github.rtdb.errors.DatabaseException;
import io.github.rtdb.errors.RemoteRejectedError;
import io.github.rtdb.transport.Transport;
import io.github.rtdb.transport.TransportRequest;
import io.github.rtdb.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one request/response cycle against the transport and classifies the outcome.
 * No retries happen here.
 */
final class RequestExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestExecutor.class);

    private static final String HEADER_AUTH = "Authorization";
    private static final String HEADER_ACCEPT = "Accept";
    static final String EVENT_STREAM = "text/event-stream";

    private final Transport transport;
    private final ClientOptions options;

    RequestExecutor(Transport transport, ClientOptions options) {
        this.transport = transport;
        this.options = options;
    }

    /**
     * Sends a request and returns the response body of a 2xx answer.
     *
     * @throws io.github.rtdb.errors.TimeoutError        if the deadline expired
     * @throws io.github.rtdb.errors.ConnectionError     on other network failures
     * @throws io.github.rtdb.errors.RedirectLimitError  if too many redirects were needed
     * @throws RemoteRejectedError                       on any other status
     */
    byte[] execute(String method, String url, byte[] body) {
        String operation = method + " " + Urls.withoutQuery(url);
        LOGGER.debug("{}", operation);

        TransportResponse<byte[]> response;
        try {
            response = transport.send(buildRequest(method, url, body, false));
        } catch (InterruptedException e) {
            throw TransportFailures.interrupted(operation, e);
        } catch (IOException | RuntimeException e) {
            throw reclassify(operation, e);
        }

        byte[] responseBody = response.body() == null ? new byte[0] : response.body();
        int status = response.status();
        if (status >= 200 && status < 300) {
            return responseBody;
        }
        LOGGER.debug("{} rejected with status {}", operation, status);
        throw new RemoteRejectedError(status, new String(responseBody, StandardCharsets.UTF_8));
    }

    /**
     * Opens an event-stream connection and returns its unread body.
     * The caller owns the stream.
     */
    InputStream openStream(String url) {
        String operation = "stream " + Urls.withoutQuery(url);
        LOGGER.debug("{}", operation);

        TransportResponse<InputStream> response;
        try {
            response = transport.openStream(buildRequest("GET", url, null, true));
        } catch (InterruptedException e) {
            throw TransportFailures.interrupted(operation, e);
        } catch (IOException | RuntimeException e) {
            throw reclassify(operation, e);
        }

        int status = response.status();
        if (status >= 200 && status < 300) {
            return response.body();
        }
        throw new RemoteRejectedError(status, drain(operation, response.body()));
    }

    private TransportRequest buildRequest(String method, String url, byte[] body, boolean stream) {
        Map<String, String> headers = new LinkedHashMap<>(options.getHeaders());
        if (options.getToken() != null) {
            headers.put(HEADER_AUTH, "Bearer " + options.getToken());
        }
        if (stream) {
            headers.put(HEADER_ACCEPT, EVENT_STREAM);
        }
        // one deadline for the call, redirects included
        return new TransportRequest(method, URI.create(url), headers, body, options.getTimeout());
    }

    private static RuntimeException reclassify(String operation, Exception e) {
        if (e instanceof DatabaseException) {
            return (DatabaseException) e;
        }
        if (TransportFailures.isTransportFailure(e)) {
            return TransportFailures.classify(operation, e);
        }
        return (RuntimeException) e;
    }

    private static String drain(String operation, InputStream body) {
        if (body == null) {
            return "";
        }
        try (InputStream in = body) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw TransportFailures.classify(operation, e);
        }
    }
}
