package io.github.rtdb.transport;

/**
 * Final response of a {@link Transport} exchange.
 *
 * @param status HTTP status code
 * @param body   response body
 * @param <T>    body representation
 */
public record TransportResponse<T>(int status, T body) {
}
