package io.github.rtdb;

import io.github.rtdb.errors.DatabaseException;
import io.github.rtdb.transport.RedirectPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration options shared by a root reference and everything derived from it.
 * Use {@link #builder()} to create instances.
 */
public final class ClientOptions {

    /** default deadline for connecting and receiving response headers */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String token;
    private final Duration timeout;
    private final int redirectLimit;
    private final Map<String, String> headers;

    private ClientOptions(Builder builder) {
        this.token = builder.token;
        this.timeout = builder.timeout;
        this.redirectLimit = builder.redirectLimit;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    }

    /**
     * Creates a new builder for ClientOptions.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the OAuth2 access token sent as a bearer token, or null if not set.
     *
     * @return the token
     */
    public String getToken() {
        return token;
    }

    /**
     * Returns the deadline covering connect and response headers.
     *
     * @return the timeout
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Returns the number of redirects a request may follow.
     *
     * @return the redirect limit
     */
    public int getRedirectLimit() {
        return redirectLimit;
    }

    /**
     * Returns extra headers sent with every request.
     *
     * @return unmodifiable header map
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Builder for ClientOptions.
     */
    public static final class Builder {
        private String token;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int redirectLimit = RedirectPolicy.DEFAULT_MAX_HOPS;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Sets an OAuth2 access token, sent as {@code Authorization: Bearer <token>}.
         *
         * @param token the access token
         * @return this builder
         */
        public Builder token(String token) {
            this.token = token;
            return this;
        }

        /**
         * Sets the request timeout.
         *
         * @param timeout the timeout duration
         * @return this builder
         * @throws DatabaseException if timeout is not positive
         */
        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout cannot be null");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new DatabaseException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets how many redirects a request may follow.
         *
         * @param redirectLimit the number of redirects (0 or more)
         * @return this builder
         * @throws DatabaseException if redirectLimit is negative
         */
        public Builder redirectLimit(int redirectLimit) {
            if (redirectLimit < 0) {
                throw new DatabaseException("redirect limit cannot be negative");
            }
            this.redirectLimit = redirectLimit;
            return this;
        }

        /**
         * Adds a header sent with every request and kept across redirects.
         *
         * @param name  the header name
         * @param value the header value
         * @return this builder
         * @throws DatabaseException if name is empty
         */
        public Builder header(String name, String value) {
            if (name == null || name.isEmpty()) {
                throw new DatabaseException("header name cannot be empty");
            }
            Objects.requireNonNull(value, "header value cannot be null");
            headers.put(name, value);
            return this;
        }

        /**
         * Builds the ClientOptions instance.
         *
         * @return the configured options
         */
        public ClientOptions build() {
            return new ClientOptions(this);
        }
    }
}
