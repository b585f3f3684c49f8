package io.github.rtdb;

import io.github.rtdb.errors.DatabaseException;
import io.github.rtdb.errors.DecodeError;
import io.github.rtdb.transport.JdkHttpTransport;
import io.github.rtdb.transport.RedirectPolicy;
import io.github.rtdb.transport.Transport;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.lang.reflect.Type;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * A location in a Firebase Realtime Database, addressed over the REST API.
 * <p>
 * Use {@link #builder(String)} to create a root reference and {@link #child(String)} to
 * derive others. Derived references share the transport and options of their parent but
 * own a copy of its query parameters and their own streaming state.
 * <p>
 * Example usage:
 * <pre>{@code
 * try (Reference ref = Reference.builder("my-app.firebaseio.com")
 *         .auth("database-secret")
 *         .build()) {
 *     Reference users = ref.child("users");
 *     Reference alice = users.push(Map.of("name", "alice"));
 *     User user = alice.value(User.class);
 *
 *     users.addListener(EventType.PUT, event -> System.out.println(event.getPath()));
 *     users.watch();
 * }
 * }</pre>
 */
public final class Reference implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Reference.class);

    private static final String PARAM_AUTH = "auth";
    private static final String PARAM_FORMAT = "format";
    private static final String PARAM_SHALLOW = "shallow";
    private static final String PARAM_ORDER_BY = "orderBy";
    private static final String PARAM_START_AT = "startAt";
    private static final String PARAM_END_AT = "endAt";
    private static final String PARAM_EQUAL_TO = "equalTo";
    private static final String PARAM_LIMIT_TO_FIRST = "limitToFirst";
    private static final String PARAM_LIMIT_TO_LAST = "limitToLast";
    private static final String FORMAT_EXPORT = "export";

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private final String address;
    // sorted so that rendering is stable; guarded by itself
    private final Map<String, String> params;
    private final RequestExecutor executor;
    private final Gson gson;
    private final EventStream eventStream;

    private Reference(String address, Map<String, String> params, RequestExecutor executor, Gson gson) {
        this.address = address;
        this.params = params;
        this.executor = executor;
        this.gson = gson;
        this.eventStream = new EventStream(address);
    }

    /**
     * Creates a new builder for a root reference.
     *
     * @param url the database address; {@code https://} is assumed when no scheme is given
     * @return a new builder
     */
    public static Builder builder(String url) {
        return new Builder(url);
    }

    /**
     * Returns the address of this location, without {@code .json} and query parameters.
     *
     * @return the address
     */
    public String getUrl() {
        return address;
    }

    /**
     * Returns a snapshot of the query parameters sent with every request.
     *
     * @return unmodifiable copy of the parameters
     */
    public Map<String, String> getParams() {
        synchronized (params) {
            return Collections.unmodifiableMap(new TreeMap<>(params));
        }
    }

    /**
     * Creates a reference to a child location with the same configuration.
     * Leading and trailing slashes and a {@code .json} suffix are ignored.
     *
     * @param path the relative path, may contain several segments
     * @return the child reference
     */
    public Reference child(String path) {
        String sanitized = Urls.sanitizePath(path == null ? "" : path);
        if (sanitized.isEmpty()) {
            return copy(address);
        }
        return copy(address + "/" + Urls.encodePath(sanitized));
    }

    /**
     * Creates a reference to {@code path} counted from the root of the database,
     * with the same configuration.
     *
     * @param path the absolute path
     * @return the reference
     */
    public Reference ref(String path) {
        URI uri = URI.create(address);
        String root = uri.getScheme() + "://" + uri.getRawAuthority();
        String sanitized = Urls.sanitizePath(path == null ? "" : path);
        if (sanitized.isEmpty()) {
            return copy(root);
        }
        return copy(root + "/" + Urls.encodePath(sanitized));
    }

    // -- parameters changed in place

    /**
     * Sets the database secret or ID token sent as the {@code auth} parameter.
     *
     * @param token the credential
     * @return this reference
     */
    public Reference auth(String token) {
        return putParam(PARAM_AUTH, token);
    }

    /**
     * Removes the {@code auth} parameter.
     *
     * @return this reference
     */
    public Reference unauth() {
        return putParam(PARAM_AUTH, null);
    }

    /**
     * Limits reads to the keys of immediate children; object values come back as {@code true}.
     *
     * @param shallow whether reads are shallow
     * @return this reference
     */
    public Reference shallow(boolean shallow) {
        return putParam(PARAM_SHALLOW, shallow ? "true" : null);
    }

    /**
     * Asks the service to include priorities ({@code format=export}) in read results.
     *
     * @param include whether priorities are included
     * @return this reference
     */
    public Reference includePriority(boolean include) {
        return putParam(PARAM_FORMAT, include ? FORMAT_EXPORT : null);
    }

    // -- query filters returning a new reference

    /**
     * Orders query results by a child key, or by {@code $key}, {@code $value} or {@code $priority}.
     *
     * @param child the ordering expression
     * @return a new reference with the ordering applied
     * @throws DatabaseException if child is null
     */
    public Reference orderBy(String child) {
        return copyWith(PARAM_ORDER_BY, quote(child));
    }

    /**
     * Starts query results at a value. Integers and booleans are sent as is, anything else as a JSON string.
     *
     * @param value the start value
     * @return a new reference with the filter applied
     * @throws DatabaseException if value is null
     */
    public Reference startAt(String value) {
        return copyWith(PARAM_START_AT, escape(value));
    }

    /**
     * Ends query results at a value. Integers and booleans are sent as is, anything else as a JSON string.
     *
     * @param value the end value
     * @return a new reference with the filter applied
     * @throws DatabaseException if value is null
     */
    public Reference endAt(String value) {
        return copyWith(PARAM_END_AT, escape(value));
    }

    /**
     * Restricts query results to a value. Integers and booleans are sent as is, anything else as a JSON string.
     *
     * @param value the value to match
     * @return a new reference with the filter applied
     * @throws DatabaseException if value is null
     */
    public Reference equalTo(String value) {
        return copyWith(PARAM_EQUAL_TO, escape(value));
    }

    /**
     * Limits query results to the first {@code limit} entries.
     *
     * @param limit the number of entries
     * @return a new reference with the limit applied
     * @throws DatabaseException if limit is not positive
     */
    public Reference limitToFirst(int limit) {
        return copyWith(PARAM_LIMIT_TO_FIRST, validLimit(limit));
    }

    /**
     * Limits query results to the last {@code limit} entries.
     *
     * @param limit the number of entries
     * @return a new reference with the limit applied
     * @throws DatabaseException if limit is not positive
     */
    public Reference limitToLast(int limit) {
        return copyWith(PARAM_LIMIT_TO_LAST, validLimit(limit));
    }

    // -- CRUD

    /**
     * Reads the value at this location as raw JSON text.
     *
     * @return the JSON document, {@code null} when nothing is stored
     */
    public String rawValue() {
        byte[] body = executor.execute("GET", toString(), null);
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Reads the value at this location.
     *
     * @param type the target class
     * @param <T>  the target type
     * @return the decoded value, or null when nothing is stored
     * @throws DecodeError if the response does not decode into {@code type}
     */
    public <T> T value(Class<T> type) {
        return value((Type) type);
    }

    /**
     * Reads the value at this location into a generic type,
     * for example {@code new TypeToken<Map<String, User>>() {}.getType()}.
     *
     * @param type the target type
     * @param <T>  the target type
     * @return the decoded value, or null when nothing is stored
     * @throws DecodeError if the response does not decode into {@code type}
     */
    public <T> T value(Type type) {
        String json = rawValue();
        try {
            return gson.fromJson(json, type);
        } catch (JsonParseException e) {
            throw new DecodeError("cannot decode value at " + address + " as " + type.getTypeName(), e);
        }
    }

    /**
     * Replaces the data at this location.
     *
     * @param value the new value, encoded with Gson
     */
    public void set(Object value) {
        executor.execute("PUT", toString(), encode(value));
    }

    /**
     * Merges the given keys into the data at this location, leaving other keys untouched.
     *
     * @param value the keys to write, encoded with Gson
     */
    public void update(Object value) {
        executor.execute("PATCH", toString(), encode(value));
    }

    /**
     * Appends a value under a new, chronologically ordered key chosen by the service.
     *
     * @param value the value to append, encoded with Gson
     * @return a reference to the new child
     * @throws DecodeError if the response does not name the new key
     */
    public Reference push(Object value) {
        byte[] body = executor.execute("POST", toString(), encode(value));
        String json = new String(body, StandardCharsets.UTF_8);
        JsonElement name;
        try {
            JsonElement response = JsonParser.parseString(json);
            name = response.isJsonObject() ? response.getAsJsonObject().get("name") : null;
        } catch (JsonParseException e) {
            throw new DecodeError("cannot decode push response: " + json, e);
        }
        if (name == null || !name.isJsonPrimitive()) {
            throw new DecodeError("push response has no name: " + json);
        }
        LOGGER.debug("pushed {} under {}", name.getAsString(), address);
        return child(name.getAsString());
    }

    /**
     * Deletes the data at this location.
     */
    public void remove() {
        executor.execute("DELETE", toString(), null);
    }

    // -- streaming

    /**
     * Starts streaming changes at this location to the registered listeners.
     * The connection is opened before returning; later failures reach listeners as an
     * {@link EventType#ERROR} event and end the session.
     *
     * @return true if a session was started, false if one was already active
     * @throws DatabaseException if the connection cannot be opened
     */
    public boolean watch() {
        return eventStream.start(() -> executor.openStream(toString()));
    }

    /**
     * Stops streaming and releases all listener registrations.
     * Safe to call when not streaming.
     */
    public void stopWatching() {
        eventStream.stop();
    }

    /**
     * Returns whether a stream session is active.
     *
     * @return true while streaming
     */
    public boolean isWatching() {
        return eventStream.state() == StreamState.STREAMING;
    }

    /**
     * Returns the streaming state; {@link StreamState#FAILED} after a session ended on its own.
     *
     * @return the current state
     */
    public StreamState getStreamState() {
        return eventStream.state();
    }

    /**
     * Registers a listener for one event type. Terminal {@link EventType#ERROR} events are
     * delivered to every listener regardless of type.
     *
     * @param type     the event type to receive
     * @param listener the listener
     * @return handle to remove the registration
     */
    public ListenerRegistration addListener(EventType type, EventListener listener) {
        if (type == null) {
            throw new DatabaseException("event type cannot be null");
        }
        return eventStream.addListener(type, listener);
    }

    /**
     * Registers a listener for every event type.
     *
     * @param listener the listener
     * @return handle to remove the registration
     */
    public ListenerRegistration addListener(EventListener listener) {
        return eventStream.addListener(null, listener);
    }

    /**
     * Stops any active stream.
     */
    @Override
    public void close() {
        stopWatching();
    }

    /**
     * Returns the request URL: {@code <address>/.json} followed by the encoded query parameters.
     */
    @Override
    public String toString() {
        synchronized (params) {
            return Urls.render(address, params);
        }
    }

    private Reference copy(String newAddress) {
        Map<String, String> copied;
        synchronized (params) {
            copied = new TreeMap<>(params);
        }
        return new Reference(newAddress, copied, executor, gson);
    }

    private Reference copyWith(String name, String value) {
        Reference copy = copy(address);
        copy.putParam(name, value);
        return copy;
    }

    private Reference putParam(String name, String value) {
        synchronized (params) {
            if (value == null) {
                params.remove(name);
            } else {
                params.put(name, value);
            }
        }
        return this;
    }

    private byte[] encode(Object value) {
        return gson.toJson(value).getBytes(StandardCharsets.UTF_8);
    }

    private static String quote(String value) {
        if (value == null) {
            throw new DatabaseException("value cannot be null");
        }
        return new JsonPrimitive(value).toString();
    }

    private static String escape(String value) {
        if (value == null) {
            throw new DatabaseException("value cannot be null");
        }
        if (INTEGER.matcher(value).matches() || "true".equals(value) || "false".equals(value)) {
            return value;
        }
        return quote(value);
    }

    private static String validLimit(int limit) {
        if (limit <= 0) {
            throw new DatabaseException("limit must be positive");
        }
        return Integer.toString(limit);
    }

    /**
     * Builder for root references.
     */
    public static final class Builder {
        private final String url;
        private final ClientOptions.Builder optionsBuilder = ClientOptions.builder();
        private String auth;
        private Transport transport;
        private Gson gson;

        private Builder(String url) {
            if (url == null || url.isEmpty()) {
                throw new DatabaseException("url cannot be empty");
            }
            this.url = url;
        }

        /**
         * Sets the database secret or ID token sent as the {@code auth} parameter.
         *
         * @param auth the credential
         * @return this builder
         */
        public Builder auth(String auth) {
            this.auth = auth;
            return this;
        }

        /**
         * Sets an OAuth2 access token sent as a bearer token.
         *
         * @param token the access token
         * @return this builder
         */
        public Builder token(String token) {
            optionsBuilder.token(token);
            return this;
        }

        /**
         * Sets the deadline for connecting and receiving response headers.
         *
         * @param timeout the timeout duration
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            optionsBuilder.timeout(timeout);
            return this;
        }

        /**
         * Sets how many redirects a request may follow.
         *
         * @param redirectLimit the number of redirects
         * @return this builder
         */
        public Builder redirectLimit(int redirectLimit) {
            optionsBuilder.redirectLimit(redirectLimit);
            return this;
        }

        /**
         * Adds a header sent with every request.
         *
         * @param name  the header name
         * @param value the header value
         * @return this builder
         */
        public Builder header(String name, String value) {
            optionsBuilder.header(name, value);
            return this;
        }

        /**
         * Uses the given transport instead of a {@link JdkHttpTransport}. A transport may be
         * shared by several root references.
         *
         * @param transport the transport
         * @return this builder
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Uses the given Gson instance to encode and decode values.
         *
         * @param gson the Gson instance
         * @return this builder
         */
        public Builder gson(Gson gson) {
            this.gson = gson;
            return this;
        }

        /**
         * Builds the root reference.
         *
         * @return the reference
         */
        public Reference build() {
            ClientOptions options = optionsBuilder.build();
            Transport t = transport != null
                    ? transport
                    : new JdkHttpTransport(options.getTimeout(), RedirectPolicy.maxHops(options.getRedirectLimit()));
            Reference reference = new Reference(
                    Urls.sanitizeUrl(url),
                    new TreeMap<>(),
                    new RequestExecutor(t, options),
                    gson != null ? gson : new Gson());
            if (auth != null) {
                reference.auth(auth);
            }
            return reference;
        }
    }
}
