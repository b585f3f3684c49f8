package io.github.rtdb;

import io.github.rtdb.errors.DatabaseException;

import java.util.Objects;

/**
 * Event from a streaming session.
 */
public final class ChangeEvent {

    private final EventType type;
    private final String path;
    private final String data;
    private final DatabaseException error;

    /**
     * Creates a new change event.
     *
     * @param type the event type
     * @param path path of the change relative to the watched location, null for control events
     * @param data raw JSON payload, may be null
     */
    public ChangeEvent(EventType type, String path, String data) {
        this(type, path, data, null);
    }

    private ChangeEvent(EventType type, String path, String data, DatabaseException error) {
        this.type = Objects.requireNonNull(type, "type");
        this.path = path;
        this.data = data;
        this.error = error;
    }

    /**
     * Creates the terminal event reported when a session ends.
     *
     * @param error the reason the session ended
     * @return an {@link EventType#ERROR} event
     */
    public static ChangeEvent terminal(DatabaseException error) {
        return new ChangeEvent(EventType.ERROR, null, null, Objects.requireNonNull(error, "error"));
    }

    /**
     * Returns the event type.
     *
     * @return the type
     */
    public EventType getType() {
        return type;
    }

    /**
     * Returns the path of the change, relative to the watched location.
     *
     * @return the path, or null for control and error events
     */
    public String getPath() {
        return path;
    }

    /**
     * Returns the raw JSON payload.
     *
     * @return the payload, or null
     */
    public String getData() {
        return data;
    }

    /**
     * Returns the error that ended the session.
     *
     * @return the error for {@link EventType#ERROR} events, otherwise null
     */
    public DatabaseException getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChangeEvent that = (ChangeEvent) o;
        return type == that.type &&
                Objects.equals(path, that.path) &&
                Objects.equals(data, that.data) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, path, data, error);
    }

    @Override
    public String toString() {
        return "ChangeEvent{" +
                "type=" + type +
                ", path='" + path + '\'' +
                ", data='" + data + '\'' +
                (error != null ? ", error=" + error.getMessage() : "") +
                '}';
    }
}
