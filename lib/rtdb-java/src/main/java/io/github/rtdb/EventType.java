package io.github.rtdb;

/**
 * Kinds of change events produced by a streaming session.
 */
public enum EventType {
    /** data at a path was replaced */
    PUT("put", true, false),
    /** keys at a path were merged */
    PATCH("patch", true, false),
    VALUE("value", true, false),
    CHILD_ADDED("child_added", true, false),
    CHILD_CHANGED("child_changed", true, false),
    CHILD_REMOVED("child_removed", true, false),
    CHILD_MOVED("child_moved", true, false),
    KEEP_ALIVE("keep-alive", false, false),
    /** the service cancelled the stream, usually because security rules no longer allow reading */
    CANCEL("cancel", false, true),
    /** the credential used by the stream expired or was revoked */
    AUTH_REVOKED("auth_revoked", false, true),
    /** synthetic terminal event carrying the error that ended the session */
    ERROR(null, false, true);

    private final String wireName;
    private final boolean payload;
    private final boolean terminal;

    EventType(String wireName, boolean payload, boolean terminal) {
        this.wireName = wireName;
        this.payload = payload;
        this.terminal = terminal;
    }

    /**
     * Returns the event name used in stream frames, or null for {@link #ERROR}.
     *
     * @return the wire name
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * Returns true if frames of this type carry a {@code {"path": ..., "data": ...}} payload.
     *
     * @return whether a payload is expected
     */
    public boolean hasPayload() {
        return payload;
    }

    /**
     * Returns true if an event of this type ends the session.
     *
     * @return whether the type is terminal
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Looks up a type by its wire name.
     *
     * @param name the event name from a frame
     * @return the type, or null if the name is not recognized
     */
    public static EventType fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (EventType type : values()) {
            if (name.equals(type.wireName)) {
                return type;
            }
        }
        return null;
    }
}
