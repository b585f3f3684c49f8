package io.github.rtdb;

/**
 * Lifecycle of the streaming session owned by a reference.
 */
public enum StreamState {
    IDLE,
    STREAMING,
    /** the last session ended on its own; a new {@link Reference#watch()} is needed */
    FAILED
}
