package io.github.rtdb;

/**
 * Handle for one listener registration.
 * <p>
 * Registrations belong to a streaming session: stopping the stream or a session failure
 * releases them, after which they receive nothing more.
 */
public interface ListenerRegistration {

    /**
     * Removes this registration. Other registrations are unaffected.
     * Safe to call multiple times.
     */
    void remove();

    /**
     * Returns true while the registration can still receive events.
     *
     * @return whether the registration is active
     */
    boolean isActive();
}
