package net.bluemud.async.select;

/**
 * Interest in one kind of readiness of one channel, registered with an {@link EventLoop}.
 */
public interface ReadinessWatch {

    Readiness getReadiness();

    /**
     * Enable or disable notifications. Has no effect once released.
     */
    void setEnabled(boolean enabled);

    boolean isEnabled();

    /**
     * Unregister the watch. The handler is never called after this method returns. Releasing twice has no effect.
     */
    void release();

    boolean isReleased();
}
