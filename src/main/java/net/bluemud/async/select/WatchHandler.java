package net.bluemud.async.select;

/**
 * Called by the event loop when a watched channel is ready.
 */
public interface WatchHandler {

    /**
     * Called on the event loop thread. Only called while the watch is enabled and not released.
     *
     * @param watch the watch that became ready
     */
    void ready(ReadinessWatch watch);
}
