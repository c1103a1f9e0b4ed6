package net.bluemud.async.select;

import java.io.IOException;
import java.nio.channels.Channel;
import java.util.concurrent.Executor;

/**
 * A single threaded loop dispatching channel readiness to watch handlers.
 * <p>
 * {@link #execute(Runnable)} may be called from any thread, the remaining methods only from the loop thread.
 */
public interface EventLoop extends Executor {

    /**
     * Create an enabled watch.
     *
     * @param channel the channel, which must be in non-blocking mode
     * @param readiness the readiness to watch for
     * @param handler called on readiness
     * @return the watch
     * @throws IOException if the channel cannot be registered (e.g. it has been closed)
     * @throws IllegalStateException if there is already a live watch for the channel and readiness
     */
    ReadinessWatch watch(Channel channel, Readiness readiness, WatchHandler handler) throws IOException;

    /**
     * @return {@code true} if the calling thread is the loop thread
     */
    boolean inEventLoop();
}
