package net.bluemud.async.select;

import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.*;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * {@link EventLoop} running a {@link Selector} on its own daemon thread.
 */
public class SocketSelector extends Thread implements EventLoop, Closeable {
    private final static Logger LOG = LoggerFactory.getLogger(SocketSelector.class);

    /**
     * The selector.
     */
    private final Selector selector;

    /**
     * The run flag.
     */
    private volatile boolean running;

    /**
     * Tasks submitted to run on the selector thread.
     */
    private final ConcurrentLinkedQueue<Runnable> pendingTasks = new ConcurrentLinkedQueue<Runnable>();

    /**
     * Constructor.
     *
     * @throws java.io.IOException if an error occurs opening the selector
     */
    public SocketSelector() throws IOException {
        this("TCP-Selector");
    }

    public SocketSelector(String name) throws IOException {
        super(name);

        // Open selector.
        this.selector = Selector.open();
        start();
    }

    /* (non-Javadoc)
     * @see java.lang.Thread#start()
     */
    public void start() {
        // Start the thread.
        setDaemon(true);
        running = true;
        super.start();
    }

    /* (non-Javadoc)
     * @see java.lang.Thread#run()
     */
    public void run() {

        while (running) {
            try {
                // Wait for an event
                selector.select();

                if (running) {
                    Iterator<SelectionKey> liter = selector.selectedKeys().iterator();

                    // Process each key
                    while (liter.hasNext()) {
                        // Get the selection key
                        SelectionKey lkey = liter.next();

                        // Remove it from the list to indicate that it is being processed
                        liter.remove();

                        if (lkey.isValid()) {
                            processKey(lkey);
                        }
                    }
                }

                // Run anything submitted by other threads.
                Runnable task = pendingTasks.poll();
                while (task != null) {
                    runTask(task);
                    task = pendingTasks.poll();
                }
            }
            catch (ConcurrentModificationException cmex) {
                // The selected key set has been modified by a separate thread.
                LOG.error("selector key error", cmex);
            }
            catch (IOException iox) {
                LOG.error("selector error ", iox);
            }
            catch (ClosedSelectorException csx) {
                LOG.error("selector closed error ", csx);
            }
            catch (Throwable t) {
                LOG.error("unexpected selector error", t);
            }
        }

        // Thread exiting, close the selector.
        try {
            for (SelectionKey key : selector.keys()) {
                try {
                    key.channel().close();
                } catch (Exception ex) {
                    LOG.warn("Error closing channel", ex);
                }
            }

            selector.close();
        }
        catch (IOException iox) {
            LOG.warn("error closing selector ", iox);
        }
    }

    /**
     * Shutdown the selector thread. Channels still registered with the selector are closed.
     */
    public void close() {
        running = false;
        selector.wakeup();
    }

    @Override
    public void execute(Runnable task) {
        checkNotNull(task, "task");
        pendingTasks.offer(task);

        if (!inEventLoop()) {
            selector.wakeup();
        }
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == this;
    }

    @Override
    public ReadinessWatch watch(Channel channel, Readiness readiness, WatchHandler handler) throws IOException {
        checkNotNull(readiness, "readiness");
        checkNotNull(handler, "handler");
        checkArgument(channel instanceof SelectableChannel, "Not a selectable channel: %s", channel);
        checkState(inEventLoop(), "Watches must be created on the selector thread");

        SelectableChannel selectable = (SelectableChannel)channel;
        checkArgument((selectable.validOps() & readiness.ops()) != 0, "%s not supported by %s", readiness, channel);

        SelectionKey key = selectable.keyFor(selector);
        ChannelWatches watches;

        if (key == null) {
            // First watch on this channel - register with no interest, the watch sets it below.
            key = selectable.register(selector, 0);
            watches = new ChannelWatches(key);
            key.attach(watches);
        } else if (!key.isValid()) {
            // Only happens once the channel has been closed.
            throw new ClosedChannelException();
        } else {
            watches = (ChannelWatches)key.attachment();
        }

        return watches.add(readiness, handler);
    }

    private void processKey(SelectionKey key) {
        ChannelWatches watches = (ChannelWatches)key.attachment();
        if (watches == null) {
            return;
        }

        try {
            watches.ready(key.readyOps());
        }
        catch (CancelledKeyException ckx) {
            // Channel closed by a handler while processing its key.
            LOG.debug("key cancelled during processing", ckx);
        }
        catch (RuntimeException rex) {
            LOG.error("Error in readiness handler for {}", key.channel(), rex);
        }
    }

    private void runTask(Runnable task) {
        try {
            task.run();
        }
        catch (RuntimeException rex) {
            LOG.error("Error in selector task", rex);
        }
    }

    /**
     * The watches registered for a single channel, attached to the channel's selection key.
     */
    private final static class ChannelWatches {
        private final SelectionKey key;
        private final Map<Readiness, SelectorWatch> watches = Maps.newEnumMap(Readiness.class);

        ChannelWatches(SelectionKey key) {
            this.key = key;
        }

        ReadinessWatch add(Readiness readiness, WatchHandler handler) {
            checkState(!watches.containsKey(readiness), "Already watching %s for %s", readiness, key.channel());

            SelectorWatch watch = new SelectorWatch(this, readiness, handler);
            watches.put(readiness, watch);
            updateInterest();
            return watch;
        }

        void remove(SelectorWatch watch) {
            if (watches.get(watch.getReadiness()) == watch) {
                watches.remove(watch.getReadiness());
            }
            updateInterest();
        }

        void updateInterest() {
            if (!key.isValid()) {
                return;
            }

            int ops = 0;
            for (SelectorWatch watch : watches.values()) {
                if (watch.isEnabled()) {
                    ops |= watch.getReadiness().ops();
                }
            }
            key.interestOps(ops);
        }

        void ready(int readyOps) {
            // A handler may release watches, or close the channel, so re-check before each dispatch.
            for (Readiness readiness : Readiness.values()) {
                if (!key.isValid()) {
                    return;
                }

                if ((readyOps & readiness.ops()) != 0) {
                    SelectorWatch watch = watches.get(readiness);
                    if (watch != null && watch.isEnabled()) {
                        watch.handler.ready(watch);
                    }
                }
            }
        }
    }

    private final static class SelectorWatch implements ReadinessWatch {
        private final ChannelWatches owner;
        private final Readiness readiness;
        private final WatchHandler handler;

        private boolean enabled = true;
        private boolean released;

        SelectorWatch(ChannelWatches owner, Readiness readiness, WatchHandler handler) {
            this.owner = owner;
            this.readiness = readiness;
            this.handler = handler;
        }

        @Override
        public Readiness getReadiness() {
            return readiness;
        }

        @Override
        public void setEnabled(boolean enabled) {
            if (!released && this.enabled != enabled) {
                this.enabled = enabled;
                owner.updateInterest();
            }
        }

        @Override
        public boolean isEnabled() {
            return enabled && !released;
        }

        @Override
        public void release() {
            if (!released) {
                released = true;
                enabled = false;
                owner.remove(this);
            }
        }

        @Override
        public boolean isReleased() {
            return released;
        }
    }
}
