package net.bluemud.async.select;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Pipe;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class SocketSelectorTest {

    private SocketSelector selector;
    private Pipe pipe;
    private BlockingQueue<String> received;

    @Before
    public void setup() throws Exception {
        selector = new SocketSelector("Test-Selector");
        pipe = Pipe.open();
        pipe.source().configureBlocking(false);
        received = new LinkedBlockingQueue<String>();
    }

    @After
    public void cleanup() throws Exception {
        selector.close();
        selector.join(1000);
        pipe.sink().close();
        pipe.source().close();
    }

    /**
     * Run on the selector thread and wait for the result.
     */
    private <T> T onSelector(Callable<T> callable) throws Exception {
        FutureTask<T> task = new FutureTask<T>(callable);
        selector.execute(task);
        return task.get(1, TimeUnit.SECONDS);
    }

    private ReadinessWatch watchSource() throws Exception {
        return onSelector(new Callable<ReadinessWatch>() {
            @Override public ReadinessWatch call() throws Exception {
                return selector.watch(pipe.source(), Readiness.READ, new WatchHandler() {
                    @Override public void ready(ReadinessWatch watch) {
                        assertThat(selector.inEventLoop(), is(true));

                        ByteBuffer buffer = ByteBuffer.allocate(64);
                        try {
                            int read = pipe.source().read(buffer);
                            if (read > 0) {
                                received.add(new String(buffer.array(), 0, read));
                            }
                        } catch (IOException iox) {
                            received.add("error: " + iox);
                        }
                    }
                });
            }
        });
    }

    private void send(String data) throws IOException {
        pipe.sink().write(ByteBuffer.wrap(data.getBytes()));
    }

    @Test
    public void readWatchFires() throws Exception {
        ReadinessWatch watch = watchSource();
        assertThat(watch.getReadiness(), is(Readiness.READ));
        assertThat(watch.isEnabled(), is(true));

        send("hello");
        assertThat(received.poll(1, TimeUnit.SECONDS), is("hello"));
    }

    @Test
    public void disabledWatchDoesNotFire() throws Exception {
        final ReadinessWatch watch = watchSource();
        onSelector(new Callable<Void>() {
            @Override public Void call() {
                watch.setEnabled(false);
                return null;
            }
        });

        send("held");
        assertThat(received.poll(200, TimeUnit.MILLISECONDS), is(nullValue()));

        onSelector(new Callable<Void>() {
            @Override public Void call() {
                watch.setEnabled(true);
                return null;
            }
        });
        assertThat(received.poll(1, TimeUnit.SECONDS), is("held"));
    }

    @Test
    public void releasedWatchDoesNotFire() throws Exception {
        final ReadinessWatch watch = watchSource();
        onSelector(new Callable<Void>() {
            @Override public Void call() {
                watch.release();
                watch.release();
                watch.setEnabled(true);
                return null;
            }
        });

        assertThat(watch.isReleased(), is(true));
        assertThat(watch.isEnabled(), is(false));

        send("dropped");
        assertThat(received.poll(200, TimeUnit.MILLISECONDS), is(nullValue()));

        // A new watch can be created once the old one is released.
        watchSource();
        assertThat(received.poll(1, TimeUnit.SECONDS), is("dropped"));
    }

    @Test
    public void oneWatchPerReadiness() throws Exception {
        watchSource();
        try {
            watchSource();
            fail("Expected IllegalStateException");
        } catch (ExecutionException ex) {
            assertThat(ex.getCause(), instanceOf(IllegalStateException.class));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void watchOnlyOnSelectorThread() throws Exception {
        selector.watch(pipe.source(), Readiness.READ, new WatchHandler() {
            @Override public void ready(ReadinessWatch watch) {
            }
        });
    }

    @Test
    public void tasksRunOnSelectorThread() throws Exception {
        assertThat(selector.inEventLoop(), is(false));

        boolean inLoop = onSelector(new Callable<Boolean>() {
            @Override public Boolean call() {
                return selector.inEventLoop();
            }
        });
        assertThat(inLoop, is(true));
    }

    @Test
    public void failingHandlerDoesNotStopSelector() throws Exception {
        final Pipe other = Pipe.open();
        other.source().configureBlocking(false);
        try {
            onSelector(new Callable<ReadinessWatch>() {
                @Override public ReadinessWatch call() throws Exception {
                    return selector.watch(other.source(), Readiness.READ, new WatchHandler() {
                        @Override public void ready(ReadinessWatch watch) {
                            watch.release();
                            throw new IllegalStateException("handler failure");
                        }
                    });
                }
            });
            other.sink().write(ByteBuffer.wrap(new byte[] { 1 }));

            watchSource();
            send("still running");
            assertThat(received.poll(1, TimeUnit.SECONDS), is("still running"));
        } finally {
            other.sink().close();
            other.source().close();
        }
    }
}
