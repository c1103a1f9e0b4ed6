package net.bluemud.async;

import com.google.common.base.MoreObjects;
import net.bluemud.async.api.Connection;
import net.bluemud.async.api.ConnectionListener;
import net.bluemud.async.api.ConnectionState;
import net.bluemud.async.api.DisconnectReason;
import net.bluemud.async.select.EventLoop;
import net.bluemud.async.select.Readiness;
import net.bluemud.async.select.ReadinessWatch;
import net.bluemud.async.select.WatchHandler;
import net.bluemud.async.util.ReceiveBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.nio.channels.ClosedChannelException;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndexes;
import static com.google.common.base.Preconditions.checkState;

/**
 * An existing, connected TCP connection. Received data is buffered until the listener has processed it, writes go
 * straight to the socket and report when the socket's send buffer fills up.
 * <p>
 * Created by {@link TcpFactory} for inbound and outbound connections, but can equally be created around a socket
 * connected by other means. Not thread safe: everything happens on the thread of the {@link EventLoop}.
 */
public class TcpConnection implements Connection {
    private final static Logger LOG = LoggerFactory.getLogger(TcpConnection.class);

    /**
     * The default size of the receive buffer.
     */
    public static final int DEFAULT_RECV_BUFFER_SIZE = 1024;

    private final ByteChannel socket;
    private final InetSocketAddress remoteAddress;
    private final EventLoop eventLoop;
    private final ConnectionListener listener;
    private final ReceiveBuffer receiveBuffer;

    private final ReadinessWatch readWatch;
    private final ReadinessWatch writeWatch;

    private ConnectionState state = ConnectionState.CONNECTED;
    private IOException lastError;

    public TcpConnection(ByteChannel socket, InetSocketAddress remoteAddress, EventLoop eventLoop,
                         ConnectionListener listener) throws IOException {
        this(socket, remoteAddress, DEFAULT_RECV_BUFFER_SIZE, eventLoop, listener);
    }

    /**
     * Constructor. Must be called on the event loop thread.
     *
     * @param socket a connected socket in non-blocking mode, owned by the connection from now on
     * @param remoteAddress the address of the remote host
     * @param recvBufferSize the size of the receive buffer
     * @param eventLoop the loop notifying the connection of socket readiness
     * @param listener receives the connection's events
     * @throws IOException if the socket cannot be watched
     */
    public TcpConnection(ByteChannel socket, InetSocketAddress remoteAddress, int recvBufferSize,
                         EventLoop eventLoop, ConnectionListener listener) throws IOException {
        this.socket = checkNotNull(socket, "socket");
        this.remoteAddress = checkNotNull(remoteAddress, "remoteAddress");
        this.eventLoop = checkNotNull(eventLoop, "eventLoop");
        this.listener = checkNotNull(listener, "listener");
        this.receiveBuffer = new ReceiveBuffer(recvBufferSize);

        this.readWatch = eventLoop.watch(socket, Readiness.READ, new WatchHandler() {
            @Override public void ready(ReadinessWatch watch) {
                recvHandler();
            }
        });

        try {
            this.writeWatch = eventLoop.watch(socket, Readiness.WRITE, new WatchHandler() {
                @Override public void ready(ReadinessWatch watch) {
                    writeHandler();
                }
            });
        } catch (IOException | RuntimeException ex) {
            readWatch.release();
            throw ex;
        }

        // Only interested in writability after an incomplete write.
        this.writeWatch.setEnabled(false);

        LOG.debug("Connection to {} established", remoteAddress);
    }

    @Override
    public int write(ByteBuffer data) throws IOException {
        checkNotNull(data, "data");
        checkState(eventLoop.inEventLoop(), "write must be called on the event loop thread");

        if (state != ConnectionState.CONNECTED) {
            throw new ClosedChannelException();
        }

        int requested = data.remaining();
        int written = socket.write(data);

        if (written < requested) {
            // Did not write the entire buffer. Ask to be notified when the socket becomes writable, unless already waiting.
            LOG.debug("wrote part buffer to {}: {} of {} bytes", remoteAddress, written, requested);

            if (!writeWatch.isEnabled()) {
                writeWatch.setEnabled(true);
                listener.sendBufferFull(this, true);
            }
        }

        return written;
    }

    @Override
    public int write(byte[] data, int offset, int length) throws IOException {
        checkPositionIndexes(offset, offset + length, data.length);
        return write(ByteBuffer.wrap(data, offset, length));
    }

    @Override
    public void disconnect() {
        checkState(eventLoop.inEventLoop(), "disconnect must be called on the event loop thread");

        if (state != ConnectionState.CONNECTED) {
            return;
        }

        LOG.debug("Disconnecting from {}", remoteAddress);
        state = ConnectionState.DISCONNECTING;
        teardown();
    }

    @Override
    public InetSocketAddress getRemoteAddress() {
        return remoteAddress;
    }

    @Override
    public InetAddress getRemoteHost() {
        return remoteAddress.getAddress();
    }

    @Override
    public int getRemotePort() {
        return remoteAddress.getPort();
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    @Override
    public boolean isSendBufferFull() {
        return writeWatch.isEnabled();
    }

    @Override
    public IOException getLastError() {
        return lastError;
    }

    @Override
    public int getRecvBufferCapacity() {
        return receiveBuffer.capacity();
    }

    /**
     * Read from the socket, called when it is readable.
     */
    private void recvHandler() {
        if (state != ConnectionState.CONNECTED) {
            return;
        }

        if (receiveBuffer.isFull()) {
            // Nothing was consumed from a full buffer last time round - there is no room to read into.
            closeOnError(DisconnectReason.RECV_BUFFER_OVERFLOW);
            return;
        }

        ByteBuffer buffer = receiveBuffer.getEmptyBuffer();
        int lread;
        try {
            lread = socket.read(buffer);
        }
        catch (IOException iox) {
            lastError = iox;
            closeOnError(DisconnectReason.SYSTEM_ERROR);
            return;
        }

        if (lread == -1) {
            // The socket has been closed by the far-end.
            closeOnError(DisconnectReason.REMOTE_DISCONNECTED);
            return;
        }

        if (lread == 0) {
            // Spurious wakeup, nothing to read.
            return;
        }

        receiveBuffer.readComplete(buffer);

        int available = receiveBuffer.available();
        int consumed = listener.dataReceived(this, receiveBuffer.getData());

        if (state != ConnectionState.CONNECTED) {
            // Disconnected by the listener, the buffer has been released.
            return;
        }

        checkState(consumed >= 0 && consumed <= available,
                "Listener consumed %s bytes of %s available", consumed, available);
        receiveBuffer.compact(consumed);
    }

    /**
     * The socket is writable again after an incomplete write.
     */
    private void writeHandler() {
        if (state != ConnectionState.CONNECTED) {
            return;
        }

        writeWatch.setEnabled(false);
        listener.sendBufferFull(this, false);
    }

    private void closeOnError(DisconnectReason reason) {
        if (reason == DisconnectReason.SYSTEM_ERROR) {
            LOG.debug("Closing connection to {}: {}", remoteAddress, reason, lastError);
        } else {
            LOG.debug("Closing connection to {}: {}", remoteAddress, reason);
        }

        state = ConnectionState.DISCONNECTING;
        teardown();
        listener.disconnected(this, reason);
    }

    private void teardown() {
        try {
            readWatch.release();
        } finally {
            try {
                writeWatch.release();
            } finally {
                closeSocket();
            }
        }
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException iox) {
            LOG.warn("Error closing channel to {}", remoteAddress, iox);
        } finally {
            receiveBuffer.clear();
            state = ConnectionState.DISCONNECTED;
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("remoteAddress", remoteAddress)
                .add("state", state)
                .add("buffered", receiveBuffer.available())
                .toString();
    }
}
