package net.bluemud.async;

import net.bluemud.async.api.Connection;
import net.bluemud.async.api.ConnectionListener;
import net.bluemud.async.api.DisconnectReason;
import net.bluemud.async.api.InboundConnectionHandler;
import net.bluemud.async.api.OutboundConnectionListener;
import net.bluemud.async.select.EventLoop;
import net.bluemud.async.select.Readiness;
import net.bluemud.async.select.ReadinessWatch;
import net.bluemud.async.select.SocketSelector;
import net.bluemud.async.select.WatchHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Listens for and opens TCP connections, all driven by a single {@link SocketSelector}.
 */
public class TcpFactory {
	private final static Logger LOG = LoggerFactory.getLogger(TcpFactory.class);

	private static InboundConnectionHandler REJECT_ALL = new InboundConnectionHandler() {
		@Override public ConnectionListener acceptConnection(InetSocketAddress remoteAddress) {
			return null;
		}

		@Override public void connectionOpened(Connection connection) {
		}
	};

	private final SocketSelector selector;
	private final InboundConnectionHandler inboundHandler;
	private final int recvBufferSize;

	public TcpFactory() throws IOException {
		this(REJECT_ALL);
	}

	public TcpFactory(InboundConnectionHandler inboundHandler) throws IOException {
		this(inboundHandler, TcpConnection.DEFAULT_RECV_BUFFER_SIZE);
	}

	/**
	 * @param inboundHandler handler for inbound connections
	 * @param recvBufferSize receive buffer size of each connection
	 * @throws IOException if the selector cannot be opened
	 */
	public TcpFactory(InboundConnectionHandler inboundHandler, int recvBufferSize) throws IOException {
		checkArgument(recvBufferSize > 0, "recvBufferSize must be positive: %s", recvBufferSize);
		this.inboundHandler = checkNotNull(inboundHandler, "inboundHandler");
		this.recvBufferSize = recvBufferSize;
		this.selector = new SocketSelector();
	}

	public EventLoop getEventLoop() {
		return selector;
	}

	/**
	 * Start listening for inbound connections, which are passed to the factory's {@link InboundConnectionHandler}.
	 *
	 * @param socketAddress the local address to listen on, the port may be 0
	 * @return the address actually bound
	 * @throws IOException if the address cannot be bound
	 */
	public InetSocketAddress listenOn(SocketAddress socketAddress) throws IOException {
		// Create a non-blocking server socket channel.
		final ServerSocketChannel lchannel = ServerSocketChannel.open();
		try {
			lchannel.configureBlocking(false);
			lchannel.bind(socketAddress);
		} catch (IOException iox) {
			closeChannel(lchannel);
			throw iox;
		}

		final InetSocketAddress localAddress = (InetSocketAddress)lchannel.getLocalAddress();
		LOG.debug("New server socket on {}", localAddress);

		// Watches can only be created on the selector thread.
		selector.execute(new Runnable() {
			@Override public void run() {
				try {
					selector.watch(lchannel, Readiness.ACCEPT, new WatchHandler() {
						@Override public void ready(ReadinessWatch watch) {
							acceptConnections(lchannel);
						}
					});
				} catch (IOException iox) {
					LOG.error("Error listening on {}", localAddress, iox);
					closeChannel(lchannel);
				}
			}
		});

		return localAddress;
	}

	/**
	 * Open a connection. The result is reported to {@code callback} on the selector thread.
	 * <p>
	 * An unresolved address is resolved again on the calling thread before connecting, failure to resolve it is
	 * reported as {@link DisconnectReason#HOST_NOT_FOUND}.
	 *
	 * @param socketAddress the remote address
	 * @param listener listener for the connection once connected
	 * @param callback notified of success or failure
	 */
	public void connectTo(InetSocketAddress socketAddress, final ConnectionListener listener,
						  final OutboundConnectionListener callback) {
		checkNotNull(socketAddress, "socketAddress");
		checkNotNull(listener, "listener");
		checkNotNull(callback, "callback");

		final InetSocketAddress requested = socketAddress;
		final InetSocketAddress resolved = socketAddress.isUnresolved()
				? new InetSocketAddress(socketAddress.getHostString(), socketAddress.getPort())
				: socketAddress;

		selector.execute(new Runnable() {
			@Override public void run() {
				if (resolved.isUnresolved()) {
					LOG.debug("Host not found: {}", requested.getHostString());
					callback.connectFailed(requested, DisconnectReason.HOST_NOT_FOUND,
							new UnknownHostException(requested.getHostString()));
				} else {
					startOutboundConnection(resolved, listener, callback);
				}
			}
		});
	}

	/**
	 * Shut down the selector, closing all listening sockets and connections. Connection listeners are not notified.
	 */
	public void shutdown() {
		selector.close();
	}

	private void acceptConnections(ServerSocketChannel server) {
		while (true) {
			SocketChannel lchannel;
			try {
				// Get the incoming connection.
				lchannel = server.accept();
			} catch (IOException iox) {
				LOG.error("Error accepting inbound connection ", iox);
				return;
			}

			if (lchannel == null) {
				// No more pending connections.
				return;
			}

			openInboundConnection(lchannel);
		}
	}

	private void openInboundConnection(SocketChannel lchannel) {
		try {
			// Set channel to non-blocking mode.
			lchannel.configureBlocking(false);

			InetSocketAddress remoteAddress = (InetSocketAddress)lchannel.getRemoteAddress();
			LOG.debug("Inbound connection from {}", remoteAddress);

			ConnectionListener listener = inboundHandler.acceptConnection(remoteAddress);
			if (listener == null) {
				// Rejected
				LOG.debug("Rejected connection from {}", remoteAddress);
				closeChannel(lchannel);
				return;
			}

			TcpConnection connection = new TcpConnection(lchannel, remoteAddress, recvBufferSize, selector, listener);
			inboundHandler.connectionOpened(connection);
		}
		catch (IOException iox) {
			LOG.error("Error processing inbound connection ", iox);
			closeChannel(lchannel);
		}
	}

	private void startOutboundConnection(final InetSocketAddress addr, final ConnectionListener listener,
										 final OutboundConnectionListener callback) {
		SocketChannel lchannel = null;
		try {
			// Open a socket channel to the specified address and initiate the connection.
			lchannel = SocketChannel.open();
			lchannel.configureBlocking(false);

			if (lchannel.connect(addr)) {
				// Connected immediately (e.g. loopback).
				completeOutboundConnection(lchannel, addr, listener, callback);
				return;
			}

			final SocketChannel pending = lchannel;
			selector.watch(lchannel, Readiness.CONNECT, new WatchHandler() {
				@Override public void ready(ReadinessWatch watch) {
					finishOutboundConnection(watch, pending, addr, listener, callback);
				}
			});
		}
		catch (IOException iox) {
			LOG.error("Error connecting to {} ", addr, iox);
			closeChannel(lchannel);
			callback.connectFailed(addr, DisconnectReason.SYSTEM_ERROR, iox);
		}
	}

	private void finishOutboundConnection(ReadinessWatch watch, SocketChannel lchannel, InetSocketAddress addr,
										  ConnectionListener listener, OutboundConnectionListener callback) {
		try {
			// Complete the connection.
			if (!lchannel.finishConnect()) {
				return;
			}
		}
		catch (IOException iox) {
			LOG.error("Outbound connection completion error ", iox);
			watch.release();
			closeChannel(lchannel);
			callback.connectFailed(addr, DisconnectReason.SYSTEM_ERROR, iox);
			return;
		}

		watch.release();
		completeOutboundConnection(lchannel, addr, listener, callback);
	}

	private void completeOutboundConnection(SocketChannel lchannel, InetSocketAddress addr,
											ConnectionListener listener, OutboundConnectionListener callback) {
		TcpConnection connection;
		try {
			connection = new TcpConnection(lchannel, addr, recvBufferSize, selector, listener);
		}
		catch (IOException iox) {
			LOG.error("Outbound connection completion error ", iox);
			closeChannel(lchannel);
			callback.connectFailed(addr, DisconnectReason.SYSTEM_ERROR, iox);
			return;
		}

		callback.connected(connection);
	}

	private static void closeChannel(Closeable channel) {
		if (channel == null) {
			return;
		}

		try {
			channel.close();
		} catch (IOException iox) {
			LOG.warn("Error closing channel", iox);
		}
	}
}
