package net.bluemud.async;

import net.bluemud.async.api.Connection;
import net.bluemud.async.api.ConnectionListener;
import net.bluemud.async.api.ConnectionListenerAdapter;
import net.bluemud.async.api.DisconnectReason;
import net.bluemud.async.api.InboundConnectionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Echoes everything received. Data that cannot be written straight away is left unconsumed.
 */
class EchoServer implements InboundConnectionHandler {
	private final static Logger LOG = LoggerFactory.getLogger(EchoServer.class);

	final BlockingQueue<Connection> opened = new LinkedBlockingQueue<Connection>();
	final BlockingQueue<DisconnectReason> disconnects = new LinkedBlockingQueue<DisconnectReason>();

	@Override
	public ConnectionListener acceptConnection(InetSocketAddress remoteAddress) {
		return new ConnectionListenerAdapter() {
			@Override public int dataReceived(Connection connection, ByteBuffer data) {
				try {
					return connection.write(data);
				} catch (IOException iox) {
					LOG.warn("echo failed", iox);
					connection.disconnect();
					return 0;
				}
			}

			@Override public void disconnected(Connection connection, DisconnectReason reason) {
				disconnects.add(reason);
			}
		};
	}

	@Override
	public void connectionOpened(Connection connection) {
		opened.add(connection);
	}
}
