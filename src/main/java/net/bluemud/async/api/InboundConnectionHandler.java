package net.bluemud.async.api;

import java.net.InetSocketAddress;

/**
 * Interface called whenever a new inbound connection is received
 */
public interface InboundConnectionHandler {

	/**
	 * @param remoteAddress address of the connecting host
	 * @return the listener for the new connection, or {@code null} to reject it
	 */
	ConnectionListener acceptConnection(InetSocketAddress remoteAddress);

	void connectionOpened(Connection connection);
}
