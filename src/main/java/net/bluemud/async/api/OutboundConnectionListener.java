package net.bluemud.async.api;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Called when a particular outbound connection is connected, or has failed.
 */
public interface OutboundConnectionListener {
	void connected(Connection connection);

	/**
	 * @param reason {@link DisconnectReason#HOST_NOT_FOUND} or {@link DisconnectReason#SYSTEM_ERROR}
	 */
	void connectFailed(InetSocketAddress remoteAddress, DisconnectReason reason, IOException cause);
}
