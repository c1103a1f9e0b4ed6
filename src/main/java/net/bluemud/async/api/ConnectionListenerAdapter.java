package net.bluemud.async.api;

/**
 * Listener with empty disconnect and send buffer notifications.
 */
public abstract class ConnectionListenerAdapter implements ConnectionListener {

	@Override
	public void disconnected(Connection connection, DisconnectReason reason) {
	}

	@Override
	public void sendBufferFull(Connection connection, boolean full) {
	}
}
