package net.bluemud.async.api;

/**
 * Reason reported to {@link ConnectionListener#disconnected(Connection, DisconnectReason)} and
 * {@link OutboundConnectionListener#connectFailed}.
 */
public enum DisconnectReason {
	/** The remote host name could not be resolved. Only reported for outbound connections. */
	HOST_NOT_FOUND,

	/** The remote host closed the connection. */
	REMOTE_DISCONNECTED,

	/** An I/O error occurred, see {@link Connection#getLastError()}. */
	SYSTEM_ERROR,

	/** The receive buffer was full and the listener did not consume any of it. */
	RECV_BUFFER_OVERFLOW
}
