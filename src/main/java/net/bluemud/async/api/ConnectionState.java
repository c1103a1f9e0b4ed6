package net.bluemud.async.api;

/**
 * Lifecycle of a {@link Connection}. A connection never returns to {@link #CONNECTED}.
 */
public enum ConnectionState {
	CONNECTED,

	/** Closing because of a remote disconnect or an error, the listener has not been notified yet. */
	DISCONNECTING,

	DISCONNECTED
}
