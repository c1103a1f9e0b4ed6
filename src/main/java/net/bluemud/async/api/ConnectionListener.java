package net.bluemud.async.api;

import java.nio.ByteBuffer;

/**
 * Receives the events of a {@link Connection}. All methods are called on the event loop thread.
 */
public interface ConnectionListener {

	/**
	 * Called when data has been received. The buffer holds any bytes left unprocessed by previous calls followed by the
	 * newly read bytes. Bytes that are not consumed are kept and presented again, with new data appended, on the next
	 * call.
	 * <p>
	 * The buffer is a read-only view that is only valid for the duration of the call.
	 *
	 * @param connection the connection
	 * @param data buffered data, from position 0 to the limit
	 * @return the number of bytes processed, between 0 and {@code data.limit()}
	 */
	int dataReceived(Connection connection, ByteBuffer data);

	/**
	 * Called once when the connection has been closed for any reason other than a call to
	 * {@link Connection#disconnect()}.
	 */
	void disconnected(Connection connection, DisconnectReason reason);

	/**
	 * Called with {@code true} when a write could not be completed and with {@code false} once the socket is writable
	 * again. Calls always alternate.
	 */
	void sendBufferFull(Connection connection, boolean full);
}
