package net.bluemud.async.api;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

/**
 * An established TCP connection driven by an event loop.
 * <p>
 * Apart from the address accessors, methods must be called on the event loop thread.
 */
public interface Connection {

	/**
	 * Write as much of the buffer as the socket will accept right now. The buffer position is advanced past the written
	 * bytes; anything left in the buffer is the caller's to offer again once
	 * {@link ConnectionListener#sendBufferFull(Connection, boolean)} reports that the send buffer has drained.
	 *
	 * @param data data to write
	 * @return the number of bytes written, possibly zero
	 * @throws java.nio.channels.ClosedChannelException if the connection is not connected
	 * @throws IOException if the write fails, the connection is NOT closed as a result
	 */
	int write(ByteBuffer data) throws IOException;

	int write(byte[] data, int offset, int length) throws IOException;

	/**
	 * Disconnect from the remote host. Does nothing if already disconnected.
	 * {@link ConnectionListener#disconnected(Connection, DisconnectReason)} is not called.
	 */
	void disconnect();

	InetSocketAddress getRemoteAddress();
	InetAddress getRemoteHost();
	int getRemotePort();

	ConnectionState getState();

	/**
	 * @return {@code true} between a {@code sendBufferFull(true)} notification and the matching {@code sendBufferFull(false)}
	 */
	boolean isSendBufferFull();

	/**
	 * @return the error behind a {@link DisconnectReason#SYSTEM_ERROR} disconnect, otherwise {@code null}
	 */
	IOException getLastError();

	int getRecvBufferCapacity();
}
