package net.bluemud.async;

import com.google.common.collect.Lists;
import net.bluemud.async.api.Connection;
import net.bluemud.async.api.ConnectionListener;
import net.bluemud.async.api.DisconnectReason;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * Records every event. Consumes nothing unless {@link #consume(Connection, ByteBuffer)} is overridden.
 */
class RecordingListener implements ConnectionListener {

	final List<String> received = Lists.newArrayList();
	final List<DisconnectReason> disconnects = Lists.newArrayList();
	final List<Boolean> sendBufferFull = Lists.newArrayList();

	@Override
	public int dataReceived(Connection connection, ByteBuffer data) {
		byte[] bytes = new byte[data.remaining()];
		data.duplicate().get(bytes);
		received.add(new String(bytes));
		return consume(connection, data);
	}

	protected int consume(Connection connection, ByteBuffer data) {
		return 0;
	}

	@Override
	public void disconnected(Connection connection, DisconnectReason reason) {
		disconnects.add(reason);
	}

	@Override
	public void sendBufferFull(Connection connection, boolean full) {
		sendBufferFull.add(full);
	}
}
