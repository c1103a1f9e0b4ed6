package net.bluemud.async.util;

import java.nio.ByteBuffer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;

/**
 * A fixed capacity byte buffer that is filled at the end and drained from the start, allowing portions of it to be
 * viewed / used as instances of {@code ByteBuffer}.
 * <p>
 * Data always starts at offset 0 of the backing array; {@link #compact(int)} moves unconsumed bytes back to the start.
 *
 * WARNING: Single thread only!
 * WARNING: ByteBuffer instances returned by {@link #getEmptyBuffer()} must be passed back to
 *   {@link #readComplete(ByteBuffer)} without changing their position other than by filling them (e.g. do not flip()).
 */
public class ReceiveBuffer {

	// The backing byte array
	private final byte[] array;

	// Number of bytes of data at the start of the array.
	private int count;

	public ReceiveBuffer(int capacity) {
		checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
		this.array = new byte[capacity];
	}

	public int capacity() {
		return array.length;
	}

	/**
	 * @return amount of data held.
	 */
	public int available() {
		return count;
	}

	/**
	 * @return space remaining for reading into.
	 */
	public int remaining() {
		return array.length - count;
	}

	public boolean isFull() {
		return count == array.length;
	}

	/**
	 * Returns a view of the empty end of the buffer. Data put into the returned buffer is added by a subsequent call to
	 * {@link #readComplete(ByteBuffer)}.
	 *
	 * @return a {@code ByteBuffer} positioned at the end of the data, with no remaining space if the buffer is full.
	 */
	public ByteBuffer getEmptyBuffer() {
		return ByteBuffer.wrap(array, count, remaining());
	}

	/**
	 * Buffer, obtained from {@link #getEmptyBuffer()}, that has had data read into it - and therefore into the
	 * underlying array.
	 * <p> Assumes the buffer has NOT been flipped</p>
	 * @param buffer returned buffer
	 */
	public void readComplete(ByteBuffer buffer) {
		checkArgument(buffer.array() == array, "Not a buffer of this ReceiveBuffer");
		checkPositionIndex(buffer.position(), array.length);
		checkArgument(buffer.position() >= count, "Buffer position %s is before the end of data %s", buffer.position(), count);
		count = buffer.position();
	}

	/**
	 * @return a read-only view of the data, from position 0 to the amount available.
	 */
	public ByteBuffer getData() {
		return ByteBuffer.wrap(array, 0, count).slice().asReadOnlyBuffer();
	}

	/**
	 * Discard the first {@code offset} bytes, moving the rest of the data to the start of the buffer.
	 *
	 * @param offset number of bytes consumed, between 0 and {@link #available()}
	 */
	public void compact(int offset) {
		checkPositionIndex(offset, count, "offset");

		if (offset > 0) {
			System.arraycopy(array, offset, array, 0, count - offset);
			count -= offset;
		}
	}

	/**
	 * Byte at {@code index}, relative to the start of the data.
	 */
	public byte get(int index) {
		checkElementIndex(index, count);
		return array[index];
	}

	public void clear() {
		count = 0;
	}
}
