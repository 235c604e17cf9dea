package com.geoipapi.db;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;

/**
 * Positional, read-only view over the bytes of one database generation. The
 * view is backed by a single {@link ByteBuffer}, so a generation holds at most
 * {@link Integer#MAX_VALUE} bytes.
 *
 * <p>Instances are not thread safe. Each reading thread works on its own
 * {@link #duplicate()}, which shares content but not position or limit.
 */
final class Buffer {
    private final ByteBuffer bytes;

    private Buffer(ByteBuffer bytes) {
        this.bytes = bytes;
    }

    static Buffer wrap(byte[] array) {
        return new Buffer(ByteBuffer.wrap(array).asReadOnlyBuffer());
    }

    static Buffer map(FileChannel channel) throws IOException {
        return new Buffer(channel.map(FileChannel.MapMode.READ_ONLY, 0, channel.size()).asReadOnlyBuffer());
    }

    /**
     * @return the size of the generation in bytes
     */
    long capacity() {
        return bytes.capacity();
    }

    long position() {
        return bytes.position();
    }

    /**
     * @throws IllegalArgumentException if the position is past the limit
     */
    Buffer position(long newPosition) {
        bytes.position(index(newPosition));
        return this;
    }

    long limit() {
        return bytes.limit();
    }

    /**
     * Sets the limit. Reads beyond the limit fail.
     */
    Buffer limit(long newLimit) {
        bytes.limit(index(newLimit));
        return this;
    }

    byte get() {
        return bytes.get();
    }

    Buffer get(byte[] dst) {
        bytes.get(dst);
        return this;
    }

    /**
     * @return the byte at {@code index}; the position is unchanged
     */
    byte get(long index) {
        return bytes.get(index(index));
    }

    double getDouble() {
        return bytes.getDouble();
    }

    float getFloat() {
        return bytes.getFloat();
    }

    Buffer duplicate() {
        return new Buffer(bytes.duplicate());
    }

    /**
     * Decodes the bytes between the position and the limit, leaving the
     * position at the limit.
     */
    String decode(CharsetDecoder decoder) throws CharacterCodingException {
        return decoder.decode(bytes).toString();
    }

    // Offsets past the int range become -1, which ByteBuffer rejects.
    private static int index(long offset) {
        return offset > Integer.MAX_VALUE ? -1 : (int) offset;
    }
}
