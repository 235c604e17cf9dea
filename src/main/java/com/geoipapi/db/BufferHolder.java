package com.geoipapi.db;

import com.geoipapi.db.Reader.FileMode;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Owns the bytes of one generation and hands every reader its own view.
 */
final class BufferHolder {
    // Never shared directly; readers only see duplicates.
    private final Buffer buffer;

    BufferHolder(File database, FileMode mode) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(database, "r");
             FileChannel channel = file.getChannel()) {
            long size = channel.size();
            if (size > Integer.MAX_VALUE) {
                throw new InvalidDatabaseException("The database " + database.getName()
                    + " is " + size + " bytes; at most " + Integer.MAX_VALUE + " are supported.");
            }
            this.buffer = mode == FileMode.MEMORY
                ? Buffer.wrap(readFully(channel, (int) size, database))
                : Buffer.map(channel);
        }
    }

    BufferHolder(byte[] bytes) {
        this.buffer = Buffer.wrap(bytes.clone());
    }

    private static byte[] readFully(FileChannel channel, int size, File database) throws IOException {
        var bytes = new byte[size];
        var target = ByteBuffer.wrap(bytes);
        while (target.hasRemaining()) {
            if (channel.read(target) == -1) {
                throw new IOException("The database " + database.getName()
                    + " shrank while it was being read.");
            }
        }
        return bytes;
    }

    /**
     * @return a view for the calling thread; duplicating only reads the shared
     *     buffer, so no locking is needed
     */
    Buffer get() {
        return this.buffer.duplicate();
    }
}
