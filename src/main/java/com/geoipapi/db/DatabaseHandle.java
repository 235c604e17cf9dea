package com.geoipapi.db;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A reference counted, opened database generation.
 *
 * <p>A new handle carries one reference, owned by whoever opened it (normally
 * the active slot). Readers take further references through {@link #tryLease()}
 * and give them back by closing the {@link Lease}. When the count drops to
 * zero the reader is closed and the release listener runs; from then on the
 * handle cannot be leased again.
 */
public final class DatabaseHandle {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseHandle.class);

    private final Reader reader;
    private final Path path;
    private final long sizeBytes;
    private final Runnable releaseListener;
    private final AtomicInteger references = new AtomicInteger(1);

    /**
     * Wraps an already opened reader.
     *
     * @param reader          the opened generation
     * @param path            the file the generation was read from
     * @param sizeBytes       the size of that file
     * @param releaseListener run once when the last reference is released;
     *                        may be {@code null}
     */
    public DatabaseHandle(Reader reader, Path path, long sizeBytes, Runnable releaseListener) {
        this.reader = reader;
        this.path = path;
        this.sizeBytes = sizeBytes;
        this.releaseListener = releaseListener;
    }

    /**
     * Opens the generation stored at {@code path}, loading it into memory.
     *
     * @param path the database file
     * @return a handle holding one reference
     * @throws IOException if the file cannot be read or is not a valid database
     */
    public static DatabaseHandle open(Path path) throws IOException {
        return open(path, Reader.FileMode.MEMORY, null);
    }

    /**
     * Opens the generation stored at {@code path}.
     *
     * @param path            the database file
     * @param fileMode        how the bytes are held
     * @param releaseListener run once when the last reference is released;
     *                        may be {@code null}
     * @return a handle holding one reference
     * @throws IOException if the file cannot be read or is not a valid database
     */
    public static DatabaseHandle open(Path path, Reader.FileMode fileMode, Runnable releaseListener)
        throws IOException {
        File file = path.toFile();
        long size = Files.size(path);
        return new DatabaseHandle(new Reader(file, fileMode), path, size, releaseListener);
    }

    /**
     * Takes a reference for the duration of one read.
     *
     * @return a lease, or empty if the handle has already been released
     */
    public Optional<Lease> tryLease() {
        return retain() ? Optional.of(new Lease()) : Optional.empty();
    }

    private boolean retain() {
        for (;;) {
            int current = references.get();
            if (current <= 0) {
                return false;
            }
            if (references.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Gives back one reference. The last release closes the generation.
     *
     * @throws IllegalStateException if the handle was released more often than
     *                               it was retained
     */
    public void release() {
        int remaining = references.decrementAndGet();
        if (remaining > 0) {
            return;
        }
        if (remaining < 0) {
            references.incrementAndGet();
            throw new IllegalStateException("Database " + reader.getName() + " released too often.");
        }
        reader.close();
        logger.info("Released database generation {} (build {}).", path, reader.getMetadata().buildDate());
        if (releaseListener != null) {
            releaseListener.run();
        }
    }

    /**
     * @return the number of outstanding references; zero once released
     */
    public int referenceCount() {
        return Math.max(0, references.get());
    }

    public boolean isReleased() {
        return references.get() <= 0;
    }

    public Metadata metadata() {
        return reader.getMetadata();
    }

    public Path path() {
        return path;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    @Override
    public String toString() {
        return "DatabaseHandle[" + path + ", build " + reader.getMetadata().buildEpoch()
            + ", references " + referenceCount() + "]";
    }

    /**
     * One reader's reference to the handle. Closing it more than once has no
     * further effect.
     */
    public final class Lease implements AutoCloseable {
        private final AtomicBoolean closed = new AtomicBoolean();

        private Lease() {
        }

        public Reader reader() {
            return reader;
        }

        public DatabaseHandle handle() {
            return DatabaseHandle.this;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
