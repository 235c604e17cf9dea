package com.geoipapi.update;

import com.geoipapi.db.DatabaseHandle;
import com.geoipapi.db.Metadata;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single reference to the generation lookups should use.
 *
 * <p>Readers never lock: {@link #acquire()} reads the reference and takes a
 * lease on it. The slot owns one reference of the handle it holds; after a
 * {@link #swap(DatabaseHandle)} that reference passes to the caller, which
 * releases it once it no longer needs the previous generation.
 */
@ParametersAreNonnullByDefault
public final class ActiveDatabaseSlot implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ActiveDatabaseSlot.class);

    // Null until the first generation is activated, and again after close().
    private final AtomicReference<DatabaseHandle> current = new AtomicReference<>();

    /**
     * Leases the current generation.
     *
     * @return a lease to close when the read is done, or empty if no
     *         generation is active
     */
    public Optional<DatabaseHandle.Lease> acquire() {
        for (;;) {
            final DatabaseHandle handle = current.get();
            if (null == handle) {
                return Optional.empty();
            }
            final Optional<DatabaseHandle.Lease> lease = handle.tryLease();
            if (lease.isPresent()) {
                return lease;
            }
            // The handle was swapped out and fully released between reading
            // the reference and leasing it; the slot already holds its
            // replacement.
            logger.debug("Lost race with a swap of {}; retrying.", handle);
        }
    }

    /**
     * Atomically makes {@code replacement} the active generation. The slot
     * takes over the reference the caller holds on it.
     *
     * @param replacement the handle to activate
     * @return the previous handle, whose slot reference the caller must release;
     *         {@code null} if there was none
     */
    @Nullable
    public DatabaseHandle swap(final DatabaseHandle replacement) {
        final DatabaseHandle previous = current.getAndSet(replacement);
        logger.info("Activated {} (replacing {}).", replacement, previous);
        return previous;
    }

    /**
     * @return the metadata of the active generation, if any
     */
    public Optional<Metadata> currentMetadata() {
        return Optional.ofNullable(current.get()).map(DatabaseHandle::metadata);
    }

    /**
     * @return the size in bytes of the active generation's file, if any
     */
    public Optional<Long> currentSize() {
        return Optional.ofNullable(current.get()).map(DatabaseHandle::sizeBytes);
    }

    public boolean isActive() {
        return current.get() != null;
    }

    /**
     * Empties the slot and releases its reference. Leases already taken stay
     * valid until closed.
     */
    @Override
    public void close() {
        final DatabaseHandle handle = current.getAndSet(null);
        if (null != handle) {
            handle.release();
        }
    }
}
