package com.geoipapi.update;

import com.geoipapi.db.DatabaseHandle;
import com.geoipapi.db.Metadata;
import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the active generation current.
 *
 * <p>Each cycle downloads a candidate, validates it, installs it in the
 * retention store, activates it and prunes old generations. At most one cycle
 * runs at a time; a cycle triggered while another is running is skipped.
 * Failures are logged and leave the active generation as it was. A release
 * the source names is downloaded once; later cycles for the same release do
 * not contact the upstream.
 *
 * <p>Generations that were swapped out are deleted from disk only once their
 * last lease has been closed.
 */
@ParametersAreNonnullByDefault
public final class UpdateScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(UpdateScheduler.class);

    public enum State {
        IDLE,
        DOWNLOADING,
        VALIDATING,
        ACTIVATING,
        PRUNING
    }

    private final UpdateSettings settings;
    private final DatabaseSource source;
    private final Validator validator;
    private final RetentionStore store;
    private final ActiveDatabaseSlot slot;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final ScheduledExecutorService executor;

    // Files of handles opened by this scheduler that have not been fully released.
    private final Multiset<Path> unreleased = ConcurrentHashMultiset.create();

    // Last release that was activated or found not to be newer than the active generation.
    @Nullable
    private volatile String currentRelease;

    public UpdateScheduler(final UpdateSettings settings,
                           final DatabaseSource source,
                           final Validator validator,
                           final RetentionStore store,
                           final ActiveDatabaseSlot slot) {
        this.settings = settings;
        this.source = source;
        this.validator = validator;
        this.store = store;
        this.slot = slot;
        this.executor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("database-updater-%d").setDaemon(true).build());
    }

    /**
     * Makes a generation active and schedules the periodic updates.
     *
     * <p>A generation already on disk is preferred: the one the active link
     * points to, otherwise the newest that opens. Without one, update cycles
     * are run on the calling thread until one succeeds, backing off between
     * attempts.
     *
     * @throws StartupException if no generation could be activated
     */
    public void start() {
        try {
            store.load();
        } catch (final IOException e) {
            throw new StartupException("Cannot read data directory " + store.directory(), e);
        }

        if (!activateFromDisk()) {
            logger.info("No usable database on disk; downloading one.");
            downloadInitial();
        }

        final long intervalMillis = settings.interval().toMillis();
        executor.scheduleAtFixedRate(this::runOnce, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        logger.info("Scheduled database updates every {}.", settings.interval());
    }

    private boolean activateFromDisk() {
        final List<RetentionEntry> candidates = new ArrayList<>();
        store.activeEntry().ifPresent(candidates::add);
        store.entries().stream().filter(e -> !e.active()).forEach(candidates::add);

        for (final RetentionEntry entry : candidates) {
            try {
                activate(entry, openHandle(entry.path()));
                logger.info("Using database {} found on disk.", entry.path());
                return true;
            } catch (final IOException e) {
                logger.warn("Database {} on disk is unusable: {}", entry.path(), e.getMessage());
            }
        }
        return false;
    }

    private void downloadInitial() {
        final int attempts = settings.startupAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            runOnce();
            if (slot.isActive()) {
                return;
            }
            if (attempt < attempts) {
                final Duration delay = settings.backoffAfter(attempt);
                logger.warn("Initial database download failed (attempt {} of {}); retrying in {}.",
                            attempt, attempts, delay);
                try {
                    Thread.sleep(delay.toMillis());
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StartupException("Interrupted while waiting to retry the initial download.", e);
                }
            }
        }
        throw new StartupException("No database could be activated after " + attempts + " attempt(s).");
    }

    /**
     * Runs one update cycle on the scheduler thread.
     *
     * @return the pending outcome of the cycle
     */
    public Future<UpdateOutcome> trigger() {
        return executor.submit(this::runOnce);
    }

    /**
     * Runs one update cycle on the calling thread. Never throws; failures are
     * logged and reported as {@link UpdateOutcome#FAILED}.
     *
     * @return the outcome of the cycle
     */
    public UpdateOutcome runOnce() {
        if (!state.compareAndSet(State.IDLE, State.DOWNLOADING)) {
            logger.info("Database update already in progress; skipping.");
            return UpdateOutcome.SKIPPED;
        }
        Path candidate = null;
        try {
            final Optional<String> release = source.release();
            if (release.isPresent() && release.get().equals(currentRelease) && slot.isActive()) {
                logger.info("Release {} is already active; not downloading it again.", release.get());
                return UpdateOutcome.UNCHANGED;
            }

            candidate = store.newCandidateFile();
            source.fetch(candidate);

            state.set(State.VALIDATING);
            final Metadata metadata = validator.validate(candidate, activeSize());
            final Optional<Metadata> current = slot.currentMetadata();
            if (current.isPresent() && current.get().buildEpoch().compareTo(metadata.buildEpoch()) >= 0) {
                logger.info("Downloaded database (built {}) is not newer than the active one (built {}).",
                            metadata.buildDate(), current.get().buildDate());
                currentRelease = release.orElse(null);
                return UpdateOutcome.UNCHANGED;
            }

            state.set(State.ACTIVATING);
            final RetentionEntry entry = store.install(candidate, metadata.buildEpoch().longValueExact());
            candidate = null;
            activate(entry, openHandle(entry.path()));
            currentRelease = release.orElse(null);

            state.set(State.PRUNING);
            store.prune(unreleased::contains);
            return UpdateOutcome.UPDATED;
        } catch (final DownloadException e) {
            logger.warn("Database download failed; keeping the active database: {}", e.getMessage());
            return UpdateOutcome.FAILED;
        } catch (final ValidationException e) {
            logger.error(e.getMessage(), e.getCause());
            return UpdateOutcome.FAILED;
        } catch (final IOException | RuntimeException e) {
            logger.error("Database update failed; keeping the active database.", e);
            return UpdateOutcome.FAILED;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Database update interrupted.");
            return UpdateOutcome.FAILED;
        } finally {
            if (null != candidate) {
                deleteCandidate(candidate);
            }
            state.set(State.IDLE);
        }
    }

    private OptionalLong activeSize() {
        return slot.currentSize().map(OptionalLong::of).orElse(OptionalLong.empty());
    }

    private DatabaseHandle openHandle(final Path path) throws IOException {
        final DatabaseHandle handle = DatabaseHandle.open(path, settings.fileMode(), () -> unreleased.remove(path));
        unreleased.add(path);
        return handle;
    }

    private void activate(final RetentionEntry entry, final DatabaseHandle handle) throws IOException {
        try {
            if (!entry.active()) {
                store.promote(entry);
            }
        } catch (final IOException | RuntimeException e) {
            handle.release();
            throw e;
        }
        final DatabaseHandle previous = slot.swap(handle);
        if (null != previous) {
            previous.release();
        }
    }

    private static void deleteCandidate(final Path candidate) {
        try {
            Files.deleteIfExists(candidate);
        } catch (final IOException e) {
            logger.warn("Failed to delete rejected database candidate " + candidate + '.', e);
        }
    }

    public State state() {
        return state.get();
    }

    /**
     * @return whether the file is still read by a generation that has not been
     *         fully released
     */
    boolean isUnreleased(final Path path) {
        return unreleased.contains(path);
    }

    /**
     * Stops scheduling. A running cycle is interrupted; its partial download
     * is deleted. The active generation stays in the slot.
     */
    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Database updater did not stop within 30 seconds.");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
