package com.geoipapi.update;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the generations kept in the data directory.
 *
 * <p>Layout: each generation is stored as {@code <prefix>-<build epoch>.mmdb};
 * {@code latest.mmdb} is a relative symbolic link to the active one; files
 * ending in {@code .tmp} are downloads or links in progress. Nothing else is
 * persisted, so {@link #load()} rebuilds the bookkeeping from the directory.
 *
 * <p>Only the update thread mutates the store. Methods are synchronized so that
 * snapshots taken from other threads are consistent.
 */
@ParametersAreNonnullByDefault
public final class RetentionStore {
    private static final Logger logger = LoggerFactory.getLogger(RetentionStore.class);

    public static final String ACTIVE_LINK_NAME = "latest.mmdb";
    static final String EXTENSION = ".mmdb";
    static final String TEMP_SUFFIX = ".tmp";

    private static final Comparator<RetentionEntry> NEWEST_FIRST =
            Comparator.comparingLong(RetentionEntry::buildEpoch).reversed();

    private final Path directory;
    private final String prefix;
    private final int maxRetained;
    private final Pattern generationFileName;

    // Newest first.
    private final List<RetentionEntry> entries = new ArrayList<>();

    public RetentionStore(final Path directory, final String prefix, final int maxRetained) {
        Preconditions.checkArgument(maxRetained >= 1, "At least one generation must be retained: %s", maxRetained);
        Preconditions.checkArgument(prefix.matches("[A-Za-z0-9_.-]+"), "Invalid file name prefix: %s", prefix);
        this.directory = directory.toAbsolutePath().normalize();
        this.prefix = prefix;
        this.maxRetained = maxRetained;
        this.generationFileName = Pattern.compile(Pattern.quote(prefix) + "-(\\d{1,19})" + Pattern.quote(EXTENSION));
    }

    /**
     * Rebuilds the entries from the directory, creating it if needed. Leftover
     * temporary files from an interrupted update are deleted.
     *
     * @throws IOException if the directory cannot be created or listed
     */
    public synchronized void load() throws IOException {
        Files.createDirectories(directory);
        final Optional<Path> activeTarget = readActiveLink();

        entries.clear();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (final Path file : files) {
                final String name = file.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    logger.info("Removing leftover temporary file {}.", file);
                    Files.deleteIfExists(file);
                    continue;
                }
                final Matcher matcher = generationFileName.matcher(name);
                if (!matcher.matches() || !Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                final boolean active = activeTarget.map(file::equals).orElse(false);
                entries.add(new RetentionEntry(Long.parseLong(matcher.group(1)), file, Files.size(file), active));
            }
        }
        entries.sort(NEWEST_FIRST);
        logger.info("Found {} database generation(s) in {}; active: {}.",
                    entries.size(), directory, activeEntry().map(RetentionEntry::path).orElse(null));
    }

    private Optional<Path> readActiveLink() throws IOException {
        final Path link = directory.resolve(ACTIVE_LINK_NAME);
        if (!Files.isSymbolicLink(link)) {
            return Optional.empty();
        }
        final Path target = directory.resolve(Files.readSymbolicLink(link)).normalize();
        if (!Files.isRegularFile(target)) {
            logger.warn("Active database link {} points to missing file {}.", link, target);
            return Optional.empty();
        }
        return Optional.of(target);
    }

    /**
     * Creates an empty, uniquely named file for a download. It is removed by
     * {@link #load()} if the process dies before it is installed.
     *
     * @return the new temporary file
     * @throws IOException if the file cannot be created
     */
    public Path newCandidateFile() throws IOException {
        Files.createDirectories(directory);
        return Files.createTempFile(directory, prefix + "-download-", EXTENSION + TEMP_SUFFIX);
    }

    /**
     * @param buildEpoch a generation's build epoch
     * @return where that generation is stored
     */
    public Path pathFor(final long buildEpoch) {
        return directory.resolve(prefix + "-" + buildEpoch + EXTENSION);
    }

    /**
     * Moves a validated candidate to its final name and records it as an
     * inactive generation.
     *
     * @param candidate  the validated temporary file
     * @param buildEpoch the candidate's build epoch
     * @return the new entry
     * @throws IOException if the move fails; the candidate is left in place
     */
    public synchronized RetentionEntry install(final Path candidate, final long buildEpoch) throws IOException {
        final Path target = pathFor(buildEpoch);
        Preconditions.checkState(activeEntry().map(e -> !e.path().equals(target)).orElse(true),
                                 "Refusing to overwrite the active generation %s", target);
        Files.move(candidate, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        final RetentionEntry entry = new RetentionEntry(buildEpoch, target, Files.size(target), false);
        record(entry);
        return entry;
    }

    /**
     * Adds a generation that is on disk but not yet active.
     *
     * @param entry the generation
     */
    public synchronized void record(final RetentionEntry entry) {
        entries.removeIf(e -> e.path().equals(entry.path()));
        entries.add(entry.withActive(false));
        entries.sort(NEWEST_FIRST);
    }

    /**
     * Points the active link at {@code entry} and marks it active; the
     * previously active entry becomes inactive. The link is replaced by an
     * atomic rename, so a crash leaves either the old or the new link.
     *
     * @param entry a recorded generation
     * @return the promoted entry
     * @throws IOException if the link cannot be replaced; the entries are unchanged
     */
    public synchronized RetentionEntry promote(final RetentionEntry entry) throws IOException {
        Preconditions.checkArgument(entries.stream().anyMatch(e -> e.path().equals(entry.path())),
                                    "Unknown generation: %s", entry.path());
        final Path link = directory.resolve(ACTIVE_LINK_NAME);
        final Path temporaryLink = directory.resolve(ACTIVE_LINK_NAME + TEMP_SUFFIX);
        Files.deleteIfExists(temporaryLink);
        Files.createSymbolicLink(temporaryLink, entry.path().getFileName());
        Files.move(temporaryLink, link, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);

        entries.replaceAll(e -> e.withActive(e.path().equals(entry.path())));
        logger.info("Active database link now points to {}.", entry.path().getFileName());
        return entry.withActive(true);
    }

    /**
     * Deletes the oldest generations until at most the retention limit
     * remain. The active generation is never deleted, nor is any generation
     * {@code inUse} reports as still referenced.
     *
     * @param inUse generations that are still being read
     * @return the entries that were deleted
     */
    public synchronized List<RetentionEntry> prune(final Predicate<Path> inUse) {
        int excess = entries.size() - maxRetained;
        final List<RetentionEntry> pruned = new ArrayList<>();
        for (int i = entries.size() - 1; i >= 0 && excess > 0; i--) {
            final RetentionEntry entry = entries.get(i);
            if (entry.active()) {
                logger.warn("Not pruning {}: it is the active generation.", entry.path());
                continue;
            }
            if (inUse.test(entry.path())) {
                logger.info("Not pruning {} yet: it is still being read.", entry.path());
                continue;
            }
            try {
                Files.deleteIfExists(entry.path());
                pruned.add(entry);
                excess--;
                logger.info("Pruned database generation {}.", entry.path());
            } catch (final IOException e) {
                logger.warn("Failed to remove old database file " + entry.path() + "; will retry.", e);
            }
        }
        entries.removeAll(pruned);
        return pruned;
    }

    public List<RetentionEntry> prune() {
        return prune(path -> false);
    }

    public synchronized Optional<RetentionEntry> activeEntry() {
        return entries.stream().filter(RetentionEntry::active).findFirst();
    }

    /**
     * @return a snapshot of the entries, newest first
     */
    public synchronized List<RetentionEntry> entries() {
        return ImmutableList.copyOf(entries);
    }

    public Path directory() {
        return directory;
    }
}
