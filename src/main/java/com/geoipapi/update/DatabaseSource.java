package com.geoipapi.update;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Where new generations come from.
 */
@FunctionalInterface
public interface DatabaseSource {
    /**
     * Writes the current upstream database, uncompressed, to {@code target}.
     * On failure the contents of {@code target} are undefined; the caller
     * discards it.
     *
     * @param target an existing, empty file
     * @throws DownloadException    if the upstream could not be fetched
     * @throws IOException          if writing {@code target} failed
     * @throws InterruptedException if the fetch was cancelled
     */
    void fetch(Path target) throws IOException, InterruptedException;

    /**
     * Names the release a fetch made now would download, for upstreams that
     * publish each release under its own name. A release that is already
     * active is not downloaded again.
     *
     * @return the release, or empty if the upstream may change at any time
     */
    default Optional<String> release() {
        return Optional.empty();
    }
}
