package com.geoipapi.update;

import java.nio.file.Path;

/**
 * One generation on disk.
 *
 * @param buildEpoch build time in seconds since the epoch; orders generations
 * @param path       the generation's file
 * @param sizeBytes  the file's size
 * @param active     whether the active pointer refers to this file
 */
public record RetentionEntry(long buildEpoch, Path path, long sizeBytes, boolean active) {

    RetentionEntry withActive(final boolean isActive) {
        return isActive == active ? this : new RetentionEntry(buildEpoch, path, sizeBytes, isActive);
    }
}
