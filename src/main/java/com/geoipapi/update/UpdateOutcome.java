package com.geoipapi.update;

/**
 * Result of one update cycle.
 */
public enum UpdateOutcome {
    /** A newer generation was validated and activated. */
    UPDATED,
    /** The upstream database is not newer than the active one; nothing changed. */
    UNCHANGED,
    /** Download, validation or activation failed; the active generation is untouched. */
    FAILED,
    /** Another cycle was already running. */
    SKIPPED
}
