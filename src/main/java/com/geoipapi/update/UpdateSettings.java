package com.geoipapi.update;

import com.geoipapi.db.Reader;
import com.google.common.base.Preconditions;
import java.time.Duration;

/**
 * Timing of the update cycle.
 *
 * @param interval          delay between the start of scheduled cycles
 * @param startupAttempts   cycles tried before giving up when no generation
 *                          is on disk at startup
 * @param startupBackoff    delay after the first failed startup attempt;
 *                          doubles after each further failure
 * @param maxStartupBackoff upper bound of the startup delay
 * @param fileMode          how activated generations are held in memory
 */
public record UpdateSettings(Duration interval,
                             int startupAttempts,
                             Duration startupBackoff,
                             Duration maxStartupBackoff,
                             Reader.FileMode fileMode) {

    public UpdateSettings {
        Preconditions.checkArgument(!interval.isNegative() && !interval.isZero(),
                                    "Update interval must be positive: %s", interval);
        Preconditions.checkArgument(startupAttempts >= 1, "At least one startup attempt is required: %s", startupAttempts);
        Preconditions.checkArgument(!startupBackoff.isNegative(), "Startup backoff must not be negative: %s", startupBackoff);
        Preconditions.checkArgument(maxStartupBackoff.compareTo(startupBackoff) >= 0,
                                    "Maximum startup backoff %s is below the initial backoff %s",
                                    maxStartupBackoff, startupBackoff);
    }

    /**
     * @param failures startup attempts that failed so far, at least one
     * @return the delay before the next attempt
     */
    Duration backoffAfter(final int failures) {
        Duration delay = startupBackoff;
        for (int i = 1; i < failures && delay.compareTo(maxStartupBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxStartupBackoff) > 0 ? maxStartupBackoff : delay;
    }
}
