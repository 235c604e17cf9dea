package com.geoipapi.update;

import java.nio.file.Path;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * A downloaded candidate was rejected and must not be activated.
 */
@ParametersAreNonnullByDefault
public class ValidationException extends Exception {
    private static final long serialVersionUID = 1L;

    private final Path candidate;

    public ValidationException(final Path candidate, final String reason) {
        this(candidate, reason, null);
    }

    public ValidationException(final Path candidate, final String reason, @Nullable final Throwable cause) {
        super("Rejected database candidate " + candidate + ": " + reason, cause);
        this.candidate = candidate;
    }

    public Path getCandidate() {
        return candidate;
    }
}
