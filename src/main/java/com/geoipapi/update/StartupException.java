package com.geoipapi.update;

import javax.annotation.ParametersAreNonnullByDefault;

/**
 * No generation could be made active while starting up. The service cannot
 * answer lookups and should not report itself ready.
 */
@ParametersAreNonnullByDefault
public class StartupException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public StartupException(final String message) {
        super(message);
    }

    public StartupException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
