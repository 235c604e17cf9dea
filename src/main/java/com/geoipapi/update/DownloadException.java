package com.geoipapi.update;

import java.io.IOException;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Fetching a database failed: network error, timeout or an unsuccessful
 * response. The next scheduled update tries again.
 */
@ParametersAreNonnullByDefault
public class DownloadException extends IOException {
    private static final long serialVersionUID = 1L;

    public DownloadException(final String message) {
        super(message);
    }

    public DownloadException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }
}
