package com.geoipapi.db;

import java.io.IOException;

/**
 * Signals that a generation was read after its resources were released.
 */
public class ClosedDatabaseException extends IOException {

    private static final long serialVersionUID = -3489254412170284396L;

    ClosedDatabaseException(String name) {
        super("The database " + name + " has been closed.");
    }
}
