package com.geoipapi.lookup;

/**
 * No generation is active yet.
 */
public class DatabaseUnavailableException extends Exception {
    private static final long serialVersionUID = 1L;

    public DatabaseUnavailableException() {
        super("No GeoIP database is loaded yet.");
    }
}
