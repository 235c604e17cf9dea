package com.geoipapi.lookup;

import javax.annotation.ParametersAreNonnullByDefault;

/**
 * The text of a lookup request is not an IPv4 or IPv6 literal.
 */
@ParametersAreNonnullByDefault
public class InvalidAddressException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String input;

    public InvalidAddressException(final String input, final Throwable cause) {
        super("Invalid IP address: " + input, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
