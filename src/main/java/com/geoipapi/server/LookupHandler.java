package com.geoipapi.server;

import com.geoipapi.lookup.DatabaseUnavailableException;
import com.geoipapi.lookup.InvalidAddressException;
import com.geoipapi.lookup.LookupResult;
import com.geoipapi.lookup.LookupService;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves {@code GET /{ip}}.
 */
@ParametersAreNonnullByDefault
final class LookupHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(LookupHandler.class);

    private final LookupService lookupService;

    LookupHandler(final LookupService lookupService) {
        this.lookupService = Objects.requireNonNull(lookupService);
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            // Memory mapped generations may page in from disk.
            exchange.dispatch(this);
            return;
        }

        final String ip = ipFromPath(exchange.getRelativePath());
        if (ip.isEmpty() || ip.indexOf('/') >= 0) {
            JsonResponses.error(exchange, StatusCodes.NOT_FOUND, "Not found");
            return;
        }

        final Optional<LookupResult> result;
        try {
            result = lookupService.lookup(ip);
        } catch (final InvalidAddressException e) {
            JsonResponses.error(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
            return;
        } catch (final DatabaseUnavailableException e) {
            JsonResponses.error(exchange, StatusCodes.SERVICE_UNAVAILABLE, e.getMessage());
            return;
        } catch (final IOException e) {
            logger.error("Lookup of " + ip + " failed.", e);
            JsonResponses.error(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Database lookup failed");
            return;
        }

        if (result.isPresent()) {
            JsonResponses.send(exchange, StatusCodes.OK, result.get());
        } else {
            JsonResponses.error(exchange, StatusCodes.NOT_FOUND, "IP address not found in database");
        }
    }

    private static String ipFromPath(final String relativePath) {
        return relativePath.startsWith("/") ? relativePath.substring(1) : relativePath;
    }
}
