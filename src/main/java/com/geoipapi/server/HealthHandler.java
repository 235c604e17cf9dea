package com.geoipapi.server;

import com.google.common.collect.ImmutableMap;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liveness check. Answers without consulting the database, so it works
 * before the first generation is active.
 */
@ParametersAreNonnullByDefault
final class HealthHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(HealthHandler.class);

    private volatile boolean shutdown;

    public void shutdown() {
        this.shutdown = true;
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) throws Exception {
        logger.debug("Health check from {}", exchange.getSourceAddress().getHostString());
        if (shutdown) {
            // Tell load balancers to stop routing here before the listener closes.
            JsonResponses.send(exchange, StatusCodes.SERVICE_UNAVAILABLE, ImmutableMap.of("status", "shutting down"));
        } else {
            JsonResponses.send(exchange, StatusCodes.OK, ImmutableMap.of("status", "healthy"));
        }
    }
}
