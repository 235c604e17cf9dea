package com.geoipapi.server;

import com.google.common.collect.ImmutableList;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects requests whose {@code Host} header is not allow-listed with
 * {@code 403 Forbidden}. The port is ignored and names compare case
 * insensitively; an entry starting with {@code *} matches every host that
 * ends with the rest of the entry.
 */
@ParametersAreNonnullByDefault
final class HostFilterHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(HostFilterHandler.class);

    private final HttpHandler next;
    private final ImmutableList<String> allowedHosts;

    HostFilterHandler(final HttpHandler next, final List<String> allowedHosts) {
        this.next = Objects.requireNonNull(next);
        this.allowedHosts = allowedHosts.stream()
                                        .map(h -> h.toLowerCase(Locale.ROOT))
                                        .collect(ImmutableList.toImmutableList());
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) throws Exception {
        final String host = exchange.getRequestHeaders().getFirst(Headers.HOST);
        if (isAllowed(host)) {
            next.handleRequest(exchange);
        } else {
            logger.debug("Rejecting request for host {} from {}.", host, exchange.getSourceAddress());
            JsonResponses.error(exchange, StatusCodes.FORBIDDEN, "Host not allowed");
        }
    }

    boolean isAllowed(@Nullable final String hostHeader) {
        if (null == hostHeader) {
            return false;
        }
        final String host = stripPort(hostHeader).toLowerCase(Locale.ROOT);
        for (final String allowed : allowedHosts) {
            if (allowed.startsWith("*")) {
                if (host.endsWith(allowed.substring(1))) {
                    return true;
                }
            } else if (host.equals(allowed)) {
                return true;
            }
        }
        return false;
    }

    static String stripPort(final String hostHeader) {
        if (hostHeader.startsWith("[")) {
            // Bracketed IPv6 literal, optionally followed by a port.
            final int end = hostHeader.indexOf(']');
            return end < 0 ? hostHeader : hostHeader.substring(0, end + 1);
        }
        final int colon = hostHeader.indexOf(':');
        return colon < 0 ? hostHeader : hostHeader.substring(0, colon);
    }
}
