package com.geoipapi.server;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import java.util.Objects;
import javax.annotation.ParametersAreNonnullByDefault;

@ParametersAreNonnullByDefault
final class AllowedMethodsHandler implements HttpHandler {

    private final ImmutableSet<HttpString> allowedMethods;
    private final HttpHandler next;
    private final String allowedMethodHeader;

    AllowedMethodsHandler(final HttpHandler next, final HttpString... allowedMethods) {
        this.allowedMethods = ImmutableSet.copyOf(allowedMethods);
        this.next = Objects.requireNonNull(next);
        this.allowedMethodHeader = Joiner.on(", ").join(this.allowedMethods);
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) throws Exception {
        final HttpString requestMethod = exchange.getRequestMethod();
        if (allowedMethods.contains(requestMethod)) {
            next.handleRequest(exchange);
        } else {
            exchange.getResponseHeaders().put(Headers.ALLOW, allowedMethodHeader);
            JsonResponses.error(exchange, StatusCodes.METHOD_NOT_ALLOWED,
                                "HTTP method " + requestMethod + " not allowed.");
        }
    }
}
