package com.geoipapi.server;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Requires a shared API key, presented as {@code Authorization: Bearer <key>},
 * as an {@code X-API-Key} header or as the {@code api_key} query parameter,
 * checked in that order. Missing or wrong keys get {@code 401 Unauthorized}.
 */
@ParametersAreNonnullByDefault
final class ApiKeyHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiKeyHandler.class);

    static final HttpString X_API_KEY = new HttpString("X-API-Key");
    static final String QUERY_PARAMETER = "api_key";
    private static final String BEARER_PREFIX = "Bearer ";

    private final HttpHandler next;
    private final byte[] apiKey;

    ApiKeyHandler(final HttpHandler next, final String apiKey) {
        this.next = Objects.requireNonNull(next);
        this.apiKey = apiKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) throws Exception {
        final Optional<String> presented = presentedKey(exchange);
        if (presented.isPresent()
                && MessageDigest.isEqual(apiKey, presented.get().getBytes(StandardCharsets.UTF_8))) {
            next.handleRequest(exchange);
        } else {
            logger.debug("Rejecting request from {}: {} API key.", exchange.getSourceAddress(),
                         presented.isPresent() ? "wrong" : "no");
            JsonResponses.error(exchange, StatusCodes.UNAUTHORIZED, "Invalid or missing API key");
        }
    }

    static Optional<String> presentedKey(final HttpServerExchange exchange) {
        final String authorization = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (null != authorization && authorization.startsWith(BEARER_PREFIX)) {
            return Optional.of(authorization.substring(BEARER_PREFIX.length()));
        }
        final String header = exchange.getRequestHeaders().getFirst(X_API_KEY);
        if (null != header) {
            return Optional.of(header);
        }
        final Deque<String> parameter = exchange.getQueryParameters().get(QUERY_PARAMETER);
        if (null != parameter && !parameter.isEmpty()) {
            return Optional.of(parameter.getFirst());
        }
        return Optional.empty();
    }
}
