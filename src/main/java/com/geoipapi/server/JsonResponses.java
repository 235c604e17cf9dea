package com.geoipapi.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.collect.ImmutableMap;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import java.nio.charset.StandardCharsets;
import javax.annotation.ParametersAreNonnullByDefault;

@ParametersAreNonnullByDefault
final class JsonResponses {
    static final String CONTENT_TYPE = "application/json; charset=utf-8";

    static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new Jdk8Module());

    private JsonResponses() {
        // Prevent external instantiation.
    }

    static void send(final HttpServerExchange exchange, final int statusCode, final Object body)
            throws JsonProcessingException {
        final String json = MAPPER.writeValueAsString(body);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE);
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    static void error(final HttpServerExchange exchange, final int statusCode, final String message)
            throws JsonProcessingException {
        send(exchange, statusCode, ImmutableMap.of("error", message));
    }
}
