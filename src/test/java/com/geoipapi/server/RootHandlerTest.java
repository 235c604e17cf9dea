package com.geoipapi.server;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.geoipapi.config.ServerConfiguration;
import com.geoipapi.config.ValidatedConfiguration;
import com.geoipapi.db.DatabaseHandle;
import com.geoipapi.db.DatabaseWriter;
import com.geoipapi.db.Reader;
import com.geoipapi.lookup.LookupService;
import com.geoipapi.update.ActiveDatabaseSlot;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.ConfigFactory;
import io.undertow.Undertow;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Paths;
import java.util.Map;
import javax.annotation.ParametersAreNonnullByDefault;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@ParametersAreNonnullByDefault
public class RootHandlerTest {
    private final HttpClient client = HttpClient.newHttpClient();
    private final ActiveDatabaseSlot slot = new ActiveDatabaseSlot();
    private final HealthHandler healthHandler = new HealthHandler();

    private Undertow undertow;
    private int port;

    @BeforeEach
    public void activateDatabase() throws IOException {
        final byte[] bytes = DatabaseWriter.cityFixture(24).build();
        slot.swap(new DatabaseHandle(new Reader(bytes, "city"), Paths.get("city.mmdb"), bytes.length, null));
    }

    @AfterEach
    public void stopServer() {
        if (null != undertow) {
            undertow.stop();
        }
        slot.close();
    }

    private static ServerConfiguration serverConfiguration(final Map<String, ?> overrides) {
        return new ValidatedConfiguration(() -> ConfigFactory.parseMap(overrides)
                                                             .withFallback(ConfigFactory.defaultReference()))
                .configuration().server;
    }

    private void startServer(final ServerConfiguration configuration, final LookupService lookupService) {
        undertow = Undertow.builder()
                           .addHttpListener(0, "127.0.0.1")
                           .setHandler(Server.createRootHandler(healthHandler, lookupService, configuration))
                           .build();
        undertow.start();
        port = ((InetSocketAddress) undertow.getListenerInfo().get(0).getAddress()).getPort();
    }

    private void startServer(final Map<String, ?> overrides) {
        startServer(serverConfiguration(overrides), new LookupService(slot));
    }

    private HttpRequest.Builder request(final String path) {
        return HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path));
    }

    private HttpResponse<String> get(final String path) throws IOException, InterruptedException {
        return send(request(path).GET());
    }

    private HttpResponse<String> send(final HttpRequest.Builder request) throws IOException, InterruptedException {
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(final HttpResponse<String> response) throws IOException {
        assertEquals(JsonResponses.CONTENT_TYPE, response.headers().firstValue("Content-Type").orElse(null));
        return JsonResponses.MAPPER.readTree(response.body());
    }

    @Test
    public void shouldLookUpAddress() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1"));

        final HttpResponse<String> response = get("/8.8.8.8");

        assertEquals(200, response.statusCode());
        assertEquals("geoip-api", response.headers().firstValue("Server").orElse(null));
        final JsonNode body = json(response);
        assertEquals("8.8.8.8", body.path("ip").textValue());
        assertEquals("Mountain View", body.path("city").textValue());
        assertEquals("US", body.path("country_code").textValue());
        assertEquals(37.386, body.path("latitude").doubleValue());
        assertEquals(1000, body.path("accuracy_radius").intValue());
    }

    @Test
    public void shouldLookUpIpv6Address() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1"));

        final HttpResponse<String> response = get("/2001:db8::42");

        assertEquals(200, response.statusCode());
        assertEquals("Berlin", json(response).path("city").textValue());
    }

    @Test
    public void shouldOmitAbsentFields() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1"));

        final JsonNode body = json(get("/1.1.1.1"));

        assertEquals("AU", body.path("country_code").textValue());
        assertFalse(body.has("city"));
        assertFalse(body.has("latitude"));
    }

    @Test
    public void shouldReportUnknownAddress() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1"));

        final HttpResponse<String> response = get("/8.8.4.4");

        assertEquals(404, response.statusCode());
        assertEquals("IP address not found in database", json(response).path("error").textValue());
    }

    @Test
    public void shouldRejectInvalidAddress() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1"));

        final HttpResponse<String> response = get("/999.1.1.1");

        assertEquals(400, response.statusCode());
        assertEquals("Invalid IP address: 999.1.1.1", json(response).path("error").textValue());
    }

    @Test
    public void shouldNotFindOtherPaths() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1"));

        assertEquals(404, get("/").statusCode());
        assertEquals(404, get("/8.8.8.8/extra").statusCode());
        assertEquals("Not found", json(get("/8.8.8.8/extra")).path("error").textValue());
    }

    @Test
    public void shouldReportMissingDatabase() throws Exception {
        startServer(serverConfiguration(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1")),
                    new LookupService(new ActiveDatabaseSlot()));

        final HttpResponse<String> response = get("/8.8.8.8");

        assertEquals(503, response.statusCode());
        assertEquals("No GeoIP database is loaded yet.", json(response).path("error").textValue());
    }

    @Test
    public void shouldRejectUnknownHost() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "geoip.example.com"));

        final HttpResponse<String> response = get("/8.8.8.8");

        assertEquals(403, response.statusCode());
        assertEquals("Host not allowed", json(response).path("error").textValue());
    }

    @Test
    public void shouldServeHealthToAnyHost() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "geoip.example.com",
                                    "geoip.server.api-key", "s3cret"));

        final HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertEquals("healthy", json(response).path("status").textValue());
    }

    @Test
    public void shouldReportShutdownInHealth() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1"));
        healthHandler.shutdown();

        final HttpResponse<String> response = get("/health");

        assertEquals(503, response.statusCode());
        assertEquals("shutting down", json(response).path("status").textValue());
    }

    @Test
    public void shouldRequireApiKey() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1",
                                    "geoip.server.api-key", "s3cret"));

        final HttpResponse<String> missing = get("/8.8.8.8");
        assertEquals(401, missing.statusCode());
        assertEquals("Invalid or missing API key", json(missing).path("error").textValue());

        assertEquals(401, send(request("/8.8.8.8").header("X-API-Key", "wrong")).statusCode());
        assertEquals(401, send(request("/8.8.8.8").header("Authorization", "Basic czNjcmV0")).statusCode());
        assertEquals(200, send(request("/8.8.8.8").header("X-API-Key", "s3cret")).statusCode());
        assertEquals(200, send(request("/8.8.8.8").header("Authorization", "Bearer s3cret")).statusCode());
        assertEquals(200, get("/8.8.8.8?api_key=s3cret").statusCode());
    }

    @Test
    public void shouldCheckHostBeforeApiKey() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "geoip.example.com",
                                    "geoip.server.api-key", "s3cret"));

        assertEquals(403, send(request("/8.8.8.8").header("X-API-Key", "s3cret")).statusCode());
    }

    @Test
    public void shouldRejectOtherMethods() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1"));

        final HttpResponse<String> response = send(request("/8.8.8.8").POST(HttpRequest.BodyPublishers.noBody()));

        assertEquals(405, response.statusCode());
        assertThat(response.headers().firstValue("Allow").orElse(""), startsWith("GET"));
    }

    @Test
    public void shouldAnswerHead() throws Exception {
        startServer(ImmutableMap.of("geoip.server.allowed-hosts", "127.0.0.1"));

        final HttpResponse<String> response = send(request("/8.8.8.8")
                .method("HEAD", HttpRequest.BodyPublishers.noBody()));

        assertEquals(200, response.statusCode());
        assertTrue(response.body().isEmpty());
    }
}
