package com.geoipapi.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.geoipapi.config.ValidatedConfiguration;
import com.geoipapi.db.DatabaseWriter;
import com.geoipapi.update.StartupException;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.ConfigFactory;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ServerTest {
    @TempDir
    Path dataDir;

    private Optional<Server> server = Optional.empty();

    private Server createServer() {
        final ValidatedConfiguration vc = new ValidatedConfiguration(() -> ConfigFactory.parseMap(ImmutableMap.of(
                "geoip.server.host", "127.0.0.1",
                "geoip.server.port", 0,
                "geoip.server.allowed-hosts", "127.0.0.1",
                "geoip.database.data-dir", dataDir.toString(),
                // Nothing listens here.
                "geoip.database.url", "http://127.0.0.1:9/geoip.mmdb",
                "geoip.database.startup-attempts", 1,
                "geoip.database.download-timeout", "2 seconds",
                "geoip.server.shutdown-timeout", "1 second"))
                .withFallback(ConfigFactory.defaultReference()));
        assertTrue(vc.isValid(), () -> String.join("\n", vc.errors()));
        final Server created = new Server(vc);
        server = Optional.of(created);
        return created;
    }

    @AfterEach
    public void tearDown() {
        server.ifPresent(Server::shutdown);
    }

    @Test
    public void shouldServeDatabaseFromDataDirectory() throws Exception {
        DatabaseWriter.cityFixture(24).writeTo(dataDir.resolve("geoip-1700000000.mmdb"));
        final Server started = createServer();
        started.run();

        final int port = started.boundAddress().getPort();
        final HttpResponse<String> response = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/81.2.69.142")).build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals("London", JsonResponses.MAPPER.readTree(response.body()).path("city").textValue());
        assertTrue(Files.isSymbolicLink(dataDir.resolve("latest.mmdb")));
    }

    @Test
    public void shouldNotStartWithoutDatabase() {
        final Server created = createServer();
        assertThrows(StartupException.class, created::run);
        server = Optional.empty();
    }
}
