package com.geoipapi.update;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import com.geoipapi.db.DatabaseWriter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class HttpDatabaseSourceTest {
    @TempDir
    Path tempDir;

    private final byte[] database = DatabaseWriter.cityFixture(24).build();
    private final CountDownLatch unstall = new CountDownLatch(1);
    private final ExecutorService handlers = Executors.newCachedThreadPool();
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    public void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(handlers);
        server.createContext("/dbip-city-lite-2024-09.mmdb", exchange -> respond(exchange, 200, database));
        server.createContext("/dbip-city-lite-2024-09.mmdb.gz", exchange -> respond(exchange, 200, gzip(database)));
        server.createContext("/broken.mmdb.gz", exchange -> respond(exchange, 200, database));
        server.createContext("/stalled.mmdb", this::stall);
        server.createContext("/stalled.mmdb.gz", this::stall);
        server.createContext("/", exchange -> respond(exchange, 404, new byte[0]));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    public void stopServer() {
        unstall.countDown();
        server.stop(0);
        handlers.shutdownNow();
    }

    /**
     * Promises the whole database but sends only its first bytes.
     */
    private void stall(HttpExchange exchange) throws IOException {
        exchange.sendResponseHeaders(200, database.length);
        OutputStream out = exchange.getResponseBody();
        out.write(database, 0, 10);
        out.flush();
        try {
            unstall.await(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        exchange.close();
    }

    private static void respond(HttpExchange exchange, int status, byte[] body)
        throws IOException {
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private static byte[] gzip(byte[] bytes) throws IOException {
        var out = new ByteArrayOutputStream();
        try (var gzip = new GZIPOutputStream(out)) {
            gzip.write(bytes);
        }
        return out.toByteArray();
    }

    private HttpDatabaseSource source(String path) {
        Clock september = Clock.fixed(Instant.parse("2024-09-14T12:00:00Z"), ZoneId.of("UTC"));
        return new HttpDatabaseSource(baseUrl + path, Duration.ofSeconds(10), september);
    }

    @Test
    public void testCurrentUri() {
        // Late on the last day of the month in UTC-10 is already the next month in UTC.
        Clock clock = Clock.fixed(Instant.parse("2024-12-01T05:00:00Z"), ZoneId.of("Pacific/Honolulu"));
        var source = new HttpDatabaseSource("https://download.db-ip.com/free/dbip-city-lite-{year}-{month}.mmdb.gz",
            Duration.ofMinutes(5), clock);

        assertEquals(URI.create("https://download.db-ip.com/free/dbip-city-lite-2024-12.mmdb.gz"),
            source.currentUri());
    }

    @Test
    public void testFixedUrl() {
        var source = new HttpDatabaseSource("https://example.com/city.mmdb", Duration.ofMinutes(5));
        assertEquals(URI.create("https://example.com/city.mmdb"), source.currentUri());
    }

    @Test
    public void testDownload() throws Exception {
        var target = Files.createFile(tempDir.resolve("candidate.tmp"));

        source("/dbip-city-lite-{year}-{month}.mmdb").fetch(target);

        assertArrayEquals(database, Files.readAllBytes(target));
    }

    @Test
    public void testCompressedDownload() throws Exception {
        var target = Files.createFile(tempDir.resolve("candidate.tmp"));

        source("/dbip-city-lite-{year}-{month}.mmdb.gz").fetch(target);

        assertArrayEquals(database, Files.readAllBytes(target));
    }

    @Test
    public void testNotFound() throws IOException {
        var target = Files.createFile(tempDir.resolve("candidate.tmp"));

        var ex = assertThrows(DownloadException.class, () -> source("/dbip-city-lite-1999-01.mmdb").fetch(target));
        assertThat(ex.getMessage(), containsString("failed with status: 404"));
    }

    @Test
    public void testNotGzip() throws IOException {
        var target = Files.createFile(tempDir.resolve("candidate.tmp"));

        var ex = assertThrows(DownloadException.class, () -> source("/broken.mmdb.gz").fetch(target));
        assertThat(ex.getMessage(), containsString("Transfer from"));
    }

    @Test
    public void testStalledBody() throws IOException {
        var target = Files.createFile(tempDir.resolve("candidate.tmp"));
        var stalled = new HttpDatabaseSource(baseUrl + "/stalled.mmdb", Duration.ofSeconds(1));

        var ex = assertTimeoutPreemptively(Duration.ofSeconds(10),
            () -> assertThrows(DownloadException.class, () -> stalled.fetch(target)));
        assertThat(ex.getMessage(), containsString("Timed out after PT1S"));
    }

    @Test
    public void testStalledCompressedBodyLeavesNoPartialFile() throws IOException {
        var target = Files.createFile(tempDir.resolve("candidate.tmp"));
        var stalled = new HttpDatabaseSource(baseUrl + "/stalled.mmdb.gz", Duration.ofSeconds(1));

        assertTimeoutPreemptively(Duration.ofSeconds(10),
            () -> assertThrows(DownloadException.class, () -> stalled.fetch(target)));
        assertFalse(Files.exists(tempDir.resolve("candidate.tmp.gz.tmp")));
    }

    @Test
    public void testRelease() {
        assertEquals(Optional.of(baseUrl + "/dbip-city-lite-2024-09.mmdb.gz"),
            source("/dbip-city-lite-{year}-{month}.mmdb.gz").release());
        assertEquals(Optional.empty(), source("/city.mmdb").release());
    }

    @Test
    public void testUnreachable() throws IOException {
        var target = Files.createFile(tempDir.resolve("candidate.tmp"));
        var unreachable = source("/dbip-city-lite-2024-09.mmdb");
        server.stop(0);

        assertThrows(DownloadException.class, () -> unreachable.fetch(target));
        // Restarted so the stop in tearDown has something to stop.
        startServer();
    }
}
