package com.geoipapi.update;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.zip.GZIPInputStream;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads the database with one HTTP(S) GET.
 *
 * <p>The URL is a template: {@code {year}} and {@code {month}} (two digits)
 * are replaced with the current UTC date, which is how monthly vendor
 * releases are named. A URL whose path ends in {@code .gz} is decompressed
 * after it has been downloaded.
 */
@ParametersAreNonnullByDefault
public final class HttpDatabaseSource implements DatabaseSource {
    private static final Logger logger = LoggerFactory.getLogger(HttpDatabaseSource.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    // Ends in .tmp so the retention store's startup cleanup removes leftovers.
    private static final String COMPRESSED_SUFFIX = ".gz.tmp";

    private final String urlTemplate;
    private final Duration timeout;
    private final Clock clock;
    private final HttpClient client;

    public HttpDatabaseSource(final String urlTemplate, final Duration timeout) {
        this(urlTemplate, timeout, Clock.systemUTC());
    }

    HttpDatabaseSource(final String urlTemplate, final Duration timeout, final Clock clock) {
        this.urlTemplate = urlTemplate;
        this.timeout = timeout;
        this.clock = clock;
        this.client = HttpClient.newBuilder()
                                .connectTimeout(CONNECT_TIMEOUT.compareTo(timeout) < 0 ? CONNECT_TIMEOUT : timeout)
                                .followRedirects(HttpClient.Redirect.NORMAL)
                                .build();
    }

    /**
     * @return the URL a fetch made now would request
     */
    public URI currentUri() {
        final ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        final String url = urlTemplate.replace("{year}", String.format("%04d", now.getYear()))
                                      .replace("{month}", String.format("%02d", now.getMonthValue()));
        return URI.create(url);
    }

    /**
     * @return the resolved URL when the template carries a date placeholder
     */
    @Override
    public Optional<String> release() {
        return urlTemplate.contains("{year}") || urlTemplate.contains("{month}")
                ? Optional.of(currentUri().toString())
                : Optional.empty();
    }

    /**
     * Downloads the database. The timeout covers the whole transfer, body
     * included; a compressed body is downloaded next to {@code target} first
     * and then decompressed into it.
     */
    @Override
    public void fetch(final Path target) throws IOException, InterruptedException {
        final URI uri = currentUri();
        logger.info("Downloading database from: {}", uri);
        final HttpRequest request = HttpRequest.newBuilder(uri)
                                               .timeout(timeout)
                                               .header("User-Agent", "geoip-api")
                                               .GET()
                                               .build();
        final boolean compressed = isCompressed(uri);
        final Path download = compressed
                ? target.resolveSibling(target.getFileName() + COMPRESSED_SUFFIX)
                : target;
        try {
            final int status = send(request, download).statusCode();
            if (!isSuccess(status)) {
                throw new DownloadException("Download from " + uri + " failed with status: " + status);
            }
            if (compressed) {
                decompress(uri, download, target);
            }
            logger.info("Downloaded {} bytes from {} to {}.", Files.size(target), uri, target);
        } finally {
            if (compressed) {
                Files.deleteIfExists(download);
            }
        }
    }

    private HttpResponse<Path> send(final HttpRequest request, final Path download)
            throws DownloadException, InterruptedException {
        final URI uri = request.uri();
        // Error bodies are discarded; only a successful body is written.
        final HttpResponse.BodyHandler<Path> handler = info -> isSuccess(info.statusCode())
                ? HttpResponse.BodySubscribers.ofFile(download, StandardOpenOption.CREATE,
                                                      StandardOpenOption.WRITE,
                                                      StandardOpenOption.TRUNCATE_EXISTING)
                : HttpResponse.BodySubscribers.replacing(download);
        final CompletableFuture<HttpResponse<Path>> pending = client.sendAsync(request, handler);
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            pending.cancel(true);
            throw new DownloadException("Timed out after " + timeout + " downloading " + uri, e);
        } catch (final InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new DownloadException("Timed out after " + timeout + " requesting " + uri, cause);
            }
            throw new DownloadException("Request to " + uri + " failed: " + cause.getMessage(), cause);
        }
    }

    private static void decompress(final URI uri, final Path compressed, final Path target) throws DownloadException {
        try (InputStream payload = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(compressed)))) {
            Files.copy(payload, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            throw new DownloadException("Transfer from " + uri + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean isSuccess(final int status) {
        return status >= 200 && status < 300;
    }

    private static boolean isCompressed(final URI uri) {
        final String path = uri.getPath();
        return path != null && path.endsWith(".gz");
    }
}
