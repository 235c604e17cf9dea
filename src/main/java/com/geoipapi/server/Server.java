package com.geoipapi.server;

import com.geoipapi.config.DatabaseConfiguration;
import com.geoipapi.config.GeoIpConfiguration;
import com.geoipapi.config.ServerConfiguration;
import com.geoipapi.config.ValidatedConfiguration;
import com.geoipapi.lookup.LookupService;
import com.geoipapi.update.ActiveDatabaseSlot;
import com.geoipapi.update.HttpDatabaseSource;
import com.geoipapi.update.RetentionStore;
import com.geoipapi.update.StartupException;
import com.geoipapi.update.UpdateScheduler;
import com.geoipapi.update.Validator;
import com.typesafe.config.ConfigFactory;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.CanonicalPathHandler;
import io.undertow.server.handlers.GracefulShutdownHandler;
import io.undertow.server.handlers.PathHandler;
import io.undertow.server.handlers.SetHeaderHandler;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import java.net.InetSocketAddress;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ParametersAreNonnullByDefault
public final class Server implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(Server.class);

    private final GeoIpConfiguration configuration;
    private final ActiveDatabaseSlot slot;
    private final UpdateScheduler scheduler;
    private final HealthHandler healthHandler;
    private final GracefulShutdownHandler shutdownHandler;
    private final Undertow undertow;

    public Server(final ValidatedConfiguration vc) {
        configuration = vc.configuration();
        final DatabaseConfiguration database = configuration.database;
        final ServerConfiguration server = configuration.server;

        slot = new ActiveDatabaseSlot();
        scheduler = new UpdateScheduler(database.updateSettings(),
                                        new HttpDatabaseSource(database.url, database.downloadTimeout),
                                        new Validator(database.minFileSize, database.minSizeRatio, database.probeAddress),
                                        new RetentionStore(database.dataDir, database.filePrefix, database.retainedGenerations),
                                        slot);

        healthHandler = new HealthHandler();
        shutdownHandler = new GracefulShutdownHandler(
                createRootHandler(healthHandler, new LookupService(slot), server));
        undertow = Undertow.builder()
                           .addHttpListener(server.port, server.host)
                           .setHandler(shutdownHandler)
                           .build();
    }

    /**
     * Builds the routes: {@code /health} is always open; every other path is
     * a lookup behind the host filter and, when a key is configured, the API
     * key check.
     */
    static HttpHandler createRootHandler(final HealthHandler healthHandler,
                                         final LookupService lookupService,
                                         final ServerConfiguration server) {
        HttpHandler lookups = new LookupHandler(lookupService);
        if (server.apiKey.isPresent()) {
            lookups = new ApiKeyHandler(lookups, server.apiKey.get());
        }
        lookups = new HostFilterHandler(lookups, server.allowedHosts);

        final PathHandler pathHandler = new PathHandler()
                .addExactPath("/health", healthHandler)
                .addPrefixPath("/", lookups);
        final HttpHandler headerHandler = new SetHeaderHandler(
                new AllowedMethodsHandler(pathHandler, Methods.GET, Methods.HEAD),
                Headers.SERVER_STRING, "geoip-api");
        return new CanonicalPathHandler(headerHandler);
    }

    /**
     * Activates a database, then starts serving.
     *
     * @throws StartupException if no database could be activated
     */
    @Override
    public void run() {
        scheduler.start();
        logger.info("Starting server on {}:{}", configuration.server.host, configuration.server.port);
        undertow.start();
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown"));
    }

    /**
     * @return the address the listener is bound to; only valid after {@link #run()}
     */
    public InetSocketAddress boundAddress() {
        return (InetSocketAddress) undertow.getListenerInfo().get(0).getAddress();
    }

    public void shutdown() {
        healthHandler.shutdown();
        try {
            logger.info("Stopping HTTP server.");
            shutdownHandler.shutdown();
            shutdownHandler.awaitShutdown(configuration.server.shutdownTimeout.toMillis());
            undertow.stop();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        logger.info("Stopping database updates.");
        scheduler.close();
        slot.close();
    }

    public static void main(final String[] args) {
        final ValidatedConfiguration vc = new ValidatedConfiguration(ConfigFactory::load);
        if (!vc.isValid()) {
            vc.errors().forEach(logger::error);
            logger.error("There are configuration errors. Exiting server.");
            System.exit(1);
        }

        // Tell Undertow to use Slf4J for logging by default.
        if (null == System.getProperty("org.jboss.logging.provider")) {
            System.setProperty("org.jboss.logging.provider", "slf4j");
        }
        logger.info("Using configuration: {}", vc.configuration());
        try {
            new Server(vc).run();
        } catch (final StartupException e) {
            logger.error("Could not load a GeoIP database. Exiting server.", e);
            System.exit(1);
        }
    }
}
