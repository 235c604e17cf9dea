package com.geoipapi.config;

import com.geoipapi.db.Reader;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.net.InetAddresses;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import java.net.InetAddress;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Container for a validated configuration loaded from a {@code Config}
 * instance. The {@link GeoIpConfiguration} is only available through
 * {@link #configuration()} when {@link #isValid()}; otherwise
 * {@link #errors()} lists every problem found, so they can all be reported at
 * once.
 */
@ParametersAreNonnullByDefault
public final class ValidatedConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(ValidatedConfiguration.class);

    static final String ROOT = "geoip";

    private static final Splitter HOST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final ImmutableList<String> configurationErrors;
    private final Optional<GeoIpConfiguration> geoIpConfiguration;

    /**
     * Loads and validates a configuration. Exceptions thrown while the
     * supplier loads the {@code Config} are reported as errors.
     *
     * @param configLoader supplier of the underlying {@code Config} instance
     */
    public ValidatedConfiguration(final Supplier<Config> configLoader) {
        final ImmutableList.Builder<String> errors = ImmutableList.builder();

        GeoIpConfiguration configuration;
        try {
            final Config config = configLoader.get().resolve().getConfig(ROOT);
            final Fields fields = new Fields(config, errors);
            configuration = new GeoIpConfiguration(server(fields), database(fields));
            if (fields.failed) {
                configuration = null;
            }
        } catch (final ConfigException e) {
            logger.debug("Configuration error caught during validation.", e);
            errors.add(e.getMessage());
            configuration = null;
        }

        this.configurationErrors = errors.build();
        this.geoIpConfiguration = Optional.ofNullable(configuration);
    }

    private static ServerConfiguration server(final Fields fields) {
        final String host = fields.string("server.host", "0.0.0.0");
        final int port = fields.integer("server.port", 0);
        fields.check("server.port", port >= 0 && port <= 65535, "must be a TCP port number", port);

        final ImmutableList<String> allowedHosts = HOST_SPLITTER
                .splitToStream(fields.string("server.allowed-hosts", ""))
                .map(h -> h.toLowerCase(Locale.ROOT))
                .collect(ImmutableList.toImmutableList());
        fields.check("server.allowed-hosts", !allowedHosts.isEmpty(), "must name at least one host", allowedHosts);

        final Optional<String> apiKey = fields.optionalString("server.api-key")
                                              .filter(k -> !Strings.isNullOrEmpty(k));
        final Duration shutdownTimeout = fields.duration("server.shutdown-timeout", Duration.ZERO);
        fields.check("server.shutdown-timeout", !shutdownTimeout.isNegative(), "must not be negative", shutdownTimeout);

        return new ServerConfiguration(host, port, allowedHosts, apiKey, shutdownTimeout);
    }

    private static DatabaseConfiguration database(final Fields fields) {
        final Path dataDir = Paths.get(fields.string("database.data-dir", "."));

        final String url = fields.string("database.url", "");
        fields.check("database.url", isHttpUrl(url), "must be an http or https URL", url);

        final String filePrefix = fields.string("database.file-prefix", "geoip");
        fields.check("database.file-prefix", filePrefix.matches("[A-Za-z0-9_.-]+"),
                     "may only contain letters, digits, '.', '_' and '-'", filePrefix);

        final int retained = fields.integer("database.retained-generations", 1);
        fields.check("database.retained-generations", retained >= 1, "must be at least 1", retained);

        final Duration interval = fields.duration("database.interval", Duration.ofDays(1));
        fields.check("database.interval", isPositive(interval), "must be positive", interval);

        final Duration downloadTimeout = fields.duration("database.download-timeout", Duration.ofMinutes(5));
        fields.check("database.download-timeout", isPositive(downloadTimeout), "must be positive", downloadTimeout);

        final long minFileSize = fields.bytes("database.min-file-size", 1);
        fields.check("database.min-file-size", minFileSize > 0, "must be positive", minFileSize);

        final double minSizeRatio = fields.fraction("database.min-size-ratio", 0);
        fields.check("database.min-size-ratio", minSizeRatio >= 0 && minSizeRatio <= 1,
                     "must be between 0 and 1", minSizeRatio);

        final int startupAttempts = fields.integer("database.startup-attempts", 1);
        fields.check("database.startup-attempts", startupAttempts >= 1, "must be at least 1", startupAttempts);

        final Duration startupBackoff = fields.duration("database.startup-backoff", Duration.ZERO);
        fields.check("database.startup-backoff", !startupBackoff.isNegative(), "must not be negative", startupBackoff);

        final Duration maxStartupBackoff = fields.duration("database.max-startup-backoff", startupBackoff);
        fields.check("database.max-startup-backoff", maxStartupBackoff.compareTo(startupBackoff) >= 0,
                     "must not be less than startup-backoff", maxStartupBackoff);

        final Reader.FileMode fileMode = fields.fileMode("database.file-mode");
        final InetAddress probeAddress = fields.address("database.probe-address");

        return new DatabaseConfiguration(dataDir, url, filePrefix, retained, interval, downloadTimeout,
                                         minFileSize, minSizeRatio, startupAttempts, startupBackoff,
                                         maxStartupBackoff, fileMode, probeAddress);
    }

    private static boolean isPositive(final Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    private static boolean isHttpUrl(final String url) {
        try {
            // The date placeholders are not valid URI characters.
            final URI uri = URI.create(url.replace("{year}", "2000").replace("{month}", "01"));
            return ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
                    && null != uri.getHost();
        } catch (final IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Reads typed values, turning each failure into an error message and a
     * placeholder so that the remaining properties are still checked.
     */
    private static final class Fields {
        private final Config config;
        private final ImmutableList.Builder<String> errors;
        private boolean failed;

        Fields(final Config config, final ImmutableList.Builder<String> errors) {
            this.config = config;
            this.errors = errors;
        }

        void check(final String path, final boolean valid, final String requirement, @Nullable final Object value) {
            if (!valid) {
                error(String.format("Property '%s.%s' %s. Found: '%s'.", ROOT, path, requirement, value));
            }
        }

        private void error(final String message) {
            errors.add(message);
            failed = true;
        }

        String string(final String path, final String placeholder) {
            try {
                return config.getString(path);
            } catch (final ConfigException e) {
                error(e.getMessage());
                return placeholder;
            }
        }

        Optional<String> optionalString(final String path) {
            return config.hasPath(path) ? Optional.of(string(path, "")) : Optional.empty();
        }

        int integer(final String path, final int placeholder) {
            try {
                return config.getInt(path);
            } catch (final ConfigException e) {
                error(e.getMessage());
                return placeholder;
            }
        }

        double fraction(final String path, final double placeholder) {
            try {
                return config.getDouble(path);
            } catch (final ConfigException e) {
                error(e.getMessage());
                return placeholder;
            }
        }

        long bytes(final String path, final long placeholder) {
            try {
                return config.getBytes(path);
            } catch (final ConfigException e) {
                error(e.getMessage());
                return placeholder;
            }
        }

        Duration duration(final String path, final Duration placeholder) {
            try {
                return config.getDuration(path);
            } catch (final ConfigException e) {
                error(e.getMessage());
                return placeholder;
            }
        }

        Reader.FileMode fileMode(final String path) {
            try {
                return config.getEnum(Reader.FileMode.class, path);
            } catch (final ConfigException e) {
                error(e.getMessage());
                return Reader.FileMode.MEMORY;
            }
        }

        InetAddress address(final String path) {
            final String text = string(path, "1.1.1.1");
            try {
                return InetAddresses.forString(text);
            } catch (final IllegalArgumentException e) {
                check(path, false, "must be an IP address literal", text);
                return InetAddresses.forString("1.1.1.1");
            }
        }
    }

    /**
     * Returns the validated configuration.
     *
     * @return the validated configuration
     * @throws IllegalStateException if validation errors exist
     */
    public GeoIpConfiguration configuration() {
        Preconditions.checkState(configurationErrors.isEmpty(),
                                 "Attempt to access invalid configuration.");
        return geoIpConfiguration.orElseThrow(() -> new IllegalStateException("Configuration not available."));
    }

    public List<String> errors() {
        return configurationErrors;
    }

    public boolean isValid() {
        return configurationErrors.isEmpty();
    }
}
