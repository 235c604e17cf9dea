package com.geoipapi.config;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.ParametersAreNonnullByDefault;

@ParametersAreNonnullByDefault
public final class ServerConfiguration {

    public final String host;
    public final int port;
    public final ImmutableList<String> allowedHosts;
    public final Optional<String> apiKey;
    public final Duration shutdownTimeout;

    ServerConfiguration(final String host,
                        final int port,
                        final ImmutableList<String> allowedHosts,
                        final Optional<String> apiKey,
                        final Duration shutdownTimeout) {
        this.host = Objects.requireNonNull(host);
        this.port = port;
        this.allowedHosts = Objects.requireNonNull(allowedHosts);
        this.apiKey = Objects.requireNonNull(apiKey);
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("host", host)
                .add("port", port)
                .add("allowedHosts", allowedHosts)
                .add("apiKey", apiKey.map(k -> "<set>").orElse("<none>"))
                .add("shutdownTimeout", shutdownTimeout)
                .toString();
    }
}
