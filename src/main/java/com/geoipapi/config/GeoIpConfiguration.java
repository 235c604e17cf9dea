package com.geoipapi.config;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.annotation.ParametersAreNonnullByDefault;

@ParametersAreNonnullByDefault
public final class GeoIpConfiguration {

    public final ServerConfiguration server;
    public final DatabaseConfiguration database;

    GeoIpConfiguration(final ServerConfiguration server, final DatabaseConfiguration database) {
        this.server = Objects.requireNonNull(server);
        this.database = Objects.requireNonNull(database);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("server", server)
                .add("database", database)
                .toString();
    }
}
