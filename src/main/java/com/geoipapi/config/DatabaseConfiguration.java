package com.geoipapi.config;

import com.geoipapi.db.Reader;
import com.geoipapi.update.UpdateSettings;
import com.google.common.base.MoreObjects;
import java.net.InetAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.ParametersAreNonnullByDefault;

@ParametersAreNonnullByDefault
public final class DatabaseConfiguration {

    public final Path dataDir;
    public final String url;
    public final String filePrefix;
    public final int retainedGenerations;
    public final Duration interval;
    public final Duration downloadTimeout;
    public final long minFileSize;
    public final double minSizeRatio;
    public final int startupAttempts;
    public final Duration startupBackoff;
    public final Duration maxStartupBackoff;
    public final Reader.FileMode fileMode;
    public final InetAddress probeAddress;

    DatabaseConfiguration(final Path dataDir,
                          final String url,
                          final String filePrefix,
                          final int retainedGenerations,
                          final Duration interval,
                          final Duration downloadTimeout,
                          final long minFileSize,
                          final double minSizeRatio,
                          final int startupAttempts,
                          final Duration startupBackoff,
                          final Duration maxStartupBackoff,
                          final Reader.FileMode fileMode,
                          final InetAddress probeAddress) {
        this.dataDir = Objects.requireNonNull(dataDir);
        this.url = Objects.requireNonNull(url);
        this.filePrefix = Objects.requireNonNull(filePrefix);
        this.retainedGenerations = retainedGenerations;
        this.interval = Objects.requireNonNull(interval);
        this.downloadTimeout = Objects.requireNonNull(downloadTimeout);
        this.minFileSize = minFileSize;
        this.minSizeRatio = minSizeRatio;
        this.startupAttempts = startupAttempts;
        this.startupBackoff = Objects.requireNonNull(startupBackoff);
        this.maxStartupBackoff = Objects.requireNonNull(maxStartupBackoff);
        this.fileMode = Objects.requireNonNull(fileMode);
        this.probeAddress = Objects.requireNonNull(probeAddress);
    }

    public UpdateSettings updateSettings() {
        return new UpdateSettings(interval, startupAttempts, startupBackoff, maxStartupBackoff, fileMode);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("dataDir", dataDir)
                .add("url", url)
                .add("filePrefix", filePrefix)
                .add("retainedGenerations", retainedGenerations)
                .add("interval", interval)
                .add("downloadTimeout", downloadTimeout)
                .add("minFileSize", minFileSize)
                .add("minSizeRatio", minSizeRatio)
                .add("startupAttempts", startupAttempts)
                .add("startupBackoff", startupBackoff)
                .add("maxStartupBackoff", maxStartupBackoff)
                .add("fileMode", fileMode)
                .add("probeAddress", probeAddress.getHostAddress())
                .toString();
    }
}
