package com.geoipapi.update;

import com.geoipapi.db.Metadata;
import com.geoipapi.db.Reader;
import com.google.common.base.Preconditions;
import com.google.common.net.InetAddresses;
import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a downloaded file may become a generation. Checks run in
 * order and stop at the first failure: absolute size floor, size relative to
 * the active generation, metadata block, then a structural probe of the
 * search tree and data section.
 */
@ParametersAreNonnullByDefault
public final class Validator {
    private static final Logger logger = LoggerFactory.getLogger(Validator.class);

    static final InetAddress DEFAULT_PROBE_ADDRESS = InetAddresses.forString("1.1.1.1");

    private final long minFileSize;
    private final double minSizeRatio;
    private final InetAddress probeAddress;

    public Validator(final long minFileSize, final double minSizeRatio) {
        this(minFileSize, minSizeRatio, DEFAULT_PROBE_ADDRESS);
    }

    public Validator(final long minFileSize, final double minSizeRatio, final InetAddress probeAddress) {
        Preconditions.checkArgument(minFileSize > 0, "Minimum file size must be positive: %s", minFileSize);
        Preconditions.checkArgument(minSizeRatio >= 0 && minSizeRatio <= 1,
                                    "Minimum size ratio must be within [0, 1]: %s", minSizeRatio);
        this.minFileSize = minFileSize;
        this.minSizeRatio = minSizeRatio;
        this.probeAddress = probeAddress;
    }

    /**
     * Validates a candidate. The candidate is not modified or removed.
     *
     * @param candidate  the downloaded file
     * @param activeSize the size of the active generation's file, if one is active
     * @return the candidate's metadata
     * @throws ValidationException if any check fails
     */
    public Metadata validate(final Path candidate, final OptionalLong activeSize) throws ValidationException {
        final long size;
        try {
            size = Files.size(candidate);
        } catch (final IOException e) {
            throw new ValidationException(candidate, "cannot determine size", e);
        }
        if (size == 0) {
            throw new ValidationException(candidate, "file is empty");
        }
        if (size < minFileSize) {
            throw new ValidationException(candidate,
                    String.format("file is %d bytes; at least %d are required", size, minFileSize));
        }
        if (activeSize.isPresent()) {
            final long floor = (long) Math.ceil(activeSize.getAsLong() * minSizeRatio);
            if (size < floor) {
                throw new ValidationException(candidate,
                        String.format("file is %d bytes, less than %.0f%% of the active generation's %d bytes",
                                      size, minSizeRatio * 100, activeSize.getAsLong()));
            }
        }

        // The reader parses and checks the metadata block and that the search
        // tree fits in the file.
        try (final Reader reader = new Reader(candidate.toFile(), Reader.FileMode.MEMORY_MAPPED)) {
            final Metadata metadata = reader.getMetadata();
            reader.verifyDataSectionSeparator();
            reader.getRecord(probeAddress(metadata));
            logger.info("Validated database candidate {}: {} bytes, type {}, built {}.",
                        candidate, size, metadata.databaseType(), metadata.buildDate());
            return metadata;
        } catch (final IOException e) {
            throw new ValidationException(candidate, e.getMessage(), e);
        }
    }

    private InetAddress probeAddress(final Metadata metadata) {
        if (!metadata.isDualStack() && probeAddress.getAddress().length > 4) {
            return DEFAULT_PROBE_ADDRESS;
        }
        return probeAddress;
    }
}
