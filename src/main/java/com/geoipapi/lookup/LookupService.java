package com.geoipapi.lookup;

import com.geoipapi.db.DatabaseHandle;
import com.geoipapi.db.DatabaseRecord;
import com.geoipapi.update.ActiveDatabaseSlot;
import com.google.common.net.InetAddresses;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers location queries against whichever generation is active when the
 * query starts. The generation stays readable until the query is done, even
 * if it is swapped out in the meantime.
 */
@ParametersAreNonnullByDefault
public final class LookupService {
    private static final Logger logger = LoggerFactory.getLogger(LookupService.class);

    private final ActiveDatabaseSlot slot;

    public LookupService(final ActiveDatabaseSlot slot) {
        this.slot = slot;
    }

    /**
     * @param ipText an IPv4 or IPv6 literal; host names are not resolved
     * @return the location, or empty if the database has no record for the address
     * @throws InvalidAddressException      if {@code ipText} is not an address literal
     * @throws DatabaseUnavailableException if no generation is active
     * @throws IOException                  if the record could not be decoded
     */
    public Optional<LookupResult> lookup(final String ipText)
            throws InvalidAddressException, DatabaseUnavailableException, IOException {
        final InetAddress address = parse(ipText);
        final Optional<DatabaseHandle.Lease> acquired = slot.acquire();
        if (acquired.isEmpty()) {
            throw new DatabaseUnavailableException();
        }
        try (DatabaseHandle.Lease lease = acquired.get()) {
            final DatabaseRecord record = lease.reader().getRecord(address);
            logger.debug("Looked up {}: prefix /{}, found: {}.", address, record.prefixLength(), record.found());
            return record.found()
                    ? Optional.of(LookupResult.fromRecord(ipText, record.data()))
                    : Optional.empty();
        }
    }

    static InetAddress parse(final String ipText) throws InvalidAddressException {
        try {
            return InetAddresses.forString(ipText);
        } catch (final IllegalArgumentException e) {
            throw new InvalidAddressException(ipText, e);
        }
    }
}
