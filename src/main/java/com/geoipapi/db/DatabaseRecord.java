package com.geoipapi.db;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.InetAddress;

/**
 * The outcome of walking the search tree for one address.
 *
 * @param data         the decoded record, or {@code null} if the address has no
 *                     data in the database
 * @param address      the address that was looked up
 * @param prefixLength the number of address bits consumed by the walk. For an
 *                     IPv4 address in a dual stack tree this counts the IPv4
 *                     bits only.
 */
public record DatabaseRecord(ObjectNode data, InetAddress address, int prefixLength) {

    /**
     * @return true if the address resolved to a record
     */
    public boolean found() {
        return data != null;
    }
}
