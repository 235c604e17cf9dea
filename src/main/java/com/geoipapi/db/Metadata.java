package com.geoipapi.db;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code Metadata} holds data associated with the database itself.
 *
 * @param binaryFormatMajorVersion The major version number for the database's
 *                                 binary format.
 * @param binaryFormatMinorVersion The minor version number for the database's
 *                                 binary format.
 * @param buildEpoch               Seconds since the epoch at which the database
 *                                 was built. Generations are named and ordered
 *                                 by it.
 * @param databaseType             A string that indicates the structure of each
 *                                 data record associated with an IP address.
 * @param languages                List of languages supported by the database.
 * @param description              Map from language code to description in that
 *                                 language.
 * @param ipVersion                4 for an IPv4 only tree, 6 for a dual stack
 *                                 tree.
 * @param nodeCount                The number of nodes in the search tree.
 * @param recordSize               The number of bits in a record in the search
 *                                 tree. Note that each node consists of two
 *                                 records.
 */
public record Metadata(
        int binaryFormatMajorVersion,
        int binaryFormatMinorVersion,
        BigInteger buildEpoch,
        String databaseType,
        List<String> languages,
        Map<String, String> description,
        int ipVersion,
        long nodeCount,
        int recordSize
) {
    /**
     * The only binary format major version this reader understands.
     */
    public static final int SUPPORTED_MAJOR_VERSION = 2;

    static final int DATA_SECTION_SEPARATOR_SIZE = 16;

    /**
     * Builds metadata from the decoded metadata map, checking that the
     * fields the reader depends on are present and sane.
     *
     * @param node the decoded metadata map
     * @return the metadata
     * @throws InvalidDatabaseException if a required field is missing or invalid
     */
    static Metadata fromNode(JsonNode node) throws InvalidDatabaseException {
        if (!node.isObject()) {
            throw new InvalidDatabaseException("The database's metadata is not a map.");
        }
        int majorVersion = (int) requireInteger(node, "binary_format_major_version");
        if (majorVersion != SUPPORTED_MAJOR_VERSION) {
            throw new InvalidDatabaseException("Unsupported binary format major version "
                + majorVersion + "; only version " + SUPPORTED_MAJOR_VERSION + " is supported.");
        }
        int minorVersion = node.path("binary_format_minor_version").asInt(0);

        JsonNode buildEpoch = node.get("build_epoch");
        if (buildEpoch == null || !buildEpoch.isIntegralNumber()) {
            throw missing("build_epoch");
        }

        int ipVersion = (int) requireInteger(node, "ip_version");
        if (ipVersion != 4 && ipVersion != 6) {
            throw new InvalidDatabaseException("Unknown ip_version in metadata: " + ipVersion);
        }

        long nodeCount = requireInteger(node, "node_count");
        if (nodeCount <= 0) {
            throw new InvalidDatabaseException("Invalid node_count in metadata: " + nodeCount);
        }

        int recordSize = (int) requireInteger(node, "record_size");
        if (recordSize != 24 && recordSize != 28 && recordSize != 32) {
            throw new InvalidDatabaseException("Unknown record_size in metadata: " + recordSize);
        }

        var languages = new ArrayList<String>();
        for (JsonNode language : node.path("languages")) {
            languages.add(language.asText());
        }
        var description = new LinkedHashMap<String, String>();
        node.path("description").fields()
            .forEachRemaining(e -> description.put(e.getKey(), e.getValue().asText()));

        return new Metadata(
            majorVersion,
            minorVersion,
            buildEpoch.bigIntegerValue(),
            node.path("database_type").asText(""),
            Collections.unmodifiableList(languages),
            Collections.unmodifiableMap(description),
            ipVersion,
            nodeCount,
            recordSize);
    }

    private static long requireInteger(JsonNode node, String field) throws InvalidDatabaseException {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            throw missing(field);
        }
        return value.longValue();
    }

    private static InvalidDatabaseException missing(String field) {
        return new InvalidDatabaseException(
            "The database's metadata is missing the required integer field " + field + ".");
    }

    /**
     * @return the instant the database was built.
     */
    public Instant buildDate() {
        return Instant.ofEpochSecond(buildEpoch.longValue());
    }

    /**
     * @return true if IPv6 addresses can be looked up
     */
    public boolean isDualStack() {
        return ipVersion == 6;
    }

    /**
     * @return the size of one node (two records) in bytes
     */
    public int nodeByteSize() {
        return recordSize / 4;
    }

    /**
     * @return the size of the search tree in bytes
     */
    public long searchTreeSize() {
        return nodeCount * nodeByteSize();
    }

    /**
     * @return the absolute offset of the data section
     */
    public long dataSectionStart() {
        return searchTreeSize() + DATA_SECTION_SEPARATOR_SIZE;
    }
}
