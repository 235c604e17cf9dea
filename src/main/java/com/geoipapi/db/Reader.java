package com.geoipapi.db;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.net.InetAddress;
import java.nio.BufferUnderflowException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Instances of this class provide a reader for one database generation. IP
 * addresses can be looked up using the <code>getRecord</code> method.
 *
 * <p>A reader is safe for use by many threads at once.
 */
public final class Reader implements Closeable {
    private static final int IPV4_BITS = 32;
    private static final int IPV4_IN_IPV6_PREFIX = 96;
    private static final byte[] METADATA_START_MARKER = {(byte) 0xAB,
        (byte) 0xCD, (byte) 0xEF, 'M', 'a', 'x', 'M', 'i', 'n', 'd', '.',
        'c', 'o', 'm'};
    // The metadata block is always within this many bytes of the end.
    private static final int METADATA_MAX_SIZE = 128 * 1024;

    private final String name;
    private final long ipV4Start;
    private final long metadataStart;
    private final Metadata metadata;
    private final AtomicReference<BufferHolder> bufferHolderReference;

    /**
     * The file mode to use when opening a database.
     */
    public enum FileMode {
        /**
         * Maps the database to virtual memory.
         */
        MEMORY_MAPPED,
        /**
         * Loads the database onto the heap when the reader is constructed.
         * The file may be deleted afterwards without affecting the reader.
         */
        MEMORY
    }

    /**
     * Constructs a Reader that loads <code>database</code> into memory.
     *
     * @param database the database file to use.
     * @throws IOException if there is an error opening or reading from the
     *                     file, or if it is not a valid database.
     */
    public Reader(File database) throws IOException {
        this(database, FileMode.MEMORY);
    }

    /**
     * Constructs a Reader for <code>database</code>.
     *
     * @param database the database file to use.
     * @param fileMode the mode to open the file with.
     * @throws IOException if there is an error opening or reading from the
     *                     file, or if it is not a valid database.
     */
    public Reader(File database, FileMode fileMode) throws IOException {
        this(new BufferHolder(database, fileMode), database.getName());
    }

    /**
     * Constructs a Reader over an in-memory copy of <code>database</code>.
     *
     * @param database the database bytes.
     * @param name     the name used in error messages.
     * @throws InvalidDatabaseException if the bytes are not a valid database.
     */
    public Reader(byte[] database, String name) throws InvalidDatabaseException {
        this(new BufferHolder(database), name);
    }

    private Reader(BufferHolder bufferHolder, String name) throws InvalidDatabaseException {
        this.name = name;
        this.bufferHolderReference = new AtomicReference<>(bufferHolder);

        Buffer buffer = bufferHolder.get();
        this.metadataStart = this.findMetadataStart(buffer);

        Decoder metadataDecoder = new Decoder(buffer, this.metadataStart);
        this.metadata = Metadata.fromNode(metadataDecoder.decode(this.metadataStart));

        long dataSectionStart = this.metadata.dataSectionStart();
        if (dataSectionStart > this.metadataStart - METADATA_START_MARKER.length) {
            throw new InvalidDatabaseException("The database " + name + " is truncated: the "
                + this.metadata.searchTreeSize() + " byte search tree does not fit before the metadata.");
        }

        this.ipV4Start = this.findIpV4StartNode(buffer);
    }

    /**
     * Looks up <code>ipAddress</code> in the search tree.
     *
     * @param ipAddress the IP address to look up.
     * @return the record for the IP address. If there is no data for the
     *         address, the non-null {@link DatabaseRecord} will still be
     *         returned with {@code null} data.
     * @throws InvalidDatabaseException if the tree or the record is corrupt.
     * @throws ClosedDatabaseException  if the reader has been closed.
     */
    public DatabaseRecord getRecord(InetAddress ipAddress) throws IOException {
        byte[] rawAddress = ipAddress.getAddress();
        int bitLength = rawAddress.length * 8;

        if (bitLength > IPV4_BITS && !this.metadata.isDualStack()) {
            // An IPv6 address can never be in an IPv4 only tree.
            return new DatabaseRecord(null, ipAddress, 0);
        }

        Buffer buffer = this.getBufferHolder().get();
        long nodeCount = this.metadata.nodeCount();
        long record = this.startNode(bitLength);

        int i = 0;
        try {
            for (; i < bitLength && record < nodeCount; i++) {
                int b = 0xFF & rawAddress[i / 8];
                int bit = 1 & (b >> 7 - (i % 8));

                // bit:0 -> left record.
                // bit:1 -> right record.
                record = this.readNode(buffer, record, bit);
            }
        } catch (BufferUnderflowException | IndexOutOfBoundsException | IllegalArgumentException e) {
            throw new InvalidDatabaseException("The database " + this.name
                + "'s search tree is corrupt: node read past the end of the file.", e);
        }

        if (record > nodeCount) {
            // record is a data pointer
            return new DatabaseRecord(this.resolveDataPointer(buffer, record), ipAddress, i);
        }
        // record == nodeCount is an explicit empty record; record < nodeCount
        // means the address bits ran out before a leaf was reached.
        return new DatabaseRecord(null, ipAddress, i);
    }

    BufferHolder getBufferHolder() throws ClosedDatabaseException {
        BufferHolder bufferHolder = this.bufferHolderReference.get();
        if (bufferHolder == null) {
            throw new ClosedDatabaseException(this.name);
        }
        return bufferHolder;
    }

    private long startNode(int bitLength) {
        // Check if we are looking up an IPv4 address in an IPv6 tree. If this
        // is the case, we can skip over the first 96 nodes.
        if (this.metadata.isDualStack() && bitLength == IPV4_BITS) {
            return this.ipV4Start;
        }
        // The first node of the tree is always node 0, at the beginning of the
        // value
        return 0;
    }

    private long findIpV4StartNode(Buffer buffer)
        throws InvalidDatabaseException {
        if (!this.metadata.isDualStack()) {
            return 0;
        }

        long node = 0;
        try {
            for (int i = 0; i < IPV4_IN_IPV6_PREFIX && node < this.metadata.nodeCount(); i++) {
                node = this.readNode(buffer, node, 0);
            }
        } catch (BufferUnderflowException | IndexOutOfBoundsException | IllegalArgumentException e) {
            throw new InvalidDatabaseException("The database " + this.name
                + "'s search tree is corrupt: IPv4 subtree is out of range.", e);
        }
        return node;
    }

    long readNode(Buffer buffer, long nodeNumber, int index)
            throws InvalidDatabaseException {
        // index is the index of the record within the node, which
        // can either be 0 or 1.
        long baseOffset = nodeNumber * this.metadata.nodeByteSize();

        switch (this.metadata.recordSize()) {
            case 24:
                // For a 24 bit record, each record is 3 bytes.
                buffer.position(baseOffset + (long) index * 3);
                return Decoder.decodeLong(buffer, 0, 3);
            case 28:
                int middle = buffer.get(baseOffset + 3);

                if (index == 0) {
                    // The high nibble of the middle byte is the most
                    // significant nibble of the left record.
                    middle = (0xF0 & middle) >>> 4;
                } else {
                    // The low nibble belongs to the right record.
                    middle = 0x0F & middle;
                }
                buffer.position(baseOffset + (long) index * 4);
                return Decoder.decodeLong(buffer, middle, 3);
            case 32:
                buffer.position(baseOffset + (long) index * 4);
                return Decoder.decodeLong(buffer, 0, 4);
            default:
                throw new InvalidDatabaseException("Unknown record size: "
                    + this.metadata.recordSize());
        }
    }

    private ObjectNode resolveDataPointer(Buffer buffer, long pointer)
        throws InvalidDatabaseException {
        long resolved = (pointer - this.metadata.nodeCount())
            + this.metadata.searchTreeSize();

        if (resolved < this.metadata.dataSectionStart() || resolved >= this.metadataStart) {
            throw new InvalidDatabaseException(
                "The database " + this.name + "'s search tree is corrupt: "
                    + "contains pointer outside of the data section.");
        }

        var decoder = new Decoder(buffer, this.metadata.dataSectionStart());
        var value = decoder.decode(resolved);
        if (!value.isObject()) {
            throw new InvalidDatabaseException("The database " + this.name
                + " has a " + value.getNodeType() + " record where a map was expected.");
        }
        return (ObjectNode) value;
    }

    /**
     * Checks that the 16 bytes between the search tree and the data section
     * are zero, as the format requires.
     *
     * @throws InvalidDatabaseException if the separator is not all zeros.
     * @throws ClosedDatabaseException  if the reader has been closed.
     */
    public void verifyDataSectionSeparator() throws IOException {
        Buffer buffer = this.getBufferHolder().get();
        long start = this.metadata.searchTreeSize();
        for (long i = start; i < this.metadata.dataSectionStart(); i++) {
            if (buffer.get(i) != 0) {
                throw new InvalidDatabaseException("The database " + this.name
                    + " has a non-zero byte in the data section separator at offset " + i + ".");
            }
        }
    }

    /*
     * Searches backwards from the end of the file for the metadata marker.
     * Only the last METADATA_MAX_SIZE bytes can hold it.
     */
    private long findMetadataStart(Buffer buffer)
        throws InvalidDatabaseException {
        long fileSize = buffer.capacity();
        long lowest = Math.max(0, fileSize - METADATA_MAX_SIZE);

        FILE:
        for (long end = fileSize; end - METADATA_START_MARKER.length >= lowest; end--) {
            for (int j = 0; j < METADATA_START_MARKER.length; j++) {
                if (buffer.get(end - j - 1) != METADATA_START_MARKER[METADATA_START_MARKER.length - j - 1]) {
                    continue FILE;
                }
            }
            if (end == fileSize) {
                break;
            }
            return end;
        }
        throw new InvalidDatabaseException(
            "Could not find a metadata marker in this file ("
                + this.name + "). Is this a valid MaxMind DB file?");
    }

    /**
     * @return the node a walk for an IPv4 address starts from.
     */
    long getIpv4Start() {
        return this.ipV4Start;
    }

    /**
     * @return the metadata for the database file.
     */
    public Metadata getMetadata() {
        return this.metadata;
    }

    /**
     * @return the name of the database, usually its file name.
     */
    public String getName() {
        return this.name;
    }

    /**
     * Drops the reference to the database bytes. Lookups started afterwards
     * fail with {@link ClosedDatabaseException}.
     */
    @Override
    public void close() {
        this.bufferHolderReference.set(null);
    }
}
