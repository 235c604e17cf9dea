package com.geoipapi.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.FloatNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
 * Decoder for the data section (and the metadata block) of a database.
 *
 * This class CANNOT be shared between threads.
 */
final class Decoder {
    private static final Logger logger = LoggerFactory.getLogger(Decoder.class);

    private static final int[] POINTER_VALUE_OFFSETS = {0, 0, 1 << 11, (1 << 19) + (1 << 11), 0};

    // A pointer resolving to another pointer is already unusual; a chain this
    // long only appears in a corrupt or hostile file.
    static final int MAX_POINTER_CHAIN = 4;

    static final int MAX_DEPTH = 64;

    private final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;

    private final CharsetDecoder utfDecoder = StandardCharsets.UTF_8.newDecoder();

    private final Buffer buffer;

    private final long pointerBase;

    Decoder(Buffer buffer, long pointerBase) {
        this.buffer = buffer;
        this.pointerBase = pointerBase;
    }

    /**
     * Decodes the value starting at {@code offset}.
     *
     * @param offset absolute offset of the control byte
     * @return the decoded value, with every pointer followed
     * @throws InvalidDatabaseException if any part of the value is malformed
     */
    JsonNode decode(long offset) throws InvalidDatabaseException {
        checkOffset(offset);
        this.buffer.position(offset);
        try {
            return decodeValue(0, 0);
        } catch (BufferUnderflowException | IndexOutOfBoundsException | IllegalArgumentException e) {
            throw new InvalidDatabaseException(
                "The database's data section contains bad data: "
                    + "value at offset " + offset + " runs past the end of the database.", e);
        }
    }

    private JsonNode decodeValue(int depth, int pointerChain) throws InvalidDatabaseException {
        if (depth > MAX_DEPTH) {
            throw new InvalidDatabaseException(
                "The database's data section contains bad data: nesting deeper than "
                    + MAX_DEPTH + " levels.");
        }
        var ctrlByte = 0xFF & this.buffer.get();
        var type = Type.fromControlByte(ctrlByte);

        // Pointers are a special case, we don't read the next 'size' bytes, we
        // use the size to determine the length of the pointer and then follow
        // it.
        if (type == Type.POINTER) {
            if (pointerChain >= MAX_POINTER_CHAIN) {
                throw new InvalidDatabaseException(
                    "The database's data section contains bad data: more than "
                        + MAX_POINTER_CHAIN + " consecutive pointers.");
            }
            long pointer = decodePointer(ctrlByte);
            checkOffset(pointer);
            long resume = this.buffer.position();
            this.buffer.position(pointer);
            var value = decodeValue(depth + 1, pointerChain + 1);
            this.buffer.position(resume);
            return value;
        }

        if (type == Type.EXTENDED) {
            type = Type.fromExtendedByte(this.buffer.get());
        }

        int size = decodeSize(ctrlByte);
        if (logger.isTraceEnabled()) {
            logger.trace("Decoding {} of size {} at offset {}", type, size, this.buffer.position());
        }
        return decodeByType(type, size, depth);
    }

    private JsonNode decodeByType(Type type, int size, int depth) throws InvalidDatabaseException {
        int maxSize = type.maxPayloadSize();
        if (maxSize >= 0 && size > maxSize) {
            throw new InvalidDatabaseException(
                "The database's data section contains bad data: " + type
                    + " of size " + size + " (at most " + maxSize + " allowed).");
        }
        switch (type) {
            case MAP:
                return this.decodeMap(size, depth);
            case ARRAY:
                return this.decodeArray(size, depth);
            case BOOLEAN:
                return Decoder.decodeBoolean(size);
            case UTF8_STRING:
                return new TextNode(this.decodeString(size));
            case DOUBLE:
                checkFixedSize(type, size, 8);
                return new DoubleNode(this.buffer.getDouble());
            case FLOAT:
                checkFixedSize(type, size, 4);
                return new FloatNode(this.buffer.getFloat());
            case BYTES:
                return new BinaryNode(this.getByteArray(size));
            case UINT16:
                return IntNode.valueOf((int) this.decodeLong(size));
            case UINT32:
                return LongNode.valueOf(this.decodeLong(size));
            case INT32:
                return IntNode.valueOf(this.decodeInteger(0, size));
            case UINT64:
            case UINT128:
                return new BigIntegerNode(new BigInteger(1, this.getByteArray(size)));
            default:
                throw new InvalidDatabaseException(
                    "The database's data section contains bad data: unexpected type " + type.name());
        }
    }

    private long decodePointer(int ctrlByte) {
        int pointerSize = ((ctrlByte >>> 3) & 0x3) + 1;
        int base = pointerSize == 4 ? 0 : ctrlByte & 0x7;
        long packed = Decoder.decodeLong(this.buffer, base, pointerSize);
        return packed + this.pointerBase + POINTER_VALUE_OFFSETS[pointerSize];
    }

    private int decodeSize(int ctrlByte) {
        int size = ctrlByte & 0x1f;
        if (size < 29) {
            return size;
        }
        return switch (size) {
            case 29 -> 29 + (0xFF & this.buffer.get());
            case 30 -> 285 + this.decodeInteger(0, 2);
            default -> 65821 + this.decodeInteger(0, 3);
        };
    }

    private String decodeString(int size) throws InvalidDatabaseException {
        checkRemaining(size);
        var oldLimit = this.buffer.limit();
        this.buffer.limit(this.buffer.position() + size);
        try {
            return this.buffer.decode(this.utfDecoder);
        } catch (CharacterCodingException e) {
            throw new InvalidDatabaseException(
                "The database's data section contains bad data: invalid UTF-8 string.", e);
        } finally {
            this.buffer.limit(oldLimit);
        }
    }

    private long decodeLong(int size) {
        return Decoder.decodeLong(this.buffer, 0, size);
    }

    static long decodeLong(Buffer buffer, int base, int size) {
        long integer = base;
        for (int i = 0; i < size; i++) {
            integer = (integer << 8) | (buffer.get() & 0xFF);
        }
        return integer;
    }

    private int decodeInteger(int base, int size) {
        int integer = base;
        for (int i = 0; i < size; i++) {
            integer = (integer << 8) | (this.buffer.get() & 0xFF);
        }
        return integer;
    }

    private static BooleanNode decodeBoolean(int size) throws InvalidDatabaseException {
        return switch (size) {
            case 0 -> BooleanNode.FALSE;
            case 1 -> BooleanNode.TRUE;
            default -> throw new InvalidDatabaseException(
                "The database's data section contains bad data: invalid size of boolean: " + size);
        };
    }

    private ArrayNode decodeArray(int size, int depth) throws InvalidDatabaseException {
        var array = this.nodeFactory.arrayNode(Math.min(size, 1024));
        for (int i = 0; i < size; i++) {
            array.add(this.decodeValue(depth + 1, 0));
        }
        return array;
    }

    private ObjectNode decodeMap(int size, int depth) throws InvalidDatabaseException {
        var map = this.nodeFactory.objectNode();
        for (int i = 0; i < size; i++) {
            var key = this.decodeValue(depth + 1, 0);
            if (!key.isTextual()) {
                throw new InvalidDatabaseException(
                    "The database's data section contains bad data: map key is a "
                        + key.getNodeType() + ", not a string.");
            }
            var value = this.decodeValue(depth + 1, 0);
            if (map.replace(key.textValue(), value) != null) {
                throw new InvalidDatabaseException(
                    "The database's data section contains bad data: duplicate map key \""
                        + key.textValue() + "\".");
            }
        }
        return map;
    }

    private byte[] getByteArray(int length) throws InvalidDatabaseException {
        checkRemaining(length);
        var bytes = new byte[length];
        this.buffer.get(bytes);
        return bytes;
    }

    private void checkFixedSize(Type type, int size, int expected) throws InvalidDatabaseException {
        if (size != expected) {
            throw new InvalidDatabaseException(
                "The database's data section contains bad data: invalid size of "
                    + type.name().toLowerCase() + ": " + size);
        }
    }

    private void checkRemaining(int length) throws InvalidDatabaseException {
        if (length > this.buffer.limit() - this.buffer.position()) {
            throw new InvalidDatabaseException(
                "The database's data section contains bad data: a value of " + length
                    + " bytes at offset " + this.buffer.position()
                    + " runs past the end of the database.");
        }
    }

    private void checkOffset(long offset) throws InvalidDatabaseException {
        if (offset < 0 || offset >= this.buffer.capacity()) {
            throw new InvalidDatabaseException(
                "The database's data section contains bad data: "
                    + "pointer larger than the database.");
        }
    }
}
