package com.geoipapi.db;

/**
 * Data section types, in type number order. Numbers 1 to 7 fit in the control
 * byte; the rest are written as {@link #EXTENDED} followed by
 * {@code number - 7}.
 */
enum Type {
    EXTENDED, POINTER, UTF8_STRING, DOUBLE, BYTES, UINT16, UINT32, MAP, INT32, UINT64, UINT128, ARRAY, CONTAINER, END_MARKER, BOOLEAN, FLOAT;

    // values() clones the array on every call.
    static final Type[] values = Type.values();

    static final int FIRST_EXTENDED = 8;

    static Type get(int i) throws InvalidDatabaseException {
        if (i < 0 || i >= Type.values.length) {
            throw new InvalidDatabaseException(
                "The database's data section contains bad data: unknown type number " + i);
        }
        return Type.values[i];
    }

    static Type fromControlByte(int b) throws InvalidDatabaseException {
        // The type is encoded in the top 3 bits of the byte.
        return Type.get((0xFF & b) >>> 5);
    }

    static Type fromExtendedByte(int b) throws InvalidDatabaseException {
        int typeNum = (0xFF & b) + 7;
        if (typeNum < FIRST_EXTENDED) {
            throw new InvalidDatabaseException(
                "The database's data section contains bad data: an extended type "
                    + "resolved to a type number < 8 (" + typeNum + ")");
        }
        return Type.get(typeNum);
    }

    int number() {
        return ordinal();
    }

    boolean isExtended() {
        return ordinal() >= FIRST_EXTENDED;
    }

    /**
     * @return the largest payload, in bytes, a value of this type may declare;
     *         -1 when any size is acceptable
     */
    int maxPayloadSize() {
        return switch (this) {
            case UINT16 -> 2;
            case UINT32, INT32 -> 4;
            case UINT64 -> 8;
            case UINT128 -> 16;
            default -> -1;
        };
    }
}
