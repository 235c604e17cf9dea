package com.geoipapi.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetAddress;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class PointerTest {

    @SuppressWarnings("static-method")
    @Test
    public void testPointerSizes() throws IOException {
        // One offset per pointer encoding: 1, 2 and 3 bytes after the control byte.
        for (long target : new long[] {5, 2047, 3017, (1 << 19) + (1 << 11) - 1, (1 << 19) + (1 << 11) + 5}) {
            var encoder = new DatabaseWriter.DataEncoder(false);
            encoder.writePointer(target);
            var bytes = new byte[(int) target + 8];
            var pointer = encoder.toByteArray();
            System.arraycopy(pointer, 0, bytes, 0, pointer.length);
            // "hit" at the target offset.
            bytes[(int) target] = 0x43;
            bytes[(int) target + 1] = 'h';
            bytes[(int) target + 2] = 'i';
            bytes[(int) target + 3] = 't';

            var decoder = new Decoder(Buffer.wrap(bytes), 0);
            assertEquals("hit", decoder.decode(0).textValue(), "pointer to " + target);
        }
    }

    @SuppressWarnings("static-method")
    @Test
    public void testFourBytePointer() throws IOException {
        long packed = (1L << 27) + (1 << 19) + (1 << 11) + 100;
        var encoder = new DatabaseWriter.DataEncoder(false);
        encoder.writePointer(packed);
        encoder.write("far");

        // A pointer base below zero brings the target back into this small buffer.
        var decoder = new Decoder(Buffer.wrap(encoder.toByteArray()), 5 - packed);
        assertEquals("far", decoder.decode(0).textValue());
    }

    @SuppressWarnings("static-method")
    @Test
    public void testPointerBaseIsDataSection() throws IOException {
        // Pointers in the data section are relative to its start, not to the file.
        var prefix = new byte[32];
        var encoder = new DatabaseWriter.DataEncoder(false);
        encoder.write("target");
        long pointerAt = encoder.size();
        encoder.writePointer(0);
        var data = encoder.toByteArray();
        var bytes = new byte[prefix.length + data.length];
        System.arraycopy(data, 0, bytes, prefix.length, data.length);

        var decoder = new Decoder(Buffer.wrap(bytes), prefix.length);
        assertEquals("target", decoder.decode(prefix.length + pointerAt).textValue());
    }

    @SuppressWarnings("static-method")
    @Test
    public void testMapKeysThroughPointers() throws IOException {
        var record = Map.of("long_key", "long_value1", "long_key2", "long_value2");
        var other = Map.of("long_key", "long_value2", "long_key2", "long_value1");
        var withPointers = new DatabaseWriter(4, 24).pointerKeys()
            .insert("1.0.0.0/8", record)
            .insert("2.0.0.0/8", other)
            .build();
        var withoutPointers = new DatabaseWriter(4, 24)
            .insert("1.0.0.0/8", record)
            .insert("2.0.0.0/8", other)
            .build();
        assertTrue(withPointers.length < withoutPointers.length);

        try (var reader = new Reader(withPointers, "pointers")) {
            var first = reader.getRecord(InetAddress.getByName("1.2.3.4")).data();
            assertEquals("long_value1", first.get("long_key").textValue());
            assertEquals("long_value2", first.get("long_key2").textValue());

            var second = reader.getRecord(InetAddress.getByName("2.2.3.4")).data();
            assertEquals("long_value2", second.get("long_key").textValue());
            assertEquals("long_value1", second.get("long_key2").textValue());
        }
    }
}
