package com.geoipapi.update;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.geoipapi.db.DatabaseWriter;
import com.geoipapi.db.Reader;
import com.google.common.net.InetAddresses;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ValidatorTest {
    @TempDir
    Path tempDir;

    private final Validator validator = new Validator(1, 0.5);

    private Path candidate(byte[] bytes) throws IOException {
        return Files.write(tempDir.resolve("candidate.mmdb.tmp"), bytes);
    }

    @Test
    public void testValidDatabase() throws Exception {
        var file = candidate(DatabaseWriter.cityFixture(28).buildEpoch(1_725_148_800L).build());

        var metadata = validator.validate(file, OptionalLong.empty());

        assertEquals(1_725_148_800L, metadata.buildEpoch().longValueExact());
        assertEquals("Test-City", metadata.databaseType());
        assertTrue(Files.exists(file));
    }

    @Test
    public void testEmptyFile() throws IOException {
        var file = candidate(new byte[0]);
        var ex = assertThrows(ValidationException.class, () -> validator.validate(file, OptionalLong.empty()));
        assertThat(ex.getMessage(), containsString("file is empty"));
        assertEquals(file, ex.getCandidate());
    }

    @Test
    public void testMissingFile() {
        var file = tempDir.resolve("missing.mmdb");
        var ex = assertThrows(ValidationException.class, () -> validator.validate(file, OptionalLong.empty()));
        assertThat(ex.getMessage(), containsString("cannot determine size"));
    }

    @Test
    public void testBelowMinimumSize() throws IOException {
        var file = candidate(DatabaseWriter.cityFixture(24).build());
        var strict = new Validator(1024 * 1024, 0.5);

        var ex = assertThrows(ValidationException.class, () -> strict.validate(file, OptionalLong.empty()));
        assertThat(ex.getMessage(), containsString("at least 1048576 are required"));
    }

    @Test
    public void testShrunkComparedToActive() throws Exception {
        var file = candidate(DatabaseWriter.cityFixture(24).build());
        long size = Files.size(file);

        validator.validate(file, OptionalLong.of(size * 2));
        var ex = assertThrows(ValidationException.class,
            () -> validator.validate(file, OptionalLong.of(size * 2 + 2)));
        assertThat(ex.getMessage(), containsString("less than 50%"));
    }

    @Test
    public void testZeroRatioAcceptsAnySize() throws Exception {
        var file = candidate(DatabaseWriter.cityFixture(24).build());
        new Validator(1, 0).validate(file, OptionalLong.of(Long.MAX_VALUE / 2));
    }

    @Test
    public void testNoMetadata() throws IOException {
        var file = candidate(new byte[4096]);
        var ex = assertThrows(ValidationException.class, () -> validator.validate(file, OptionalLong.empty()));
        assertThat(ex.getMessage(), containsString("metadata"));
    }

    @Test
    public void testTruncatedMetadata() throws IOException {
        var bytes = DatabaseWriter.cityFixture(24).build();
        var file = candidate(Arrays.copyOf(bytes, bytes.length - 20));
        assertThrows(ValidationException.class, () -> validator.validate(file, OptionalLong.empty()));
    }

    @Test
    public void testNonZeroSeparator() throws IOException {
        var bytes = DatabaseWriter.cityFixture(24).build();
        long treeSize;
        try (var reader = new Reader(bytes, "fixture")) {
            treeSize = reader.getMetadata().searchTreeSize();
        }
        bytes[(int) treeSize + 3] = (byte) 0xFF;
        var file = candidate(bytes);

        var ex = assertThrows(ValidationException.class, () -> validator.validate(file, OptionalLong.empty()));
        assertThat(ex.getMessage(), containsString("data section separator"));
    }

    @Test
    public void testIpv6ProbeOnIpv4Database() throws Exception {
        var bytes = new DatabaseWriter(4, 24).insert("1.1.1.0/24", Map.of("country", "AU")).build();
        var file = candidate(bytes);

        var metadata = new Validator(1, 0.5, InetAddresses.forString("2001:db8::1"))
            .validate(file, OptionalLong.empty());
        assertEquals(4, metadata.ipVersion());
    }
}
