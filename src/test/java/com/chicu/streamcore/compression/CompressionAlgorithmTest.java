package com.chicu.streamcore.compression;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CompressionAlgorithmTest {

    private static byte[] repetitiveJson() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < 500; i++) {
            sb.append("{\"eventType\":\"order_placed\",\"aggregateId\":\"wallet:abc\",\"sequence\":").append(i).append("},");
        }
        sb.append("{}]");
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @EnumSource(CompressionAlgorithm.class)
    void compress_shouldShrinkRepetitiveData_andRestoreIt(CompressionAlgorithm algorithm) throws IOException {
        byte[] original = repetitiveJson();

        byte[] packed = algorithm.compress(original, 3);

        assertTrue(packed.length < original.length / 4, "повторяющийся JSON должен сжиматься в разы");
        assertArrayEquals(original, algorithm.decompress(packed));
    }

    @Test
    void compress_shouldClampLevelOutOfRange() throws IOException {
        byte[] original = repetitiveJson();

        byte[] low = CompressionAlgorithm.DEFLATE.compress(original, 0);
        byte[] high = CompressionAlgorithm.DEFLATE.compress(original, 42);

        assertArrayEquals(original, CompressionAlgorithm.DEFLATE.decompress(low));
        assertArrayEquals(original, CompressionAlgorithm.DEFLATE.decompress(high));
    }

    @Test
    void decompress_shouldFailOnGarbage() {
        byte[] garbage = "not compressed at all".getBytes(StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> CompressionAlgorithm.GZIP.decompress(garbage));
        assertThrows(IOException.class, () -> CompressionAlgorithm.DEFLATE.decompress(garbage));
    }

    @Test
    void emptyInput_shouldRoundTrip() throws IOException {
        for (CompressionAlgorithm a : CompressionAlgorithm.values()) {
            assertEquals(0, a.decompress(a.compress(new byte[0], 5)).length, a.name());
        }
    }
}
