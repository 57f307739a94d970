package com.ngramengine.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkSizePolicyTest {

    @ParameterizedTest
    @CsvSource({
        "50000, DEFAULT, LOW, 50000",
        "50000, DEFAULT, MEDIUM, 40000",
        "50000, DEFAULT, HIGH, 30000",
        "50000, DEFAULT, CRITICAL, 20000",
        "50000, NGRAM_GENERATION, LOW, 30000",
        "50000, NGRAM_GENERATION, CRITICAL, 12000",
        "50000, UNIQUE_EXTRACTION, LOW, 60000",
        "10000, NGRAM_GENERATION, CRITICAL, 2400",
        "2000, NGRAM_GENERATION, CRITICAL, 1000",
        "100000, NGRAM_GENERATION, CRITICAL, 24000"
    })
    @DisplayName("有效分块大小 = 基准 × 压力系数 × 操作系数，且不低于下限")
    void testEffectiveSize(int base, OperationKind kind, PressureTier tier, int expected) {
        assertEquals(expected, ChunkSizePolicy.effectiveSize(base, kind, tier));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 500, 1000, 5000, 9999, 10000, 50000, 123457, 1_000_000})
    @DisplayName("压力从 LOW 到 CRITICAL 时分块大小单调不增且不低于下限")
    void testMonotonicAndFloored(int base) {
        for (OperationKind kind : OperationKind.values()) {
            int previous = Integer.MAX_VALUE;
            for (PressureTier tier : PressureTier.values()) {
                int size = ChunkSizePolicy.effectiveSize(base, kind, tier);
                assertTrue(size <= previous, "分块大小应单调不增: base=" + base + ", tier=" + tier);
                assertTrue(size >= Math.max(1000, base / 10), "分块大小不应低于下限: base=" + base);
                previous = size;
            }
        }
    }

    @Test
    @DisplayName("下限为 max(1000, base/10)")
    void testFloor() {
        assertEquals(1000, ChunkSizePolicy.floorFor(5000));
        assertEquals(1000, ChunkSizePolicy.floorFor(10000));
        assertEquals(5000, ChunkSizePolicy.floorFor(50000));
    }

    @Test
    @DisplayName("非正基准大小应抛出异常")
    void testInvalidBase() {
        assertThrows(IllegalArgumentException.class,
            () -> ChunkSizePolicy.effectiveSize(0, OperationKind.DEFAULT, PressureTier.LOW));
    }
}
