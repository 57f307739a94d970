package com.ngramengine.memory;

import java.time.Instant;

/**
 * 单次内存采样结果。
 */
public record MemorySample(
    Instant timestamp,
    long residentBytes,
    long virtualBytes,
    PressureTier pressureTier
) {
    public double residentMb() {
        return residentBytes / (1024.0 * 1024.0);
    }
}
