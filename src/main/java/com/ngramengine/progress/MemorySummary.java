package com.ngramengine.progress;

import com.ngramengine.memory.MemoryTrend;
import com.ngramengine.memory.PressureTier;

/**
 * 一次运行结束时的内存概况。
 */
public record MemorySummary(
    long peakResidentBytes,
    long budgetBytes,
    PressureTier finalTier,
    MemoryTrend trend,
    int sampleCount
) {
    public double peakResidentMb() {
        return peakResidentBytes / (1024.0 * 1024.0);
    }
}
