package com.ngramengine.memory;

/**
 * 内存压力分级，按使用率单调递增排列。
 */
public enum PressureTier {
    LOW(1.0),
    MEDIUM(0.8),
    HIGH(0.6),
    CRITICAL(0.4);

    private final double chunkFactor;

    PressureTier(double chunkFactor) {
        this.chunkFactor = chunkFactor;
    }

    /**
     * 该压力级别下的分块缩放系数。
     */
    public double chunkFactor() {
        return chunkFactor;
    }

    public boolean isAtLeast(PressureTier other) {
        return compareTo(other) >= 0;
    }
}
